package com.example.ingestion.domain.repository;

import com.example.ingestion.domain.entity.DocumentLine;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/**
 * Repository for extracted document lines
 */
@Repository
public interface DocumentLineRepository extends JpaRepository<DocumentLine, Long> {

    long countByDocumentId(Long documentId);

    /**
     * Remove lines of a previous extraction attempt
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM DocumentLine l WHERE l.documentId = :documentId")
    int deleteByDocumentId(@Param("documentId") Long documentId);
}
