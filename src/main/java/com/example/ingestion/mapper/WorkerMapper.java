package com.example.ingestion.mapper;

import com.example.ingestion.dto.DeadLetterResponse;
import com.example.ingestion.dto.WorkerStatusResponse;
import com.example.ingestion.service.queue.DeadLetterEntry;
import com.example.ingestion.service.queue.QueueStats;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for queue inspection DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface WorkerMapper {

    DeadLetterResponse toResponse(DeadLetterEntry entry);

    List<DeadLetterResponse> toResponses(List<DeadLetterEntry> entries);

    /**
     * Queue counters only; worker state and task types are filled in by the caller
     */
    @Mapping(target = "state", ignore = true)
    @Mapping(target = "registeredTaskTypes", ignore = true)
    @Mapping(target = "generatedAt", expression = "java(java.time.Instant.now())")
    WorkerStatusResponse toStatusResponse(QueueStats stats);
}
