package com.example.ingestion.client;

/**
 * Blob store holding uploaded documents.
 */
public interface ObjectStorage {

    /**
     * @throws com.example.ingestion.exception.StorageException when the object cannot be read
     */
    byte[] download(String key);

    /**
     * URL an external service can fetch the object from without credentials
     */
    String publicUrl(String key);
}
