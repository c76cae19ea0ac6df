package com.example.ingestion.exception;

import lombok.Getter;

/**
 * Exception for object storage access failures
 */
@Getter
public class StorageException extends RuntimeException {

    private final String key;

    public StorageException(String key, String message, Throwable cause) {
        super(String.format("Storage access failed for '%s': %s", key, message), cause);
        this.key = key;
    }
}
