package com.leadharvest.scrape.persistence;

public class StorageWriteException extends RuntimeException {
    public StorageWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
