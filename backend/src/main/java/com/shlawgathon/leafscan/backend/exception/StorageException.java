package com.shlawgathon.leafscan.backend.exception;

/**
 * Raised when the vector store backend fails an upsert or a query. Never retried.
 */
public class StorageException extends LeafScanException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
