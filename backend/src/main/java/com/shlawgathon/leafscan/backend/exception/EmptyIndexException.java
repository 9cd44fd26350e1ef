package com.shlawgathon.leafscan.backend.exception;

/**
 * Raised when a similarity query runs against a store holding zero records.
 */
public class EmptyIndexException extends LeafScanException {

    public EmptyIndexException(String message) {
        super(message);
    }
}
