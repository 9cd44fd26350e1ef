package com.shlawgathon.leafscan.backend.exception;

/**
 * Base type for every failure raised by the diagnosis pipeline.
 */
public class LeafScanException extends RuntimeException {

    public LeafScanException(String message) {
        super(message);
    }

    public LeafScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
