package com.shlawgathon.leafscan.backend.exception;

/**
 * Raised when a labeled corpus cannot be read as a whole.
 */
public class CorpusAccessException extends LeafScanException {

    public CorpusAccessException(String message) {
        super(message);
    }

    public CorpusAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
