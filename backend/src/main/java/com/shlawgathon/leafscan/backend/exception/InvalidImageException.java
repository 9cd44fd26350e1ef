package com.shlawgathon.leafscan.backend.exception;

/**
 * Raised when an image is malformed, too small or has fewer than three color channels.
 */
public class InvalidImageException extends LeafScanException {

    public InvalidImageException(String message) {
        super(message);
    }

    public InvalidImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
