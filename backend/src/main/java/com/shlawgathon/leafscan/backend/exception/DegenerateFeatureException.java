package com.shlawgathon.leafscan.backend.exception;

/**
 * Raised when feature extraction produces a NaN or infinite value.
 */
public class DegenerateFeatureException extends LeafScanException {

    public DegenerateFeatureException(String message) {
        super(message);
    }
}
