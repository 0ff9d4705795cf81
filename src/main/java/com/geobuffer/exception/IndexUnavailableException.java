package com.geobuffer.exception;

/**
 * Raised when an analyzer is built without a usable spatial index
 */
public class IndexUnavailableException extends BufferAnalysisException {

    public IndexUnavailableException(String message) {
        super(message);
    }
}
