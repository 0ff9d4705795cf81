package com.geobuffer.exception;

/**
 * Raised before any query is issued when the supplied legs cannot be sampled
 */
public class InvalidLegException extends BufferAnalysisException {

    public InvalidLegException(String message) {
        super(message);
    }

    public InvalidLegException(String message, Throwable cause) {
        super(message, cause);
    }
}
