package com.geobuffer.exception;

/**
 * Base class of all failures raised by buffer analysis
 */
public class BufferAnalysisException extends RuntimeException {

    public BufferAnalysisException(String message) {
        super(message);
    }

    public BufferAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
