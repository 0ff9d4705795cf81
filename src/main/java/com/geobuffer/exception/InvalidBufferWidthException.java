package com.geobuffer.exception;

/**
 * Raised before any query is issued when the buffer width is not a finite number
 * at or above the minimum width
 */
public class InvalidBufferWidthException extends BufferAnalysisException {

    private final double bufferWidth;

    public InvalidBufferWidthException(double bufferWidth, String message) {
        super(message);
        this.bufferWidth = bufferWidth;
    }

    public double getBufferWidth() {
        return bufferWidth;
    }
}
