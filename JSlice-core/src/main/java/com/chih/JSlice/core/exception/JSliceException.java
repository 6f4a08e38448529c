package com.chih.JSlice.core.exception;

/**
 * JSlice 框架根异常
 */
public class JSliceException extends RuntimeException {
    public JSliceException(String message) {
        super(message);
    }

    public JSliceException(String message, Throwable cause) {
        super(message, cause);
    }
}
