package com.oracle.optmcts.core;

/**
 * The model answered, but not in the shape the caller asked for. Retryable.
 */
public class ModelOutputException extends RuntimeException {

    public ModelOutputException(String message) {
        super(message);
    }

    public ModelOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
