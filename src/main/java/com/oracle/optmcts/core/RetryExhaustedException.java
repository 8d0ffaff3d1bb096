package com.oracle.optmcts.core;

import lombok.Getter;

@Getter
public class RetryExhaustedException extends RuntimeException {

    private final String operation;
    private final int attempts;

    public RetryExhaustedException(String operation, int attempts, Throwable lastFailure) {
        super(operation + " failed after " + attempts + " attempt(s)"
                + (lastFailure != null ? ": " + lastFailure.getMessage() : ""), lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }
}
