package com.webmon.core.retry;

public class RetriesExhaustedException extends RuntimeException {
    private final String operation;
    private final int attempts;

    public RetriesExhaustedException(String operation, int attempts, Exception lastFailure) {
        super(operation + " failed after " + attempts + " attempts: " + lastFailure.getMessage(), lastFailure);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String operation() {
        return operation;
    }

    public int attempts() {
        return attempts;
    }
}
