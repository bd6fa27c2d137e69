package com.modelmonitor.exception;

public class ConcurrencyConflictException extends ModelMonitorException {
    public ConcurrencyConflictException(String modelKey, String message) {
        super("CONCURRENCY_CONFLICT", "Model '" + modelKey + "': " + message);
    }
}
