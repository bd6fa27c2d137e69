package com.modelmonitor.exception;

public class TrainingException extends ModelMonitorException {
    public TrainingException(String message) {
        super("TRAINING_FAILED", message);
    }
    public TrainingException(String message, Throwable cause) {
        super("TRAINING_FAILED", message, cause);
    }
}
