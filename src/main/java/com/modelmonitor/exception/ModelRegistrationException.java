package com.modelmonitor.exception;

public class ModelRegistrationException extends ModelMonitorException {
    public ModelRegistrationException(String message) {
        super("MODEL_REGISTRATION_ERROR", message);
    }
}
