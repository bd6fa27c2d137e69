package com.modelmonitor.exception;

import lombok.Getter;

@Getter
public abstract class ModelMonitorException extends RuntimeException {
    private final String errorCode;
    protected ModelMonitorException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected ModelMonitorException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
