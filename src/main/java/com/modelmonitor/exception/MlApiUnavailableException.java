package com.modelmonitor.exception;

public class MlApiUnavailableException extends ModelMonitorException {
    public MlApiUnavailableException(Throwable cause) {
        super("ML_API_UNAVAILABLE",
              "The ML training service is currently unavailable.",
              cause);
    }
}
