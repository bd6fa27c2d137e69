package com.modelmonitor.exception;

public class PersistenceFailureException extends ModelMonitorException {
    public PersistenceFailureException(String operation, Throwable cause) {
        super("PERSISTENCE_FAILURE",
              "Persistence operation '" + operation + "' failed: " + cause.getMessage(),
              cause);
    }
}
