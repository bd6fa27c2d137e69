package com.modelmonitor.exception;

public class RollbackUnavailableException extends ModelMonitorException {
    public RollbackUnavailableException(String modelKey, String activeVersion) {
        super("ROLLBACK_UNAVAILABLE",
              "Model '" + modelKey + "' has no promotion of version '" + activeVersion + "' that can be reverted.");
    }
}
