package com.modelmonitor.exception;

public class ModelNotFoundException extends ModelMonitorException {
    public ModelNotFoundException(String modelKey) {
        super("MODEL_NOT_FOUND", "Model '" + modelKey + "' not found.");
    }
    public ModelNotFoundException(String modelKey, String version) {
        super("MODEL_NOT_FOUND", "Model '" + modelKey + "' has no version '" + version + "'.");
    }
}
