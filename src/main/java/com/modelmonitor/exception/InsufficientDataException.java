package com.modelmonitor.exception;

public class InsufficientDataException extends ModelMonitorException {
    public InsufficientDataException(String modelKey, String reason) {
        super("INSUFFICIENT_DATA", "Drift check for model '" + modelKey + "' is inconclusive: " + reason);
    }

    public InsufficientDataException(String modelKey, int itemsAnalyzed, int minimum) {
        this(modelKey, itemsAnalyzed + " items analyzed, at least " + minimum + " required");
    }
}
