package com.modelmonitor.exception;

public class FeatureSnapshotNotFoundException extends ModelMonitorException {
    public FeatureSnapshotNotFoundException(String modelKey, String version) {
        super("FEATURE_SNAPSHOT_NOT_FOUND",
              "No feature snapshot for model '" + modelKey + "' version '" + version + "'.");
    }
}
