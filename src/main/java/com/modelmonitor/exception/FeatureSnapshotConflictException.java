package com.modelmonitor.exception;

public class FeatureSnapshotConflictException extends ModelMonitorException {
    public FeatureSnapshotConflictException(String modelKey, String version, String existingHash, String newHash) {
        super("FEATURE_SNAPSHOT_CONFLICT",
              "Feature snapshot for model '" + modelKey + "' version '" + version
                  + "' already exists with different content (existing=" + existingHash
                  + ", new=" + newHash + ").");
    }
}
