package com.modelmonitor.entity;

public enum RetrainingStatus {
    QUEUED,
    RUNNING,
    SUCCESS,
    DEGRADATION_DETECTED,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == DEGRADATION_DETECTED || this == FAILED;
    }
}
