package com.modelmonitor.dto;

public enum CycleOutcome {
    ALREADY_CHECKED,
    INSUFFICIENT_DATA,
    NO_DRIFT,
    DRIFT_DETECTED,
    RETRAINING_SUCCEEDED,
    RETRAINING_DEGRADED,
    RETRAINING_FAILED,
    ROLLED_BACK,
    FAILED,
    CANCELLED
}
