package com.modelmonitor.entity;

public enum DatasetStatus {
    /** Accumulated and not yet consumed by a retraining attempt. */
    ACTIVE,
    /** Claimed by a running retraining job. */
    PROCESSING,
    /** Consumed by a finished retraining job. */
    ARCHIVED
}
