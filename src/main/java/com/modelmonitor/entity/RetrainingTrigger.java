package com.modelmonitor.entity;

public enum RetrainingTrigger {
    DRIFT,
    MANUAL
}
