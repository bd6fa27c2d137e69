package com.modelmonitor.entity;

public enum AlertSeverity {
    INFO,
    WARNING,
    CRITICAL
}
