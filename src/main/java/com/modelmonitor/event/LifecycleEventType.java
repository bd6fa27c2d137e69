package com.modelmonitor.event;

public enum LifecycleEventType {
    DRIFT_CHECKED,
    JOB_TRANSITION,
    ALERT_RAISED,
    ALERT_DISMISSED
}
