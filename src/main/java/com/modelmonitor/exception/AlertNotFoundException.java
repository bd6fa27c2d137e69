package com.modelmonitor.exception;

import java.util.UUID;

public class AlertNotFoundException extends ModelMonitorException {
    public AlertNotFoundException(UUID alertId) {
        super("ALERT_NOT_FOUND", "Alert with id '" + alertId + "' not found.");
    }
}
