package com.driftmonitor.exception;

import java.util.UUID;

public class AlertNotFoundException extends DriftMonitorException {
    public AlertNotFoundException(UUID alertId) {
        super("ALERT_NOT_FOUND", "Alert with id '" + alertId + "' not found.");
    }
}
