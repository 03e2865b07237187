package com.driftmonitor.exception;

import com.driftmonitor.model.AlertStatus;

import java.util.UUID;

public class AlertStateException extends DriftMonitorException {
    public AlertStateException(UUID alertId, AlertStatus from, AlertStatus to) {
        super("ILLEGAL_ALERT_TRANSITION",
              "Alert '" + alertId + "' cannot move from " + from + " to " + to + ".");
    }
}
