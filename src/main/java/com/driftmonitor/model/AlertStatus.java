package com.driftmonitor.model;

public enum AlertStatus {
    OPEN,
    ACKNOWLEDGED,
    RESOLVED
}
