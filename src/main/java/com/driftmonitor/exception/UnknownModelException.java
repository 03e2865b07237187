package com.driftmonitor.exception;

public class UnknownModelException extends DriftMonitorException {
    public UnknownModelException(String modelId) {
        super("UNKNOWN_MODEL", "Model '" + modelId + "' is not registered for monitoring.");
    }
}
