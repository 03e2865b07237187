package com.driftmonitor.exception;

public class InsufficientDataException extends DriftMonitorException {
    public InsufficientDataException(String what, int size, int required) {
        super("INSUFFICIENT_DATA",
              what + " has " + size + " samples; at least " + required + " are required.");
    }
}
