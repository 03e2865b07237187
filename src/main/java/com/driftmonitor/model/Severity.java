package com.driftmonitor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum Severity {
    LOW(2.0),
    MEDIUM(10.0),
    HIGH(25.0),
    CRITICAL(50.0);

    /** Health points a single finding of this severity costs before decay. */
    private final double healthPenalty;

    public boolean isHigherThan(Severity other) {
        return other == null || compareTo(other) > 0;
    }
}
