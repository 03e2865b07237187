package com.driftmonitor.model;

/**
 * Direction of "bad" for one metric. Accuracy-style metrics degrade when they fall,
 * latency- and error-style metrics degrade when they rise.
 */
public record MetricDefinition(String name, boolean higherIsWorse) {

    public static MetricDefinition lowerIsWorse(String name) {
        return new MetricDefinition(name, false);
    }
}
