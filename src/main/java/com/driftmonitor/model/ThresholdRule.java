package com.driftmonitor.model;

/**
 * Fixed limit on the recent mean of one metric. Which side of the limit is a breach follows the
 * metric's {@link MetricDefinition}.
 */
public record ThresholdRule(String metricName, double limit, Severity severity) {}
