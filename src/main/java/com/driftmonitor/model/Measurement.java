package com.driftmonitor.model;

import java.time.Instant;

public record Measurement(String modelId, String metricName, double value, Instant timestamp) {}
