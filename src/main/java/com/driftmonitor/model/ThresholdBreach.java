package com.driftmonitor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ThresholdBreach {
    String modelId;
    String metricName;
    double observedMean;
    double limit;
    int sampleCount;
    /** Relative distance past the limit in the metric's bad direction; raw distance when the limit is 0. */
    double deviation;
    Severity severity;
    Recommendation recommendation;
    Alert newAlert;
    Instant evaluatedAt;
}
