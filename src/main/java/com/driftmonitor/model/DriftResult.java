package com.driftmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class DriftResult {
    String modelId;
    String metricName;
    String detector;
    double driftScore;
    @JsonProperty("pValue")
    double pValue;
    boolean drift;
    double effectSize;
    double degradation;
    boolean sufficientData;
    boolean degenerateBaseline;
    int baselineSize;
    int currentSize;
    double baselineMean;
    double currentMean;
    Instant computedAt;
}
