package com.driftmonitor.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class Alert {
    UUID id;
    String modelId;
    String metricName;
    Severity severity;
    String message;
    Recommendation recommendation;
    double driftScore;
    @JsonProperty("pValue")
    double pValue;
    double degradation;
    AlertStatus status;
    int occurrences;
    Instant createdAt;
    Instant updatedAt;
    Instant acknowledgedAt;
    Instant resolvedAt;
}
