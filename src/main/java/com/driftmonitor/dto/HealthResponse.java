package com.driftmonitor.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HealthResponse {
    String modelId;
    int healthScore;
    String status;
}
