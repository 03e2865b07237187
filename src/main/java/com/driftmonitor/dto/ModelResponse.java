package com.driftmonitor.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ModelResponse {
    String modelId;
    long checkIntervalMinutes;
    List<String> baselineMetrics;
    List<String> bufferedMetrics;
    int healthScore;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant registeredAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant lastCheckAt;
}
