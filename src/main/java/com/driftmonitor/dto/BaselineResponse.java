package com.driftmonitor.dto;

import com.driftmonitor.model.Baseline;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class BaselineResponse {
    String modelId;
    String metricName;
    int sampleSize;
    double mean;
    double stdDev;
    double min;
    double max;
    boolean degenerate;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant establishedAt;

    public static BaselineResponse from(Baseline baseline) {
        return BaselineResponse.builder()
            .modelId(baseline.getModelId())
            .metricName(baseline.getMetricName())
            .sampleSize(baseline.size())
            .mean(baseline.getMean())
            .stdDev(baseline.getStdDev())
            .min(baseline.getMin())
            .max(baseline.getMax())
            .degenerate(baseline.isDegenerate())
            .establishedAt(baseline.getEstablishedAt())
            .build();
    }
}
