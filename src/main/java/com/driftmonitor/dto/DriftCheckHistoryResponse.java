package com.driftmonitor.dto;

import com.driftmonitor.entity.DriftCheckRecord;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class DriftCheckHistoryResponse {
    UUID id;
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
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant computedAt;

    public static DriftCheckHistoryResponse from(DriftCheckRecord r) {
        return DriftCheckHistoryResponse.builder()
            .id(r.getId())
            .modelId(r.getModelId())
            .metricName(r.getMetricName())
            .detector(r.getDetector())
            .driftScore(r.getDriftScore())
            .pValue(r.getPValue())
            .drift(r.isDrift())
            .effectSize(r.getEffectSize())
            .degradation(r.getDegradation())
            .sufficientData(r.isSufficientData())
            .computedAt(r.getComputedAt())
            .build();
    }
}
