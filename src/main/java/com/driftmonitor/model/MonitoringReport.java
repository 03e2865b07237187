package com.driftmonitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class MonitoringReport {
    String modelId;
    int periodDays;
    long totalMeasurements;
    List<MetricSummary> metrics;
    List<Alert> alerts;
    int healthScore;
    List<ReportRecommendation> recommendations;
    Instant generatedAt;

    @Value
    @Builder
    public static class MetricSummary {
        String metricName;
        long count;
        Double mean;
        Double stdDev;
        double trend;
    }

    public enum ReportRecommendation {
        RETRAIN_IMMEDIATELY,
        PLAN_RETRAINING_WITHIN_48H,
        REVIEW_METRICS,
        OPERATING_NORMALLY
    }
}
