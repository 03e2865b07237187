package com.driftmonitor.config;

import com.driftmonitor.model.MetricDefinition;
import com.driftmonitor.model.Severity;
import com.driftmonitor.model.ThresholdRule;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Set;

@Value
@Builder
public class MonitoringSettings {
    @Builder.Default int bufferCapacity = 1000;
    @Builder.Default Duration bufferMaxAge = Duration.ofDays(30);
    @Builder.Default int baselineMinSamples = 30;
    @Builder.Default double significance = 0.05;
    @Builder.Default int minSamples = 10;
    @Builder.Default int windowSize = 50;
    @Builder.Default double psiThreshold = 0.2;
    @Builder.Default int psiBins = 10;
    @Builder.Default Duration healthHalfLife = Duration.ofHours(6);
    @Builder.Default Duration healthWindow = Duration.ofHours(24);
    @Builder.Default Duration defaultCheckInterval = Duration.ofMinutes(15);
    @Builder.Default Set<String> higherIsWorse = Set.of("latency_ms", "error_rate");
    @Builder.Default List<ThresholdRule> thresholds = List.of(
        new ThresholdRule("error_rate", 0.05, Severity.HIGH),
        new ThresholdRule("latency_ms", 100.0, Severity.MEDIUM));
    @Builder.Default Duration thresholdWindow = Duration.ofMinutes(30);

    public static MonitoringSettings defaults() {
        return MonitoringSettings.builder().build();
    }

    public MetricDefinition metricDefinition(String metricName) {
        return new MetricDefinition(metricName, higherIsWorse.contains(metricName));
    }
}
