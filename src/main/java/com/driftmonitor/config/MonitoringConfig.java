package com.driftmonitor.config;

import com.driftmonitor.core.DriftDetector;
import com.driftmonitor.core.KolmogorovSmirnovDetector;
import com.driftmonitor.core.MonitoringSink;
import com.driftmonitor.core.PopulationStabilityDetector;
import com.driftmonitor.core.SeverityClassifier;
import com.driftmonitor.core.ThresholdEvaluator;
import com.driftmonitor.model.Severity;
import com.driftmonitor.model.ThresholdRule;
import com.driftmonitor.repository.AlertRecordRepository;
import com.driftmonitor.repository.DriftCheckRepository;
import com.driftmonitor.service.JpaMonitoringSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

@Slf4j
@Configuration
public class MonitoringConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MonitoringSettings monitoringSettings(
            @Value("${monitoring.buffer.capacity:1000}") int bufferCapacity,
            @Value("${monitoring.buffer.max-age:30d}") Duration bufferMaxAge,
            @Value("${monitoring.baseline.min-samples:30}") int baselineMinSamples,
            @Value("${monitoring.drift.significance:0.05}") double significance,
            @Value("${monitoring.drift.min-samples:10}") int minSamples,
            @Value("${monitoring.drift.window-size:50}") int windowSize,
            @Value("${monitoring.drift.psi-threshold:0.2}") double psiThreshold,
            @Value("${monitoring.drift.psi-bins:10}") int psiBins,
            @Value("${monitoring.health.half-life:6h}") Duration healthHalfLife,
            @Value("${monitoring.health.window:24h}") Duration healthWindow,
            @Value("${monitoring.scheduler.default-check-interval:15m}") Duration defaultCheckInterval,
            @Value("${monitoring.metrics.higher-is-worse:latency_ms,error_rate}") String higherIsWorse,
            @Value("${monitoring.metrics.thresholds:error_rate:0.05:HIGH,latency_ms:100:MEDIUM}") String thresholds,
            @Value("${monitoring.metrics.threshold-window:30m}") Duration thresholdWindow) {
        return MonitoringSettings.builder()
            .bufferCapacity(bufferCapacity)
            .bufferMaxAge(bufferMaxAge)
            .baselineMinSamples(baselineMinSamples)
            .significance(significance)
            .minSamples(minSamples)
            .windowSize(windowSize)
            .psiThreshold(psiThreshold)
            .psiBins(psiBins)
            .healthHalfLife(healthHalfLife)
            .healthWindow(healthWindow)
            .defaultCheckInterval(defaultCheckInterval)
            .higherIsWorse(parseNames(higherIsWorse))
            .thresholds(parseThresholds(thresholds))
            .thresholdWindow(thresholdWindow)
            .build();
    }

    @Bean
    public DriftDetector driftDetector(MonitoringSettings settings, Clock clock,
                                       @Value("${monitoring.drift.detector:ks}") String detector) {
        DriftDetector selected = switch (detector.trim().toLowerCase(Locale.ROOT)) {
            case "ks", KolmogorovSmirnovDetector.NAME -> new KolmogorovSmirnovDetector(settings, clock);
            case PopulationStabilityDetector.NAME -> new PopulationStabilityDetector(settings, clock);
            default -> throw new IllegalStateException(
                "Unsupported monitoring.drift.detector '" + detector + "' (expected ks or psi)");
        };
        log.info("Drift detector configured → {}", selected.name());
        return selected;
    }

    @Bean
    public SeverityClassifier severityClassifier() {
        return new SeverityClassifier();
    }

    @Bean
    public ThresholdEvaluator thresholdEvaluator(MonitoringSettings settings, SeverityClassifier classifier,
                                                 Clock clock) {
        return new ThresholdEvaluator(settings.getThresholdWindow(), classifier, clock);
    }

    @Bean
    public MonitoringSink monitoringSink(
            @Value("${monitoring.persistence.enabled:true}") boolean persistenceEnabled,
            DriftCheckRepository driftChecks, AlertRecordRepository alerts) {
        if (!persistenceEnabled) {
            log.info("Persistence disabled, drift results are kept in memory only");
            return MonitoringSink.NOOP;
        }
        return new JpaMonitoringSink(driftChecks, alerts);
    }

    private static Set<String> parseNames(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(v -> !v.isBlank())
            .collect(Collectors.toUnmodifiableSet());
    }

    /** Entries look like {@code metric:limit:SEVERITY}, comma separated. */
    static List<ThresholdRule> parseThresholds(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(v -> !v.isBlank())
            .map(MonitoringConfig::parseThreshold)
            .toList();
    }

    private static ThresholdRule parseThreshold(String entry) {
        String[] parts = entry.split(":");
        if (parts.length != 3 || parts[0].isBlank()) {
            throw new IllegalStateException(
                "Invalid monitoring.metrics.thresholds entry '" + entry + "' (expected metric:limit:SEVERITY)");
        }
        try {
            double limit = Double.parseDouble(parts[1].trim());
            if (!Double.isFinite(limit)) {
                throw new NumberFormatException("not finite");
            }
            Severity severity = Severity.valueOf(parts[2].trim().toUpperCase(Locale.ROOT));
            return new ThresholdRule(parts[0].trim(), limit, severity);
        } catch (IllegalArgumentException ex) {
            throw new IllegalStateException("Invalid monitoring.metrics.thresholds entry '" + entry + "'", ex);
        }
    }
}
