package com.driftmonitor.core;

import com.driftmonitor.exception.InsufficientDataException;
import com.driftmonitor.model.Baseline;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class BaselineStore {

    private final String modelId;
    private final int minSamples;
    private final Clock clock;
    private final ConcurrentHashMap<String, Baseline> baselines = new ConcurrentHashMap<>();

    public BaselineStore(String modelId, int minSamples, Clock clock) {
        this.modelId = modelId;
        this.minSamples = minSamples;
        this.clock = clock;
    }

    /**
     * Freezes {@code samples} as the reference for {@code metricName}, replacing any prior
     * baseline wholesale. A rejected call leaves the prior baseline in place.
     */
    public Baseline establish(String metricName, List<Double> samples) {
        List<Double> clean = samples == null ? List.of() : samples.stream()
            .filter(v -> v != null && Double.isFinite(v))
            .toList();
        if (clean.size() < minSamples) {
            throw new InsufficientDataException("Baseline for '" + metricName + "'", clean.size(), minSamples);
        }
        double[] values = clean.stream().mapToDouble(Double::doubleValue).toArray();
        double min = Statistics.min(values);
        double max = Statistics.max(values);
        // a constant window has zero spread even when the summed mean is off by an ulp
        boolean constant = min == max;
        Baseline baseline = Baseline.builder()
            .modelId(modelId)
            .metricName(metricName)
            .samples(clean)
            .mean(constant ? min : Statistics.mean(values))
            .stdDev(constant ? 0.0 : Statistics.stdDev(values))
            .min(min)
            .max(max)
            .establishedAt(clock.instant())
            .build();
        baselines.compute(metricName, (name, prior) -> {
            if (prior != null) {
                log.info("Replacing baseline | model={} | metric={} | priorSize={}", modelId, name, prior.size());
            }
            return baseline;
        });
        log.info("Baseline established | model={} | metric={} | size={} | mean={} | std={}",
                 modelId, metricName, baseline.size(), baseline.getMean(), baseline.getStdDev());
        return baseline;
    }

    public Optional<Baseline> get(String metricName) {
        return Optional.ofNullable(baselines.get(metricName));
    }

    public boolean reset(String metricName) {
        return baselines.remove(metricName) != null;
    }

    public Set<String> metricNames() {
        return Set.copyOf(baselines.keySet());
    }
}
