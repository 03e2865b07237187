package com.driftmonitor.core;

import com.driftmonitor.model.Measurement;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Rolling windows of recent observations for every metric of one model, bounded by both
 * sample count and sample age.
 */
@Slf4j
public class MetricBuffer {

    private final String modelId;
    private final int capacity;
    private final Duration maxAge;
    private final Clock clock;
    private final ConcurrentHashMap<String, MetricSeries> series = new ConcurrentHashMap<>();

    public MetricBuffer(String modelId, int capacity, Duration maxAge, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be positive: " + capacity);
        }
        this.modelId = modelId;
        this.capacity = capacity;
        this.maxAge = maxAge;
        this.clock = clock;
    }

    public void record(String metricName, double value, Instant timestamp) {
        if (!Double.isFinite(value)) {
            log.debug("Dropping non-finite measurement | model={} | metric={} | value={}", modelId, metricName, value);
            return;
        }
        Instant at = timestamp != null ? timestamp : clock.instant();
        series.computeIfAbsent(metricName, name -> new MetricSeries(modelId, name, capacity))
            .append(value, at, cutoff());
    }

    /** The most recent {@code size} observations, oldest first; empty when nothing was recorded. */
    public List<Measurement> window(String metricName, int size) {
        MetricSeries s = series.get(metricName);
        return s == null ? List.of() : s.latest(size, cutoff());
    }

    public List<Measurement> since(String metricName, Instant from) {
        MetricSeries s = series.get(metricName);
        return s == null ? List.of() : s.since(from, cutoff());
    }

    public int size(String metricName) {
        MetricSeries s = series.get(metricName);
        return s == null ? 0 : s.size();
    }

    public Set<String> metricNames() {
        return Set.copyOf(series.keySet());
    }

    private Instant cutoff() {
        return clock.instant().minus(maxAge);
    }
}
