package com.driftmonitor.core;

import com.driftmonitor.config.MonitoringSettings;
import com.driftmonitor.model.DriftResult;
import lombok.Getter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Everything monitored for one model. Contexts share nothing, so work on different models never
 * contends; within a context, checks are serialised per metric.
 */
@Getter
public class MonitoringContext {

    private final String modelId;
    private final MetricBuffer buffer;
    private final BaselineStore baselines;
    private final AlertManager alerts;
    private final HealthScorer health;
    private final Duration checkInterval;
    private final Instant registeredAt;
    private volatile Instant lastCheckAt;

    @Getter(lombok.AccessLevel.NONE)
    private final ConcurrentHashMap<String, ReentrantLock> checkLocks = new ConcurrentHashMap<>();
    @Getter(lombok.AccessLevel.NONE)
    private final ConcurrentHashMap<String, DriftResult> latestResults = new ConcurrentHashMap<>();

    public MonitoringContext(String modelId, Duration checkInterval, MonitoringSettings settings, Clock clock) {
        this.modelId = modelId;
        this.checkInterval = checkInterval;
        this.registeredAt = clock.instant();
        this.buffer = new MetricBuffer(modelId, settings.getBufferCapacity(), settings.getBufferMaxAge(), clock);
        this.baselines = new BaselineStore(modelId, settings.getBaselineMinSamples(), clock);
        this.alerts = new AlertManager(modelId, clock);
        this.health = new HealthScorer(settings.getHealthHalfLife(), settings.getHealthWindow());
    }

    /** Runs {@code check} once any in-flight check on the same metric has finished. */
    public <T> T withCheckLock(String metricName, Supplier<T> check) {
        ReentrantLock lock = lockFor(metricName);
        lock.lock();
        try {
            return check.get();
        } finally {
            lock.unlock();
        }
    }

    /** Runs {@code check} only if no other check holds the metric; empty otherwise. */
    public <T> Optional<T> tryWithCheckLock(String metricName, Supplier<T> check) {
        ReentrantLock lock = lockFor(metricName);
        if (!lock.tryLock()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(check.get());
        } finally {
            lock.unlock();
        }
    }

    public void recordResult(DriftResult result) {
        latestResults.put(result.getMetricName(), result);
    }

    public Optional<DriftResult> latestResult(String metricName) {
        return Optional.ofNullable(latestResults.get(metricName));
    }

    public List<DriftResult> latestResults() {
        Collection<DriftResult> values = latestResults.values();
        return values.stream()
            .sorted(Comparator.comparing(DriftResult::getMetricName))
            .toList();
    }

    public boolean isDue(Instant now) {
        Instant last = lastCheckAt;
        return last == null || !now.isBefore(last.plus(checkInterval));
    }

    public void markChecked(Instant now) {
        this.lastCheckAt = now;
    }

    private ReentrantLock lockFor(String metricName) {
        return checkLocks.computeIfAbsent(metricName, name -> new ReentrantLock());
    }
}
