package com.driftmonitor.core;

import com.driftmonitor.exception.AlertNotFoundException;
import com.driftmonitor.exception.AlertStateException;
import com.driftmonitor.model.Alert;
import com.driftmonitor.model.AlertStatus;
import com.driftmonitor.model.Classification;
import com.driftmonitor.model.DriftResult;
import com.driftmonitor.model.Recommendation;
import com.driftmonitor.model.Severity;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Alerts of one model. At most one unresolved alert exists per metric; further findings on that
 * metric fold into it. Resolved alerts stay for history and are never reopened.
 */
@Slf4j
public class AlertManager {

    private final String modelId;
    private final Clock clock;
    private final ConcurrentHashMap<UUID, AlertState> alerts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, UUID> unresolvedByMetric = new ConcurrentHashMap<>();

    public AlertManager(String modelId, Clock clock) {
        this.modelId = modelId;
        this.clock = clock;
    }

    public Evaluation evaluate(DriftResult result, Classification classification) {
        return raise(result.getMetricName(), classification,
                     new Evidence(result.getDriftScore(), result.getPValue(), result.getDegradation()));
    }

    /**
     * Entry point for findings that do not come from a drift detector, such as threshold breaches.
     * They share the per-metric alert with drift findings.
     */
    public Evaluation raise(String metricName, Classification classification, Evidence evidence) {
        Instant now = clock.instant();
        AtomicReference<Evaluation> outcome = new AtomicReference<>();
        unresolvedByMetric.compute(metricName, (metric, existingId) -> {
            AlertState existing = existingId != null ? alerts.get(existingId) : null;
            if (existing != null) {
                Change change = existing.absorb(evidence, classification, now);
                if (change != Change.CREATED) {
                    outcome.set(new Evaluation(existing.toAlert(), change));
                    return existingId;
                }
            }
            AlertState created = new AlertState(UUID.randomUUID(), modelId, metric, evidence, classification, now);
            alerts.put(created.id, created);
            outcome.set(new Evaluation(created.toAlert(), Change.CREATED));
            return created.id;
        });

        Evaluation evaluation = outcome.get();
        Alert alert = evaluation.alert();
        switch (evaluation.change()) {
            case CREATED -> log.info("Alert created | id={} | model={} | metric={} | severity={}",
                                     alert.getId(), modelId, alert.getMetricName(), alert.getSeverity());
            case ESCALATED -> log.warn("Alert escalated | id={} | model={} | metric={} | severity={}",
                                       alert.getId(), modelId, alert.getMetricName(), alert.getSeverity());
            case DEDUPLICATED -> log.debug("Alert deduplicated | id={} | model={} | metric={} | occurrences={}",
                                           alert.getId(), modelId, alert.getMetricName(), alert.getOccurrences());
        }
        return evaluation;
    }

    public Alert acknowledge(UUID alertId) {
        AlertState state = require(alertId);
        Alert alert = state.transition(AlertStatus.ACKNOWLEDGED, clock.instant());
        log.info("Alert acknowledged | id={} | model={} | metric={}", alertId, modelId, alert.getMetricName());
        return alert;
    }

    public Alert resolve(UUID alertId) {
        AlertState state = require(alertId);
        Alert alert = state.transition(AlertStatus.RESOLVED, clock.instant());
        unresolvedByMetric.remove(alert.getMetricName(), alertId);
        log.info("Alert resolved | id={} | model={} | metric={}", alertId, modelId, alert.getMetricName());
        return alert;
    }

    public Optional<Alert> find(UUID alertId) {
        AlertState state = alerts.get(alertId);
        return state == null ? Optional.empty() : Optional.of(state.toAlert());
    }

    /** Alerts newest first, optionally restricted to one status. */
    public List<Alert> list(AlertStatus status) {
        return alerts.values().stream()
            .map(AlertState::toAlert)
            .filter(a -> status == null || a.getStatus() == status)
            .sorted(Comparator.comparing(Alert::getCreatedAt).reversed())
            .toList();
    }

    public List<UUID> alertIds() {
        return List.copyOf(alerts.keySet());
    }

    private AlertState require(UUID alertId) {
        AlertState state = alerts.get(alertId);
        if (state == null) {
            throw new AlertNotFoundException(alertId);
        }
        return state;
    }

    public enum Change {
        CREATED,
        ESCALATED,
        DEDUPLICATED
    }

    public record Evidence(double driftScore, double pValue, double degradation) {}

    public record Evaluation(Alert alert, Change change) {
        public boolean created() {
            return change == Change.CREATED;
        }
    }

    private static final class AlertState {
        private final UUID id;
        private final String modelId;
        private final String metricName;
        private volatile Severity severity;
        private volatile String message;
        private volatile Recommendation recommendation;
        private volatile double driftScore;
        private volatile double pValue;
        private volatile double degradation;
        private volatile AlertStatus status;
        private volatile int occurrences;
        private volatile Instant createdAt;
        private volatile Instant updatedAt;
        private volatile Instant acknowledgedAt;
        private volatile Instant resolvedAt;

        private AlertState(UUID id, String modelId, String metricName,
                           Evidence evidence, Classification classification, Instant now) {
            this.id = id;
            this.modelId = modelId;
            this.metricName = metricName;
            this.status = AlertStatus.OPEN;
            this.occurrences = 1;
            this.createdAt = now;
            this.updatedAt = now;
            apply(evidence, classification);
        }

        /** Folds a repeat finding in; CREATED signals the caller that this alert is already resolved. */
        private synchronized Change absorb(Evidence evidence, Classification classification, Instant now) {
            if (status == AlertStatus.RESOLVED) {
                return Change.CREATED;
            }
            occurrences++;
            updatedAt = now;
            if (classification.severity().isHigherThan(severity)) {
                apply(evidence, classification);
                createdAt = now;
                return Change.ESCALATED;
            }
            return Change.DEDUPLICATED;
        }

        private synchronized Alert transition(AlertStatus target, Instant now) {
            boolean allowed = switch (target) {
                case ACKNOWLEDGED -> status == AlertStatus.OPEN;
                case RESOLVED -> status != AlertStatus.RESOLVED;
                case OPEN -> false;
            };
            if (!allowed) {
                throw new AlertStateException(id, status, target);
            }
            status = target;
            updatedAt = now;
            if (target == AlertStatus.ACKNOWLEDGED) {
                acknowledgedAt = now;
            } else {
                resolvedAt = now;
            }
            return toAlert();
        }

        private void apply(Evidence evidence, Classification classification) {
            this.severity = classification.severity();
            this.message = classification.message();
            this.recommendation = classification.recommendation();
            this.driftScore = evidence.driftScore();
            this.pValue = evidence.pValue();
            this.degradation = evidence.degradation();
        }

        private synchronized Alert toAlert() {
            return Alert.builder()
                .id(id)
                .modelId(modelId)
                .metricName(metricName)
                .severity(severity)
                .message(message)
                .recommendation(recommendation)
                .driftScore(driftScore)
                .pValue(pValue)
                .degradation(degradation)
                .status(status)
                .occurrences(occurrences)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .acknowledgedAt(acknowledgedAt)
                .resolvedAt(resolvedAt)
                .build();
        }
    }
}
