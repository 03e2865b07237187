package com.driftmonitor.service;

import com.driftmonitor.config.MonitoringSettings;
import com.driftmonitor.core.AlertManager;
import com.driftmonitor.core.DriftDetector;
import com.driftmonitor.core.MonitoringContext;
import com.driftmonitor.core.MonitoringSink;
import com.driftmonitor.core.SeverityClassifier;
import com.driftmonitor.core.ThresholdEvaluator;
import com.driftmonitor.exception.AlertNotFoundException;
import com.driftmonitor.exception.UnknownModelException;
import com.driftmonitor.model.Alert;
import com.driftmonitor.model.AlertStatus;
import com.driftmonitor.model.Baseline;
import com.driftmonitor.model.CheckOutcome;
import com.driftmonitor.model.Classification;
import com.driftmonitor.model.DriftResult;
import com.driftmonitor.model.ThresholdBreach;
import com.driftmonitor.model.ThresholdRule;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Owns one {@link MonitoringContext} per model id and routes every operation to it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonitoringRegistry {

    private final MonitoringSettings settings;
    private final DriftDetector detector;
    private final SeverityClassifier classifier;
    private final MonitoringSink sink;
    private final Clock clock;
    private final ThresholdEvaluator thresholds;

    private final ConcurrentHashMap<String, MonitoringContext> contexts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, String> alertOwners = new ConcurrentHashMap<>();

    public MonitoringContext register(String modelId) {
        return register(modelId, null);
    }

    /** Idempotent: an already registered model keeps its context, including its check interval. */
    public MonitoringContext register(String modelId, Duration checkInterval) {
        Duration interval = checkInterval != null ? checkInterval : settings.getDefaultCheckInterval();
        return contexts.computeIfAbsent(modelId, id -> {
            log.info("Model registered | model={} | checkInterval={}", id, interval);
            return new MonitoringContext(id, interval, settings, clock);
        });
    }

    public boolean deregister(String modelId) {
        MonitoringContext removed = contexts.remove(modelId);
        if (removed == null) {
            return false;
        }
        removed.getAlerts().alertIds().forEach(alertOwners::remove);
        log.info("Model deregistered | model={}", modelId);
        return true;
    }

    public boolean isRegistered(String modelId) {
        return contexts.containsKey(modelId);
    }

    public Set<String> modelIds() {
        return Set.copyOf(contexts.keySet());
    }

    public MonitoringContext context(String modelId) {
        MonitoringContext context = contexts.get(modelId);
        if (context == null) {
            throw new UnknownModelException(modelId);
        }
        return context;
    }

    public void ingest(String modelId, String metricName, double value, Instant timestamp) {
        MonitoringContext context = context(modelId);
        context.getBuffer().record(metricName, value, timestamp);
        log.debug("Measurement ingested | model={} | metric={} | value={}", modelId, metricName, value);
    }

    public Baseline establishBaseline(String modelId, String metricName, List<Double> samples) {
        return context(modelId).getBaselines().establish(metricName, samples);
    }

    public Optional<Baseline> getBaseline(String modelId, String metricName) {
        return context(modelId).getBaselines().get(metricName);
    }

    public boolean resetBaseline(String modelId, String metricName) {
        boolean removed = context(modelId).getBaselines().reset(metricName);
        if (removed) {
            log.info("Baseline reset | model={} | metric={}", modelId, metricName);
        }
        return removed;
    }

    /**
     * Detector, classifier, health update and alerting for one metric. Empty when the metric has
     * no baseline yet; waits for an in-flight check on the same metric to finish.
     */
    public Optional<CheckOutcome> checkDrift(String modelId, String metricName) {
        MonitoringContext context = context(modelId);
        return context.withCheckLock(metricName, () -> runCheck(context, metricName));
    }

    public List<CheckOutcome> checkAllMetrics(String modelId) {
        MonitoringContext context = context(modelId);
        List<CheckOutcome> outcomes = new ArrayList<>();
        for (String metricName : sortedBaselineMetrics(context)) {
            context.withCheckLock(metricName, () -> runCheck(context, metricName))
                .ifPresent(outcomes::add);
        }
        return outcomes;
    }

    /** Scheduled variant: metrics whose check is already running are skipped, not awaited. */
    public List<CheckOutcome> runScheduledChecks(String modelId) {
        MonitoringContext context = context(modelId);
        context.markChecked(clock.instant());
        List<CheckOutcome> outcomes = new ArrayList<>();
        for (String metricName : sortedBaselineMetrics(context)) {
            Optional<Optional<CheckOutcome>> attempt =
                context.tryWithCheckLock(metricName, () -> runCheck(context, metricName));
            if (attempt.isEmpty()) {
                log.debug("Check already running, skipped | model={} | metric={}", modelId, metricName);
            }
            attempt.flatMap(o -> o).ifPresent(outcomes::add);
        }
        for (ThresholdRule rule : settings.getThresholds()) {
            context.tryWithCheckLock(rule.metricName(), () -> runThresholdCheck(context, rule));
        }
        return outcomes;
    }

    /**
     * Evaluates every configured threshold against the recent mean of its metric. Breaches raise
     * alerts through the same per-metric dedup as drift findings.
     */
    public List<ThresholdBreach> checkThresholds(String modelId) {
        MonitoringContext context = context(modelId);
        List<ThresholdBreach> breaches = new ArrayList<>();
        for (ThresholdRule rule : settings.getThresholds()) {
            context.withCheckLock(rule.metricName(), () -> runThresholdCheck(context, rule))
                .ifPresent(breaches::add);
        }
        return breaches;
    }

    public List<MonitoringContext> dueForCheck(Instant now) {
        return contexts.values().stream()
            .filter(c -> c.isDue(now))
            .sorted(Comparator.comparing(MonitoringContext::getModelId))
            .toList();
    }

    public List<DriftResult> getDriftStatus(String modelId, String metricName) {
        MonitoringContext context = context(modelId);
        if (metricName == null || metricName.isBlank()) {
            return context.latestResults();
        }
        return context.latestResult(metricName).map(List::of).orElse(List.of());
    }

    public int getHealthScore(String modelId) {
        return context(modelId).getHealth().score(clock.instant());
    }

    public List<Alert> listAlerts(String modelId, AlertStatus status) {
        if (modelId != null && !modelId.isBlank()) {
            return context(modelId).getAlerts().list(status);
        }
        return contexts.values().stream()
            .flatMap(c -> c.getAlerts().list(status).stream())
            .sorted(Comparator.comparing(Alert::getCreatedAt).reversed())
            .toList();
    }

    public Alert acknowledgeAlert(UUID alertId) {
        Alert alert = ownerOf(alertId).acknowledge(alertId);
        publish(alert, sink::onAlert);
        return alert;
    }

    public Alert resolveAlert(UUID alertId) {
        Alert alert = ownerOf(alertId).resolve(alertId);
        publish(alert, sink::onAlert);
        return alert;
    }

    @PreDestroy
    void shutdown() {
        int count = contexts.size();
        contexts.clear();
        alertOwners.clear();
        log.info("Monitoring registry shut down | models={}", count);
    }

    private Optional<CheckOutcome> runCheck(MonitoringContext context, String metricName) {
        Optional<Baseline> baseline = context.getBaselines().get(metricName);
        if (baseline.isEmpty()) {
            log.debug("No baseline, drift check skipped | model={} | metric={}", context.getModelId(), metricName);
            return Optional.empty();
        }

        DriftResult result = detector.detect(baseline.get(),
            context.getBuffer().window(metricName, settings.getWindowSize()));
        Optional<Classification> classification =
            classifier.classify(result, settings.metricDefinition(metricName));
        context.getHealth().record(classification.map(Classification::severity).orElse(null), result.getComputedAt());
        context.recordResult(result);
        publish(result, sink::onDriftResult);

        log.info("Drift check | model={} | metric={} | drift={} | score={} | p={} | sufficientData={}",
                 context.getModelId(), metricName, result.isDrift(), result.getDriftScore(),
                 result.getPValue(), result.isSufficientData());

        CheckOutcome.CheckOutcomeBuilder outcome = CheckOutcome.builder().result(result);
        classification.ifPresent(c -> {
            AlertManager.Evaluation evaluation = context.getAlerts().evaluate(result, c);
            if (handleEvaluation(context, evaluation)) {
                outcome.newAlert(evaluation.alert());
            }
            outcome.severity(c.severity()).recommendation(c.recommendation());
        });
        return Optional.of(outcome.build());
    }

    private Optional<ThresholdBreach> runThresholdCheck(MonitoringContext context, ThresholdRule rule) {
        Optional<ThresholdBreach> breach = thresholds.evaluate(context.getModelId(), context.getBuffer(), rule,
                                                               settings.metricDefinition(rule.metricName()));
        if (breach.isEmpty()) {
            return breach;
        }
        ThresholdBreach found = breach.get();
        context.getHealth().record(found.getSeverity(), found.getEvaluatedAt());
        AlertManager.Evaluation evaluation = context.getAlerts().raise(rule.metricName(),
            thresholds.classification(found), new AlertManager.Evidence(0.0, 1.0, found.getDeviation()));

        log.warn("Threshold breach | model={} | metric={} | mean={} | limit={} | severity={}",
                 context.getModelId(), rule.metricName(), found.getObservedMean(), found.getLimit(),
                 found.getSeverity());

        if (handleEvaluation(context, evaluation)) {
            return Optional.of(found.toBuilder().newAlert(evaluation.alert()).build());
        }
        return breach;
    }

    /** Indexes a new alert under its model and hands non-duplicate changes to the sink. */
    private boolean handleEvaluation(MonitoringContext context, AlertManager.Evaluation evaluation) {
        boolean created = evaluation.created();
        if (created) {
            UUID alertId = evaluation.alert().getId();
            if (contexts.get(context.getModelId()) == context) {
                alertOwners.put(alertId, context.getModelId());
                // deregister may have swept the index between the check and the put
                if (contexts.get(context.getModelId()) != context) {
                    alertOwners.remove(alertId);
                }
            }
        }
        if (evaluation.change() != AlertManager.Change.DEDUPLICATED) {
            publish(evaluation.alert(), sink::onAlert);
        }
        return created;
    }

    private AlertManager ownerOf(UUID alertId) {
        String modelId = alertOwners.get(alertId);
        MonitoringContext context = modelId != null ? contexts.get(modelId) : null;
        if (context == null) {
            throw new AlertNotFoundException(alertId);
        }
        return context.getAlerts();
    }

    private static List<String> sortedBaselineMetrics(MonitoringContext context) {
        return context.getBaselines().metricNames().stream().sorted().toList();
    }

    private <T> void publish(T value, Consumer<T> target) {
        try {
            target.accept(value);
        } catch (RuntimeException ex) {
            log.warn("Monitoring sink rejected {}: {}", value.getClass().getSimpleName(), ex.getMessage(), ex);
        }
    }
}
