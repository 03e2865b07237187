package com.driftmonitor.core;

import com.driftmonitor.model.Classification;
import com.driftmonitor.model.DriftResult;
import com.driftmonitor.model.MetricDefinition;
import com.driftmonitor.model.Recommendation;
import com.driftmonitor.model.Severity;

import java.util.Locale;
import java.util.Optional;

/**
 * Deterministic decision table from drift evidence to a severity tier. Conditions are checked
 * from the most severe tier down, so a verdict that satisfies two rows takes the higher one.
 */
public class SeverityClassifier {

    static final double MEDIUM_DEGRADATION = 0.05;
    static final double HIGH_DEGRADATION = 0.15;
    static final double CRITICAL_DEGRADATION = 0.25;
    static final double LARGE_EFFECT = 0.8;
    static final double EXTREME_P_VALUE = 1.0e-4;

    public Optional<Classification> classify(DriftResult result, MetricDefinition metric) {
        double adverse = adverseDegradation(result.getDegradation(), metric);
        return severity(result.isDrift(), result.getPValue(), result.getEffectSize(), adverse)
            .map(severity -> new Classification(
                severity,
                message(severity, result, adverse),
                recommend(severity, result.getMetricName(), adverse)));
    }

    /**
     * @param degradation relative loss in the metric's "bad" direction; positive means worse
     */
    public Optional<Severity> severity(boolean drift, double pValue, double effectSize, double degradation) {
        if (!drift) {
            return Optional.empty();
        }
        boolean largeEffect = Math.abs(effectSize) >= LARGE_EFFECT;
        if (degradation >= CRITICAL_DEGRADATION || (pValue < EXTREME_P_VALUE && largeEffect)) {
            return Optional.of(Severity.CRITICAL);
        }
        if (degradation >= HIGH_DEGRADATION || largeEffect) {
            return Optional.of(Severity.HIGH);
        }
        if (degradation >= MEDIUM_DEGRADATION) {
            return Optional.of(Severity.MEDIUM);
        }
        return Optional.of(Severity.LOW);
    }

    public Recommendation recommend(Severity severity, String metricName, double degradation) {
        return switch (severity) {
            case LOW -> new Recommendation(
                Recommendation.Action.CONTINUE_MONITORING, Recommendation.Urgency.ROUTINE, metricName, degradation);
            case MEDIUM -> new Recommendation(
                Recommendation.Action.PLAN_RETRAINING, Recommendation.Urgency.DAYS, metricName, degradation);
            case HIGH -> new Recommendation(
                Recommendation.Action.RETRAIN_WITH_OVERSIGHT, Recommendation.Urgency.HOURS, metricName, degradation);
            case CRITICAL -> new Recommendation(
                Recommendation.Action.RETRAIN_WITH_SAFE_MODE_FALLBACK, Recommendation.Urgency.IMMEDIATE,
                metricName, degradation);
        };
    }

    /** Flips the sign for metrics where an increase is the bad direction. */
    public static double adverseDegradation(double degradation, MetricDefinition metric) {
        return metric.higherIsWorse() ? -degradation : degradation;
    }

    private static String message(Severity severity, DriftResult result, double adverse) {
        return String.format(Locale.ROOT,
            "%s drift in %s for model %s: score=%.4f, p=%.3e, effect=%.2f, degradation=%.2f%%",
            severity, result.getMetricName(), result.getModelId(),
            result.getDriftScore(), result.getPValue(), result.getEffectSize(), adverse * 100.0);
    }
}
