package com.driftmonitor.core;

import com.driftmonitor.model.Classification;
import com.driftmonitor.model.Measurement;
import com.driftmonitor.model.MetricDefinition;
import com.driftmonitor.model.ThresholdBreach;
import com.driftmonitor.model.ThresholdRule;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Compares the mean of a metric's recent observations with a fixed limit. Unlike the drift
 * detectors it needs no baseline and no minimum sample count.
 */
@Slf4j
public class ThresholdEvaluator {

    private final Duration window;
    private final SeverityClassifier classifier;
    private final Clock clock;

    public ThresholdEvaluator(Duration window, SeverityClassifier classifier, Clock clock) {
        this.window = window;
        this.classifier = classifier;
        this.clock = clock;
    }

    public Optional<ThresholdBreach> evaluate(String modelId, MetricBuffer buffer,
                                              ThresholdRule rule, MetricDefinition metric) {
        Instant now = clock.instant();
        List<Measurement> recent = buffer.since(rule.metricName(), now.minus(window));
        if (recent.isEmpty()) {
            return Optional.empty();
        }
        double mean = Statistics.mean(recent.stream().mapToDouble(Measurement::value).toArray());
        double deviation = deviation(mean, rule.limit(), metric);
        if (deviation <= 0.0) {
            return Optional.empty();
        }
        log.debug("Threshold breached | model={} | metric={} | mean={} | limit={} | samples={}",
                  modelId, rule.metricName(), mean, rule.limit(), recent.size());
        return Optional.of(ThresholdBreach.builder()
            .modelId(modelId)
            .metricName(rule.metricName())
            .observedMean(mean)
            .limit(rule.limit())
            .sampleCount(recent.size())
            .deviation(deviation)
            .severity(rule.severity())
            .recommendation(classifier.recommend(rule.severity(), rule.metricName(), deviation))
            .evaluatedAt(now)
            .build());
    }

    public Classification classification(ThresholdBreach breach) {
        return new Classification(breach.getSeverity(), message(breach), breach.getRecommendation());
    }

    static double deviation(double mean, double limit, MetricDefinition metric) {
        double past = metric.higherIsWorse() ? mean - limit : limit - mean;
        return limit == 0.0 ? past : past / Math.abs(limit);
    }

    private String message(ThresholdBreach breach) {
        return String.format(Locale.ROOT,
            "%s threshold breach in %s for model %s: mean=%.4f over %d samples in the last %s, limit=%.4f",
            breach.getSeverity(), breach.getMetricName(), breach.getModelId(),
            breach.getObservedMean(), breach.getSampleCount(), window, breach.getLimit());
    }
}
