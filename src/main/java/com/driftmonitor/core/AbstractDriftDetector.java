package com.driftmonitor.core;

import com.driftmonitor.config.MonitoringSettings;
import com.driftmonitor.model.Baseline;
import com.driftmonitor.model.DriftResult;
import com.driftmonitor.model.Measurement;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;

/**
 * Shared verdict assembly: minimum-sample gate, effect size and degradation. Subclasses only
 * supply the distributional statistic and its p-value.
 */
@Slf4j
public abstract class AbstractDriftDetector implements DriftDetector {

    protected final MonitoringSettings settings;
    private final Clock clock;

    protected AbstractDriftDetector(MonitoringSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    @Override
    public DriftResult detect(Baseline baseline, List<Measurement> current) {
        double[] reference = baseline.sampleArray();
        double[] recent = current.stream().mapToDouble(Measurement::value).toArray();
        double currentMean = Statistics.mean(recent);

        DriftResult.DriftResultBuilder result = DriftResult.builder()
            .modelId(baseline.getModelId())
            .metricName(baseline.getMetricName())
            .detector(name())
            .baselineSize(reference.length)
            .currentSize(recent.length)
            .baselineMean(baseline.getMean())
            .currentMean(currentMean)
            .degenerateBaseline(baseline.isDegenerate())
            .computedAt(clock.instant());

        int required = settings.getMinSamples();
        if (reference.length < required || recent.length < required) {
            return result
                .driftScore(0.0)
                .pValue(1.0)
                .drift(false)
                .effectSize(0.0)
                .degradation(0.0)
                .sufficientData(false)
                .build();
        }

        if (baseline.isDegenerate()) {
            log.warn("Degenerate baseline, effect size reported as raw mean difference | model={} | metric={}",
                     baseline.getModelId(), baseline.getMetricName());
        }

        Score score = score(reference, recent);
        return result
            .driftScore(clamp(score.statistic()))
            .pValue(clamp(score.pValue()))
            .drift(score.pValue() < settings.getSignificance())
            .effectSize(effectSize(baseline, currentMean))
            .degradation(degradation(baseline.getMean(), currentMean))
            .sufficientData(true)
            .build();
    }

    protected abstract Score score(double[] reference, double[] current);

    static double effectSize(Baseline baseline, double currentMean) {
        double diff = currentMean - baseline.getMean();
        return baseline.isDegenerate() ? diff : diff / baseline.getStdDev();
    }

    // positive when the metric fell; absolute difference when the baseline mean is zero
    static double degradation(double baselineMean, double currentMean) {
        double drop = baselineMean - currentMean;
        return baselineMean != 0.0 ? drop / baselineMean : drop;
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    protected record Score(double statistic, double pValue) {}
}
