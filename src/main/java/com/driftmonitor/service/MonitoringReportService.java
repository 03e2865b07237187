package com.driftmonitor.service;

import com.driftmonitor.core.MonitoringContext;
import com.driftmonitor.core.Statistics;
import com.driftmonitor.model.Alert;
import com.driftmonitor.model.Measurement;
import com.driftmonitor.model.MonitoringReport;
import com.driftmonitor.model.MonitoringReport.ReportRecommendation;
import com.driftmonitor.model.Severity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
public class MonitoringReportService {

    private static final int DEFAULT_PERIOD_DAYS = 7;
    private static final int LOW_HEALTH = 70;

    private final MonitoringRegistry registry;
    private final Clock clock;

    public MonitoringReport generateReport(String modelId, Integer periodDays) {
        int days = periodDays != null && periodDays > 0 ? periodDays : DEFAULT_PERIOD_DAYS;
        MonitoringContext context = registry.context(modelId);
        Instant now = clock.instant();
        Instant from = now.minus(Duration.ofDays(days));

        List<MonitoringReport.MetricSummary> summaries = context.getBuffer().metricNames().stream()
            .sorted()
            .map(metric -> summarize(metric, context.getBuffer().since(metric, from)))
            .toList();
        long total = summaries.stream().mapToLong(MonitoringReport.MetricSummary::getCount).sum();

        List<Alert> alerts = context.getAlerts().list(null).stream()
            .filter(a -> !a.getCreatedAt().isBefore(from))
            .toList();
        int health = context.getHealth().score(now);

        return MonitoringReport.builder()
            .modelId(modelId)
            .periodDays(days)
            .totalMeasurements(total)
            .metrics(summaries)
            .alerts(alerts)
            .healthScore(health)
            .recommendations(recommendations(alerts, health))
            .generatedAt(now)
            .build();
    }

    private MonitoringReport.MetricSummary summarize(String metric, List<Measurement> measurements) {
        double[] values = measurements.stream().mapToDouble(Measurement::value).toArray();
        boolean empty = values.length == 0;
        return MonitoringReport.MetricSummary.builder()
            .metricName(metric)
            .count(values.length)
            .mean(empty ? null : round(Statistics.mean(values)))
            .stdDev(empty ? null : round(Statistics.stdDev(values)))
            .trend(round(Statistics.trend(values)))
            .build();
    }

    private List<ReportRecommendation> recommendations(List<Alert> alerts, int health) {
        List<ReportRecommendation> recommendations = new ArrayList<>();
        if (alerts.stream().anyMatch(a -> a.getSeverity() == Severity.CRITICAL)) {
            recommendations.add(ReportRecommendation.RETRAIN_IMMEDIATELY);
        }
        if (alerts.stream().anyMatch(a -> a.getSeverity() == Severity.HIGH)) {
            recommendations.add(ReportRecommendation.PLAN_RETRAINING_WITHIN_48H);
        }
        if (health < LOW_HEALTH) {
            recommendations.add(ReportRecommendation.REVIEW_METRICS);
        }
        if (recommendations.isEmpty()) {
            recommendations.add(ReportRecommendation.OPERATING_NORMALLY);
        }
        return recommendations;
    }

    private double round(double value) {
        return Math.round(value * 10000.0) / 10000.0;
    }
}
