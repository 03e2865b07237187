package com.driftmonitor.service;

import com.driftmonitor.core.MonitoringSink;
import com.driftmonitor.entity.AlertRecord;
import com.driftmonitor.entity.DriftCheckRecord;
import com.driftmonitor.model.Alert;
import com.driftmonitor.model.DriftResult;
import com.driftmonitor.repository.AlertRecordRepository;
import com.driftmonitor.repository.DriftCheckRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@RequiredArgsConstructor
public class JpaMonitoringSink implements MonitoringSink {

    private final DriftCheckRepository driftChecks;
    private final AlertRecordRepository alerts;

    @Override
    @Transactional
    public void onDriftResult(DriftResult result) {
        DriftCheckRecord saved = driftChecks.save(DriftCheckRecord.builder()
            .modelId(result.getModelId())
            .metricName(result.getMetricName())
            .detector(result.getDetector())
            .driftScore(result.getDriftScore())
            .pValue(result.getPValue())
            .drift(result.isDrift())
            .effectSize(result.getEffectSize())
            .degradation(result.getDegradation())
            .sufficientData(result.isSufficientData())
            .degenerateBaseline(result.isDegenerateBaseline())
            .baselineSize(result.getBaselineSize())
            .currentSize(result.getCurrentSize())
            .computedAt(result.getComputedAt())
            .build());
        log.debug("Drift check persisted | id={} | model={} | metric={}",
                  saved.getId(), result.getModelId(), result.getMetricName());
    }

    @Override
    @Transactional
    public void onAlert(Alert alert) {
        AlertRecord record = alerts.findById(alert.getId()).orElseGet(AlertRecord::new);
        record.setId(alert.getId());
        record.setModelId(alert.getModelId());
        record.setMetricName(alert.getMetricName());
        record.setSeverity(alert.getSeverity());
        record.setStatus(alert.getStatus());
        record.setMessage(alert.getMessage());
        if (alert.getRecommendation() != null) {
            record.setRecommendedAction(alert.getRecommendation().action().name());
            record.setUrgency(alert.getRecommendation().urgency().name());
        }
        record.setDriftScore(alert.getDriftScore());
        record.setPValue(alert.getPValue());
        record.setDegradation(alert.getDegradation());
        record.setOccurrences(alert.getOccurrences());
        record.setCreatedAt(alert.getCreatedAt());
        record.setUpdatedAt(alert.getUpdatedAt());
        record.setAcknowledgedAt(alert.getAcknowledgedAt());
        record.setResolvedAt(alert.getResolvedAt());
        alerts.save(record);
        log.debug("Alert persisted | id={} | status={}", alert.getId(), alert.getStatus());
    }
}
