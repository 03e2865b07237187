package com.driftmonitor.entity;

import com.driftmonitor.model.AlertStatus;
import com.driftmonitor.model.Severity;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "alerts",
    indexes = {
        @Index(name = "idx_alert_model",   columnList = "model_id"),
        @Index(name = "idx_alert_status",  columnList = "status"),
        @Index(name = "idx_alert_created", columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AlertRecord {

    @Id
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_id", nullable = false, length = 128)
    private String modelId;

    @Column(name = "metric_name", nullable = false, length = 128)
    private String metricName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Severity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private AlertStatus status;

    @Column(length = 512)
    private String message;

    @Column(name = "recommended_action", length = 64)
    private String recommendedAction;

    @Column(length = 20)
    private String urgency;

    @Column(name = "drift_score")
    private double driftScore;

    @Column(name = "p_value")
    private double pValue;

    private double degradation;

    private int occurrences;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "resolved_at")
    private Instant resolvedAt;
}
