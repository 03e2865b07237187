package com.driftmonitor.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "drift_checks",
    indexes = {
        @Index(name = "idx_drift_model",    columnList = "model_id"),
        @Index(name = "idx_drift_metric",   columnList = "metric_name"),
        @Index(name = "idx_drift_computed", columnList = "computed_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DriftCheckRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "model_id", nullable = false, length = 128)
    private String modelId;

    @Column(name = "metric_name", nullable = false, length = 128)
    private String metricName;

    @Column(nullable = false, length = 20)
    private String detector;

    @Column(name = "drift_score", nullable = false)
    private double driftScore;

    @Column(name = "p_value", nullable = false)
    private double pValue;

    @Column(name = "is_drift", nullable = false)
    private boolean drift;

    @Column(name = "effect_size")
    private double effectSize;

    private double degradation;

    @Column(name = "sufficient_data")
    private boolean sufficientData;

    @Column(name = "degenerate_baseline")
    private boolean degenerateBaseline;

    @Column(name = "baseline_size")
    private int baselineSize;

    @Column(name = "current_size")
    private int currentSize;

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
