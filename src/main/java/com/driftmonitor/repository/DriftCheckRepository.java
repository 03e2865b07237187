package com.driftmonitor.repository;

import com.driftmonitor.entity.DriftCheckRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface DriftCheckRepository extends JpaRepository<DriftCheckRecord, UUID> {

    Page<DriftCheckRecord> findByModelIdOrderByComputedAtDesc(String modelId, Pageable pageable);

    Page<DriftCheckRecord> findByModelIdAndMetricNameOrderByComputedAtDesc(
        String modelId, String metricName, Pageable pageable);
}
