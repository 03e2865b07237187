package com.driftmonitor.service;

import com.driftmonitor.dto.DriftCheckHistoryResponse;
import com.driftmonitor.repository.DriftCheckRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class DriftHistoryService {

    private final DriftCheckRepository repository;

    @Transactional(readOnly = true)
    public Page<DriftCheckHistoryResponse> history(String modelId, String metricName, Pageable pageable) {
        if (metricName == null || metricName.isBlank()) {
            return repository.findByModelIdOrderByComputedAtDesc(modelId, pageable)
                .map(DriftCheckHistoryResponse::from);
        }
        return repository.findByModelIdAndMetricNameOrderByComputedAtDesc(modelId, metricName, pageable)
            .map(DriftCheckHistoryResponse::from);
    }
}
