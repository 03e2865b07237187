package com.driftmonitor.controller;

import com.driftmonitor.core.HealthScorer;
import com.driftmonitor.core.MonitoringContext;
import com.driftmonitor.dto.BaselineRequest;
import com.driftmonitor.dto.BaselineResponse;
import com.driftmonitor.dto.DriftCheckHistoryResponse;
import com.driftmonitor.dto.HealthResponse;
import com.driftmonitor.dto.MeasurementRequest;
import com.driftmonitor.dto.ModelResponse;
import com.driftmonitor.model.CheckOutcome;
import com.driftmonitor.model.DriftResult;
import com.driftmonitor.model.MonitoringReport;
import com.driftmonitor.model.ThresholdBreach;
import com.driftmonitor.service.DriftHistoryService;
import com.driftmonitor.service.MonitoringRegistry;
import com.driftmonitor.service.MonitoringReportService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/models")
@RequiredArgsConstructor
public class MonitoringController {

    private final MonitoringRegistry registry;
    private final MonitoringReportService reportService;
    private final DriftHistoryService historyService;

    @PostMapping("/{modelId}")
    public ResponseEntity<ModelResponse> register(
            @PathVariable String modelId,
            @RequestParam(required = false) @Min(1) @Max(10080) Integer checkIntervalMinutes,
            HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /models/{} | checkIntervalMinutes={} | requestId={}", modelId, checkIntervalMinutes, requestId);
        Duration interval = checkIntervalMinutes != null ? Duration.ofMinutes(checkIntervalMinutes) : null;
        MonitoringContext context = registry.register(modelId, interval);
        return ResponseEntity.status(HttpStatus.CREATED)
            .header("X-Request-ID", requestId)
            .body(toResponse(context));
    }

    @DeleteMapping("/{modelId}")
    public ResponseEntity<Void> deregister(@PathVariable String modelId) {
        log.info("DELETE /models/{}", modelId);
        return registry.deregister(modelId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @GetMapping
    public ResponseEntity<List<String>> models() {
        return ResponseEntity.ok(registry.modelIds().stream().sorted().toList());
    }

    @GetMapping("/{modelId}")
    public ResponseEntity<ModelResponse> model(@PathVariable String modelId) {
        return ResponseEntity.ok(toResponse(registry.context(modelId)));
    }

    @PostMapping("/{modelId}/measurements")
    public ResponseEntity<Void> ingest(
            @PathVariable String modelId, @Valid @RequestBody MeasurementRequest request) {
        registry.ingest(modelId, request.getMetricName(), request.getValue(), request.getTimestamp());
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/{modelId}/measurements/batch")
    public ResponseEntity<Map<String, Integer>> ingestBatch(
            @PathVariable String modelId, @Valid @RequestBody List<@Valid MeasurementRequest> requests) {
        registry.context(modelId);
        requests.forEach(r -> registry.ingest(modelId, r.getMetricName(), r.getValue(), r.getTimestamp()));
        log.info("POST /models/{}/measurements/batch | count={}", modelId, requests.size());
        return ResponseEntity.accepted().body(Map.of("accepted", requests.size()));
    }

    @PutMapping("/{modelId}/baselines/{metricName}")
    public ResponseEntity<BaselineResponse> establishBaseline(
            @PathVariable String modelId, @PathVariable String metricName,
            @Valid @RequestBody BaselineRequest request) {
        log.info("PUT /models/{}/baselines/{} | samples={}", modelId, metricName, request.getSamples().size());
        return ResponseEntity.ok(BaselineResponse.from(
            registry.establishBaseline(modelId, metricName, request.getSamples())));
    }

    @GetMapping("/{modelId}/baselines/{metricName}")
    public ResponseEntity<BaselineResponse> baseline(@PathVariable String modelId, @PathVariable String metricName) {
        return registry.getBaseline(modelId, metricName)
            .map(b -> ResponseEntity.ok(BaselineResponse.from(b)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{modelId}/baselines/{metricName}")
    public ResponseEntity<Void> resetBaseline(@PathVariable String modelId, @PathVariable String metricName) {
        return registry.resetBaseline(modelId, metricName)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    @PostMapping("/{modelId}/drift-checks")
    public ResponseEntity<List<CheckOutcome>> checkDrift(
            @PathVariable String modelId, @RequestParam(required = false) String metricName,
            HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /models/{}/drift-checks | metric={} | requestId={}", modelId, metricName, requestId);
        List<CheckOutcome> outcomes = metricName == null || metricName.isBlank()
            ? registry.checkAllMetrics(modelId)
            : registry.checkDrift(modelId, metricName).map(List::of).orElse(List.of());
        return ResponseEntity.ok().header("X-Request-ID", requestId).body(outcomes);
    }

    @PostMapping("/{modelId}/threshold-checks")
    public ResponseEntity<List<ThresholdBreach>> checkThresholds(
            @PathVariable String modelId, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /models/{}/threshold-checks | requestId={}", modelId, requestId);
        return ResponseEntity.ok().header("X-Request-ID", requestId).body(registry.checkThresholds(modelId));
    }

    @GetMapping("/{modelId}/drift")
    public ResponseEntity<List<DriftResult>> driftStatus(
            @PathVariable String modelId, @RequestParam(required = false) String metricName) {
        return ResponseEntity.ok(registry.getDriftStatus(modelId, metricName));
    }

    @GetMapping("/{modelId}/drift/history")
    public ResponseEntity<Page<DriftCheckHistoryResponse>> driftHistory(
            @PathVariable String modelId,
            @RequestParam(required = false) String metricName,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        registry.context(modelId);
        return ResponseEntity.ok(historyService.history(modelId, metricName, PageRequest.of(page, size)));
    }

    @GetMapping("/{modelId}/health")
    public ResponseEntity<HealthResponse> health(@PathVariable String modelId) {
        int score = registry.getHealthScore(modelId);
        return ResponseEntity.ok(HealthResponse.builder()
            .modelId(modelId)
            .healthScore(score)
            .status(score == HealthScorer.MAX_SCORE ? "healthy" : score >= 70 ? "degraded" : "unhealthy")
            .build());
    }

    @GetMapping("/{modelId}/report")
    public ResponseEntity<MonitoringReport> report(
            @PathVariable String modelId,
            @RequestParam(required = false) @Min(1) @Max(365) Integer periodDays) {
        return ResponseEntity.ok(reportService.generateReport(modelId, periodDays));
    }

    private ModelResponse toResponse(MonitoringContext context) {
        return ModelResponse.builder()
            .modelId(context.getModelId())
            .checkIntervalMinutes(context.getCheckInterval().toMinutes())
            .baselineMetrics(context.getBaselines().metricNames().stream().sorted().toList())
            .bufferedMetrics(context.getBuffer().metricNames().stream().sorted().toList())
            .healthScore(registry.getHealthScore(context.getModelId()))
            .registeredAt(context.getRegisteredAt())
            .lastCheckAt(context.getLastCheckAt())
            .build();
    }

    private String resolveRequestId(HttpServletRequest request) {
        String id = request.getHeader("X-Request-ID");
        return (id != null && !id.isBlank()) ? id : UUID.randomUUID().toString();
    }
}
