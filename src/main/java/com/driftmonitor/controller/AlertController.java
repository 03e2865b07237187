package com.driftmonitor.controller;

import com.driftmonitor.model.Alert;
import com.driftmonitor.model.AlertStatus;
import com.driftmonitor.service.MonitoringRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@Slf4j
@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final MonitoringRegistry registry;

    @GetMapping
    public ResponseEntity<List<Alert>> alerts(
            @RequestParam(required = false) String modelId,
            @RequestParam(required = false) AlertStatus status) {
        return ResponseEntity.ok(registry.listAlerts(modelId, status));
    }

    @PostMapping("/{alertId}/acknowledge")
    public ResponseEntity<Alert> acknowledge(@PathVariable UUID alertId) {
        log.info("POST /alerts/{}/acknowledge", alertId);
        return ResponseEntity.ok(registry.acknowledgeAlert(alertId));
    }

    @PostMapping("/{alertId}/resolve")
    public ResponseEntity<Alert> resolve(@PathVariable UUID alertId) {
        log.info("POST /alerts/{}/resolve", alertId);
        return ResponseEntity.ok(registry.resolveAlert(alertId));
    }
}
