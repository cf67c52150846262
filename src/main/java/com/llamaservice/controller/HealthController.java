package com.llamaservice.controller;

import com.llamaservice.dto.HealthStatusDto;
import com.llamaservice.service.HealthReporter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * GET /health: liveness
 * GET /health/detailed: heap and model report, 503 when unhealthy
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final HealthReporter healthReporter;

    public HealthController(HealthReporter healthReporter) {
        this.healthReporter = healthReporter;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("status", "ok", "timestamp", Instant.now().toString()));
    }

    @GetMapping("/detailed")
    public ResponseEntity<HealthStatusDto> detailed() {
        HealthStatusDto report = healthReporter.report();
        HttpStatus status = report.getStatus() == HealthStatusDto.Status.UNHEALTHY
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.OK;
        return ResponseEntity.status(status).body(report);
    }
}
