package com.example.workflowcompiler.api.v1;

import lombok.extern.slf4j.Slf4j;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Health check endpoint.
 * <p>
 * GET /api/v1/health (and the bare /health probe path) returns 200 with status and service name.
 * </p>
 */
@RestController
@Slf4j
public class HealthController {

    @GetMapping({"/api/v1/health", "/health"})
    public ResponseEntity<Map<String, String>> health() {
        log.trace("Health check");
        return ResponseEntity.ok(Map.of("status", "UP", "service", "workflow-compiler"));
    }
}
