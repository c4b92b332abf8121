package com.example.realtime.controller;

import com.example.realtime.dto.HealthResponse;
import com.example.realtime.service.DeliveryHealthService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness for container checks. Always 200 while the process runs; a lost listener link shows
 * up as {@code degraded} in the body.
 */
@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final DeliveryHealthService deliveryHealthService;

    public HealthController(DeliveryHealthService deliveryHealthService) {
        this.deliveryHealthService = deliveryHealthService;
    }

    @GetMapping
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(deliveryHealthService.snapshot());
    }
}
