package com.threadsmith.controller;

import com.threadsmith.controller.dto.ServiceInfoResponses.HealthResponse;
import com.threadsmith.controller.dto.ServiceInfoResponses.ServiceDescriptionResponse;
import com.threadsmith.service.ServiceInfoService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated service description and liveness endpoints.
 */
@RestController
public class ServiceInfoController {

    private final ServiceInfoService serviceInfoService;

    public ServiceInfoController(ServiceInfoService serviceInfoService) {
        this.serviceInfoService = serviceInfoService;
    }

    @GetMapping("/")
    public ResponseEntity<ServiceDescriptionResponse> describe() {
        return ResponseEntity.ok(serviceInfoService.describe());
    }

    @GetMapping("/api/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(serviceInfoService.health());
    }
}
