package com.threadsmith.controller.dto;

import java.util.Map;

public final class ServiceInfoResponses {

    private ServiceInfoResponses() {
    }

    public record HealthResponse(
            String status,
            String service,
            String version
    ) {
    }

    public record ServiceDescriptionResponse(
            String message,
            String version,
            Map<String, String> endpoints
    ) {
    }
}
