package com.threadsmith.service;

import com.threadsmith.config.ThreadsmithRuntimeProperties;
import com.threadsmith.controller.dto.ServiceInfoResponses.HealthResponse;
import com.threadsmith.controller.dto.ServiceInfoResponses.ServiceDescriptionResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class ServiceInfoService {

    static final String HEALTHY = "healthy";

    private final ThreadsmithRuntimeProperties runtimeProperties;

    public HealthResponse health() {
        return new HealthResponse(HEALTHY, runtimeProperties.getServiceName(), runtimeProperties.getVersion());
    }

    public ServiceDescriptionResponse describe() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("health", "GET /api/health");
        endpoints.put("scrape", "POST /api/scrape");
        endpoints.put("scrape_simple", "POST /api/scrape-simple");
        endpoints.put("enhance_titles", "POST /api/enhance-titles");
        endpoints.put("personalities", "GET /api/personalities?telegram_id=");
        endpoints.put("create_personality", "POST /api/personality");
        endpoints.put("delete_personality", "POST /api/personality/delete");
        return new ServiceDescriptionResponse("Reddit Scraper API", runtimeProperties.getVersion(), endpoints);
    }
}
