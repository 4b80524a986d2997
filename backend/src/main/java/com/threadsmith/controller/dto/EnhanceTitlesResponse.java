package com.threadsmith.controller.dto;

import java.util.List;
import java.util.Map;

public record EnhanceTitlesResponse(
        String status,
        String message,
        List<Map<String, Object>> results
) {
}
