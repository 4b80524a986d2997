package com.threadsmith.controller.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

/**
 * Caller-supplied titles to rewrite. Each entry must carry {@code title}; other keys are
 * echoed back untouched.
 */
public record EnhanceTitlesRequest(
        @NotNull(message = "titles is required")
        @Size(max = 50, message = "titles must contain at most 50 entries")
        List<Map<String, Object>> titles,

        @Size(max = 4000, message = "prompt must be at most 4000 characters")
        String prompt
) {
}
