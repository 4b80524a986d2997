package com.threadsmith.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Body of {@code /api/scrape} and {@code /api/scrape-simple}. Missing fields take the
 * defaults below; validation happens in the request handler so failures keep the scrape
 * envelope.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScrapeRequest(
        String subreddit,
        Integer limit,
        String sort,
        String timeFilter,
        Long telegramId,
        String personalityName,
        Boolean useAi
) {
    public static final int DEFAULT_LIMIT = 10;
    public static final String DEFAULT_SORT = "hot";
    public static final String DEFAULT_TIME_FILTER = "week";
    public static final String DEFAULT_PERSONALITY = "default";

    public int resolvedLimit() {
        return limit != null ? limit : DEFAULT_LIMIT;
    }

    public String resolvedSort() {
        return sort != null ? sort : DEFAULT_SORT;
    }

    public String resolvedTimeFilter() {
        return timeFilter != null ? timeFilter : DEFAULT_TIME_FILTER;
    }

    public String resolvedPersonalityName() {
        return personalityName != null && !personalityName.isBlank() ? personalityName : DEFAULT_PERSONALITY;
    }

    public boolean resolvedUseAi() {
        return useAi == null || useAi;
    }
}
