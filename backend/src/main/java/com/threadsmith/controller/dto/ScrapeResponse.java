package com.threadsmith.controller.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Envelope shared by every scrape outcome. {@code results} is {@code null} on failure.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScrapeResponse(
        String taskId,
        String status,
        String message,
        Long telegramId,
        String subreddit,
        List<ScrapedPost> results
) {
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    public static ScrapeResponse completed(
            String taskId,
            Long telegramId,
            String subreddit,
            List<ScrapedPost> results
    ) {
        return new ScrapeResponse(
                taskId,
                STATUS_COMPLETED,
                "Successfully scraped " + results.size() + " posts from r/" + subreddit,
                telegramId,
                subreddit,
                results
        );
    }

    public static ScrapeResponse failed(String taskId, Long telegramId, String subreddit, String message) {
        return new ScrapeResponse(taskId, STATUS_FAILED, message, telegramId, subreddit, null);
    }
}
