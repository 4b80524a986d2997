package com.threadsmith.provider;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.threadsmith.model.RedditItem;

import java.util.List;

/**
 * Body posted to the workflow webhook once a chat user confirms a scrape.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkflowPayload(
        long telegramId,
        long chatId,
        String subreddit,
        List<RedditItem> posts,
        Metadata metadata,
        boolean aiProcessing,
        String aiPrompt
) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Metadata(String sortType, String timeFilter, int count, String timestamp) {}
}
