package com.threadsmith.telegram.service;

import com.threadsmith.model.RedditItem;

import java.time.Instant;
import java.util.List;

/**
 * A finished scrape waiting for the user's rewrite instruction.
 */
public record PendingBatch(
        long telegramId,
        long chatId,
        String subreddit,
        String sortType,
        String timeFilter,
        List<RedditItem> posts,
        Instant scrapedAt
) {
    public PendingBatch {
        posts = List.copyOf(posts);
    }
}
