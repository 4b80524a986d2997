package com.threadsmith.service;

import com.threadsmith.controller.dto.ScrapeRequest;
import com.threadsmith.controller.dto.ScrapeResponse;
import com.threadsmith.controller.dto.ScrapedPost;
import com.threadsmith.model.AppUser;
import com.threadsmith.model.Personality;
import com.threadsmith.model.RedditItem;
import com.threadsmith.model.RewriteResult;
import com.threadsmith.web.ApiException;
import com.threadsmith.web.RequestValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Request handler for the scrape routes: resolve user, resolve personality, fetch once,
 * then rewrite each post in order. Anything failing before the fetch completes turns into
 * a {@code failed} envelope; per-post rewrite failures never do.
 */
@Service
public class ScrapeService {

    private static final Logger log = LoggerFactory.getLogger(ScrapeService.class);

    private final PersonalityStore personalityStore;
    private final PostFetchService postFetchService;
    private final RewriteEngine rewriteEngine;

    public ScrapeService(
            PersonalityStore personalityStore,
            PostFetchService postFetchService,
            RewriteEngine rewriteEngine
    ) {
        this.personalityStore = personalityStore;
        this.postFetchService = postFetchService;
        this.rewriteEngine = rewriteEngine;
    }

    /**
     * Fetches and, unless {@code use_ai} is false, rewrites posts for a known chat user.
     */
    public ScrapeOutcome scrape(ScrapeRequest request) {
        String taskId = newTaskId();
        Long telegramId = request.telegramId();
        String subreddit = request.subreddit();
        try {
            if (telegramId == null) {
                throw new RequestValidationException("telegram_id is required");
            }
            AppUser user = personalityStore.getOrCreateUser(telegramId);
            Personality personality = request.resolvedUseAi()
                    ? personalityStore.resolve(user.getTelegramId(), request.resolvedPersonalityName())
                    : null;

            List<RedditItem> items = postFetchService.fetch(
                    subreddit, request.resolvedSort(), request.resolvedTimeFilter(), request.resolvedLimit());

            List<ScrapedPost> results = new ArrayList<>(items.size());
            int failedRewrites = 0;
            for (RedditItem item : items) {
                if (personality == null) {
                    results.add(ScrapedPost.plain(item));
                    continue;
                }
                RewriteResult rewrite = rewriteEngine.rewrite(item.title(), personality);
                if (rewrite.failed()) {
                    failedRewrites++;
                }
                results.add(ScrapedPost.enhanced(item, rewrite));
            }
            if (failedRewrites > 0) {
                log.warn("Task {}: {} of {} rewrites fell back to the original title",
                        taskId, failedRewrites, items.size());
            }
            log.info("Task {} completed: {} posts from r/{} for user {}", taskId, results.size(), subreddit, telegramId);
            return ScrapeOutcome.ok(ScrapeResponse.completed(taskId, telegramId, subreddit, results));
        } catch (RuntimeException ex) {
            return failure(taskId, telegramId, subreddit, ex);
        }
    }

    /**
     * Fetch-only variant: no user, no personality, no rewrite.
     */
    public ScrapeOutcome scrapeSimple(ScrapeRequest request) {
        String taskId = newTaskId();
        String subreddit = request.subreddit();
        try {
            List<RedditItem> items = postFetchService.fetch(
                    subreddit, request.resolvedSort(), request.resolvedTimeFilter(), request.resolvedLimit());
            List<ScrapedPost> results = items.stream().map(ScrapedPost::plain).toList();
            log.info("Task {} completed: {} posts from r/{}", taskId, results.size(), subreddit);
            return ScrapeOutcome.ok(ScrapeResponse.completed(taskId, request.telegramId(), subreddit, results));
        } catch (RuntimeException ex) {
            return failure(taskId, request.telegramId(), subreddit, ex);
        }
    }

    private static ScrapeOutcome failure(String taskId, Long telegramId, String subreddit, RuntimeException ex) {
        HttpStatus status;
        if (ex instanceof ApiException apiException) {
            status = apiException.getStatus();
            log.info("Task {} rejected ({}): {}", taskId, apiException.getCode(), ex.getMessage());
        } else {
            status = HttpStatus.BAD_GATEWAY;
            log.warn("Task {} failed: {}", taskId, ex.toString());
        }
        String message = StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
        return new ScrapeOutcome(status, ScrapeResponse.failed(taskId, telegramId, subreddit, message));
    }

    private static String newTaskId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Envelope plus the HTTP status it should be answered with.
     */
    public record ScrapeOutcome(HttpStatus status, ScrapeResponse response) {
        static ScrapeOutcome ok(ScrapeResponse response) {
            return new ScrapeOutcome(HttpStatus.OK, response);
        }
    }
}
