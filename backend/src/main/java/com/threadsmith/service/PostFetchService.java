package com.threadsmith.service;

import com.threadsmith.config.RedditProperties;
import com.threadsmith.model.RedditItem;
import com.threadsmith.model.SortMode;
import com.threadsmith.model.TimeWindow;
import com.threadsmith.provider.RedditClient;
import com.threadsmith.web.RequestValidationException;
import com.threadsmith.web.SubredditNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Item fetcher: turns one subreddit request into at most {@code max-limit} posts, in the
 * order Reddit returned them.
 */
@Service
public class PostFetchService {

    private static final Logger log = LoggerFactory.getLogger(PostFetchService.class);
    static final TimeWindow DEFAULT_TIME_WINDOW = TimeWindow.WEEK;

    private final RedditClient redditClient;
    private final RedditProperties redditProperties;

    public PostFetchService(RedditClient redditClient, RedditProperties redditProperties) {
        this.redditClient = redditClient;
        this.redditProperties = redditProperties;
    }

    /**
     * Fetches posts from a subreddit.
     *
     * @param subreddit  Subreddit name, with or without the {@code r/} prefix
     * @param sort       Listing order name, unknown values fall back to {@code hot}
     * @param timeFilter Time filter name, only read for {@code top}; {@code null} means {@code week}
     * @param count      Requested number of posts, clamped to the configured maximum
     * @return Posts in upstream order, never more than {@code min(count, max-limit)}
     * @throws RequestValidationException  for a blank subreddit, a non-positive count or an unknown time filter on {@code top}
     * @throws SubredditNotFoundException for a subreddit that does not exist
     */
    public List<RedditItem> fetch(String subreddit, String sort, String timeFilter, int count) {
        String name = normalizeSubreddit(subreddit);
        if (count < 1) {
            throw new RequestValidationException("limit must be at least 1");
        }
        SortMode sortMode = SortMode.fromValue(sort);
        TimeWindow timeWindow = sortMode == SortMode.TOP ? resolveTimeWindow(timeFilter) : DEFAULT_TIME_WINDOW;
        int limit = Math.min(count, redditProperties.getMaxLimit());

        if (redditProperties.isVerifySubreddit() && !redditClient.subredditExists(name)) {
            throw new SubredditNotFoundException(name);
        }

        List<RedditClient.RedditPost> posts = redditClient.fetchPosts(name, sortMode, timeWindow, limit);
        List<RedditItem> items = new ArrayList<>(Math.min(posts.size(), limit));
        for (RedditClient.RedditPost post : posts) {
            if (items.size() == limit) {
                break;
            }
            items.add(toItem(name, post));
        }
        log.info("Fetched {} posts from r/{} (sort={}, t={}, requested={})",
                items.size(), name, sortMode.value(), timeWindow.value(), count);
        return items;
    }

    private static TimeWindow resolveTimeWindow(String timeFilter) {
        if (timeFilter == null) {
            return DEFAULT_TIME_WINDOW;
        }
        return TimeWindow.fromValue(timeFilter).orElseThrow(() ->
                new RequestValidationException("Unknown time_filter '" + timeFilter
                        + "', expected one of hour, day, week, month, year, all"));
    }

    private RedditItem toItem(String subreddit, RedditClient.RedditPost post) {
        String author = StringUtils.hasText(post.author()) ? post.author() : RedditItem.DELETED_AUTHOR;
        return new RedditItem(
                post.id(),
                post.title(),
                post.score(),
                post.url(),
                absolutePermalink(post.permalink()),
                post.createdUtc(),
                author,
                subreddit,
                post.numComments(),
                post.upvoteRatio(),
                preview(post.selftext()),
                post.video(),
                post.over18()
        );
    }

    private String absolutePermalink(String permalink) {
        if (!StringUtils.hasText(permalink) || permalink.startsWith("http")) {
            return permalink;
        }
        return redditProperties.getPermalinkBaseUrl() + permalink;
    }

    private String preview(String selftext) {
        if (selftext == null) {
            return "";
        }
        int max = redditProperties.getSelftextPreviewLength();
        return selftext.length() > max ? selftext.substring(0, max) : selftext;
    }

    private static String normalizeSubreddit(String subreddit) {
        if (!StringUtils.hasText(subreddit)) {
            throw new RequestValidationException("subreddit is required");
        }
        String name = subreddit.trim();
        if (name.regionMatches(true, 0, "r/", 0, 2)) {
            name = name.substring(2);
        }
        if (!name.matches("[A-Za-z0-9_]{1,50}")) {
            throw new RequestValidationException("Invalid subreddit name '" + subreddit + "'");
        }
        return name;
    }
}
