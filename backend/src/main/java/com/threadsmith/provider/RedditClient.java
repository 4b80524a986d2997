package com.threadsmith.provider;

import com.threadsmith.model.SortMode;
import com.threadsmith.model.TimeWindow;

import java.util.List;

/**
 * Abstraction over Reddit listing access so the fetcher can run against canned data.
 */
public interface RedditClient {

    /**
     * Fetches one listing page from a subreddit.
     *
     * @param subreddit  Subreddit name without the {@code r/} prefix
     * @param sort       Listing order
     * @param timeWindow Time filter, only honored for {@link SortMode#TOP}
     * @param limit      Maximum number of posts to return
     * @return Posts in the order Reddit supplied them
     */
    List<RedditPost> fetchPosts(String subreddit, SortMode sort, TimeWindow timeWindow, int limit);

    /**
     * @return {@code true} when the subreddit resolves to an existing community
     */
    boolean subredditExists(String subreddit);

    /**
     * Raw post fields as Reddit reports them. {@code permalink} is site-relative and
     * {@code author} is {@code null} for removed accounts.
     */
    record RedditPost(
        String id,
        String title,
        int score,
        String url,
        String permalink,
        double createdUtc,
        String author,
        int numComments,
        double upvoteRatio,
        String selftext,
        boolean video,
        boolean over18
    ) {}
}
