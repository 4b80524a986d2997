package com.threadsmith.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One post as returned by a fetch. Never persisted.
 */
public record RedditItem(
        String id,
        String title,
        int score,
        String url,
        String permalink,
        @JsonProperty("created_utc") double createdUtc,
        String author,
        String subreddit,
        @JsonProperty("num_comments") int numComments,
        @JsonProperty("upvote_ratio") double upvoteRatio,
        String selftext,
        @JsonProperty("is_video") boolean video,
        @JsonProperty("over_18") boolean over18
) {
    public static final String DELETED_AUTHOR = "[deleted]";
}
