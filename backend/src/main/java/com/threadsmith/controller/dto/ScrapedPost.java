package com.threadsmith.controller.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.threadsmith.model.RedditItem;
import com.threadsmith.model.RewriteResult;

/**
 * One result record: the fetched post plus, when AI was requested, its rewritten title.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScrapedPost(
        @JsonUnwrapped RedditItem post,
        String originalTitle,
        String aiTitle,
        String personalityUsed,
        String rewriteError
) {
    public static ScrapedPost plain(RedditItem post) {
        return new ScrapedPost(post, null, null, null, null);
    }

    public static ScrapedPost enhanced(RedditItem post, RewriteResult rewrite) {
        return new ScrapedPost(
                post,
                rewrite.originalText(),
                rewrite.rewrittenText(),
                rewrite.personalityName(),
                rewrite.error()
        );
    }
}
