package com.threadsmith.web;

import org.springframework.http.HttpStatus;

public class SubredditNotFoundException extends ApiException {

    public SubredditNotFoundException(String subreddit) {
        super(HttpStatus.NOT_FOUND, "collection_not_found", "Subreddit r/" + subreddit + " not found");
    }
}
