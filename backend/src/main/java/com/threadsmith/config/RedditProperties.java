package com.threadsmith.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Reddit fetch settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "threadsmith.reddit")
public class RedditProperties {

    /**
     * {@code live} talks to Reddit, {@code mock} serves canned posts.
     */
    private String mode = "live";
    private String clientId;
    private String clientSecret;
    private String userAgent = "RedditScraper/1.0";
    private String publicBaseUrl = "https://www.reddit.com";
    private String oauthBaseUrl = "https://oauth.reddit.com";
    private String permalinkBaseUrl = "https://reddit.com";
    private int maxLimit = 50;
    private int selftextPreviewLength = 200;
    private boolean verifySubreddit = true;
    private Duration timeout = Duration.ofSeconds(30);
}
