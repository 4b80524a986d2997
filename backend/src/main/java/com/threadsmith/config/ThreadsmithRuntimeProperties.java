package com.threadsmith.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Service identity, API key auth and rate limiting settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "threadsmith")
public class ThreadsmithRuntimeProperties {

    private String serviceName = "reddit-scraper-api";
    private String version = "1.0.0";

    private Security security = new Security();
    private RateLimit rateLimit = new RateLimit();

    @Getter
    @Setter
    public static class Security {
        /**
         * Static key expected in {@link #headerName}. Blank disables the check.
         */
        private String apiKey = "";
        private String headerName = "X-API-Key";
    }

    @Getter
    @Setter
    public static class RateLimit {
        /**
         * {@code redis} or {@code memory}.
         */
        private String mode = "redis";
        private String redisKeyPrefix = "threadsmith:ratelimit:";
        private int scrapesPerUserPerMinute = 5;
        private int sendsPerSecond = 25;
    }
}
