package com.threadsmith.telegram.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@ConfigurationProperties(prefix = "threadsmith.telegram")
public class TelegramBotProperties {

    private boolean enabled;
    private Credentials bot = new Credentials();

    /**
     * Telegram user ids allowed to scrape. Empty lets everyone in.
     */
    private List<Long> allowedUserIds = new ArrayList<>();

    /**
     * How long a scrape waits for its follow-up instruction.
     */
    private Duration sessionTtl = Duration.ofMinutes(15);
    private int previewSize = 5;
    private int previewTitleLength = 80;
    private String accessDeniedContact = "the bot owner";

    @Getter
    @Setter
    public static class Credentials {
        private String token;
        private String username;
    }
}
