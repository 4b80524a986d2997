package com.threadsmith.telegram.config;

import com.threadsmith.config.ThreadsmithRuntimeProperties;
import com.threadsmith.provider.WorkflowWebhookClient;
import com.threadsmith.service.PersonalityStore;
import com.threadsmith.service.PostFetchService;
import com.threadsmith.service.RateLimiter;
import com.threadsmith.service.TitleEnhancementService;
import com.threadsmith.telegram.bot.TelegramBotLifecycle;
import com.threadsmith.telegram.bot.TelegramLongPollingBotAdapter;
import com.threadsmith.telegram.service.ChatSessionStore;
import com.threadsmith.telegram.service.ScraperBotService;
import com.threadsmith.telegram.service.TelegramUpdateHandler;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.bots.DefaultBotOptions;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(TelegramBotProperties.class)
@ConditionalOnProperty(prefix = "threadsmith.telegram", name = "enabled", havingValue = "true")
public class TelegramBotConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DefaultBotOptions telegramBotOptions() {
        return new DefaultBotOptions();
    }

    @Bean
    public ChatSessionStore chatSessionStore(TelegramBotProperties properties) {
        return new ChatSessionStore(properties.getSessionTtl(), Clock.systemUTC());
    }

    @Bean
    public ScraperBotService scraperBotService(
            TelegramBotProperties properties,
            ThreadsmithRuntimeProperties runtimeProperties,
            ChatSessionStore chatSessionStore,
            PostFetchService postFetchService,
            TitleEnhancementService titleEnhancementService,
            PersonalityStore personalityStore,
            WorkflowWebhookClient workflowWebhookClient,
            RateLimiter rateLimiter) {
        return new ScraperBotService(
                properties,
                runtimeProperties,
                chatSessionStore,
                postFetchService,
                titleEnhancementService,
                personalityStore,
                workflowWebhookClient,
                rateLimiter);
    }

    @Bean
    @ConditionalOnMissingBean
    public TelegramLongPollingBotAdapter telegramLongPollingBotAdapter(
            DefaultBotOptions telegramBotOptions,
            TelegramBotProperties properties,
            TelegramUpdateHandler updateHandler) {
        return new TelegramLongPollingBotAdapter(telegramBotOptions, properties, updateHandler);
    }

    @Bean
    @ConditionalOnMissingBean
    public TelegramBotLifecycle telegramBotLifecycle(TelegramLongPollingBotAdapter longPollingBot) {
        return new TelegramBotLifecycle(longPollingBot);
    }
}
