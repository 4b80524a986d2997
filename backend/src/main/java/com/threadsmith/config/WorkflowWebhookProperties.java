package com.threadsmith.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Outbound workflow webhook the chat bot hands finished scrapes to.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "threadsmith.workflow")
public class WorkflowWebhookProperties {

    private String webhookUrl;
    private Duration timeout = Duration.ofSeconds(180);
}
