package com.threadsmith.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.threadsmith.config.WorkflowWebhookProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

import java.util.Optional;

/**
 * Hands finished scrapes to an external workflow (an n8n webhook in the reference deployment).
 */
@Component
public class WorkflowWebhookClient {

    private static final Logger log = LoggerFactory.getLogger(WorkflowWebhookClient.class);

    private final RestClient restClient;
    private final WorkflowWebhookProperties webhookProperties;
    private final ObjectMapper objectMapper;

    public WorkflowWebhookClient(
            @Qualifier("workflowRestClient") RestClient restClient,
            WorkflowWebhookProperties webhookProperties,
            ObjectMapper objectMapper
    ) {
        this.restClient = restClient;
        this.webhookProperties = webhookProperties;
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        return StringUtils.hasText(webhookProperties.getWebhookUrl());
    }

    /**
     * Posts the payload and returns the workflow's {@code message} field when it sent one.
     *
     * @throws IllegalStateException when no webhook URL is configured
     */
    public Optional<String> send(WorkflowPayload payload) {
        if (!isConfigured()) {
            throw new IllegalStateException("Workflow webhook URL is not configured");
        }
        String reply = restClient.post()
                .uri(webhookProperties.getWebhookUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(String.class);
        log.info("Delivered {} posts from r/{} to workflow for user {}",
                payload.posts().size(), payload.subreddit(), payload.telegramId());
        return replyMessage(reply);
    }

    private Optional<String> replyMessage(String reply) {
        if (!StringUtils.hasText(reply)) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(reply);
            if (node != null && node.hasNonNull("message")) {
                return Optional.of(node.get("message").asText());
            }
        } catch (JsonProcessingException ex) {
            log.debug("Workflow reply is not JSON, ignoring body: {}", ex.getOriginalMessage());
        }
        return Optional.empty();
    }
}
