package com.threadsmith.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.threadsmith.config.WorkflowWebhookProperties;
import com.threadsmith.model.RedditItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WorkflowWebhookClientTest {

    private static final String WEBHOOK_URL = "https://workflow.example.com/webhook/reddit";

    private WorkflowWebhookProperties properties;
    private MockRestServiceServer server;
    private WorkflowWebhookClient client;

    @BeforeEach
    void setUp() {
        properties = new WorkflowWebhookProperties();
        properties.setWebhookUrl(WEBHOOK_URL);
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new WorkflowWebhookClient(builder.build(), properties, new ObjectMapper());
    }

    @Test
    void send_postsSnakeCasePayloadAndReturnsMessage() {
        server.expect(once(), requestTo(WEBHOOK_URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.telegram_id").value(42))
                .andExpect(jsonPath("$.chat_id").value(4242))
                .andExpect(jsonPath("$.ai_processing").value(true))
                .andExpect(jsonPath("$.ai_prompt").value("Make it funny"))
                .andExpect(jsonPath("$.metadata.sort_type").value("top"))
                .andExpect(jsonPath("$.posts[0].num_comments").value(3))
                .andRespond(withSuccess("{\"message\":\"Queued 1 post\"}", MediaType.APPLICATION_JSON));

        Optional<String> reply = client.send(payload());

        server.verify();
        assertEquals(Optional.of("Queued 1 post"), reply);
    }

    @Test
    void send_plainTextReplyYieldsEmptyMessage() {
        server.expect(once(), requestTo(WEBHOOK_URL))
                .andRespond(withSuccess("Workflow was started", MediaType.TEXT_PLAIN));

        assertTrue(client.send(payload()).isEmpty());
    }

    @Test
    void send_requiresConfiguredUrl() {
        properties.setWebhookUrl(" ");

        assertFalse(client.isConfigured());
        assertThrows(IllegalStateException.class, () -> client.send(payload()));
    }

    private static WorkflowPayload payload() {
        RedditItem item = new RedditItem(
                "abc1", "Rust 2.0", 512, "https://example.com/a", "https://reddit.com/r/rust/comments/abc1/",
                1714550000.0, "ferris", "rust", 3, 0.97, "", false, false);
        return new WorkflowPayload(42L, 4242L, "rust", List.of(item),
                new WorkflowPayload.Metadata("top", "week", 1, "2024-05-01T10:00:00Z"),
                true, "Make it funny");
    }
}
