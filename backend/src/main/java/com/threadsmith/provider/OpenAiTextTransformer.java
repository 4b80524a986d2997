package com.threadsmith.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Text transformer backed by the hosted OpenAI chat model.
 */
@Component
@ConditionalOnProperty(prefix = "threadsmith.rewrite", name = "mode", havingValue = "live", matchIfMissing = true)
public class OpenAiTextTransformer implements TextTransformer {

    private static final Logger log = LoggerFactory.getLogger(OpenAiTextTransformer.class);

    private final ChatClient chatClient;

    public OpenAiTextTransformer(ChatClient chatClient) {
        this.chatClient = chatClient;
    }

    @Override
    public String transform(String prompt, double temperature, int maxTokens) {
        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
        String content;
        try {
            content = chatClient.prompt()
                    .user(prompt)
                    .options(options)
                    .call()
                    .content();
        } catch (RuntimeException ex) {
            log.debug("Model call failed: {}", ex.getMessage());
            throw new TextTransformException("Model call failed: " + describe(ex), ex);
        }
        if (!StringUtils.hasText(content)) {
            throw new TextTransformException("Model returned an empty response");
        }
        return content;
    }

    private static String describe(RuntimeException ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
