package com.threadsmith.service;

import com.threadsmith.config.RewriteProperties;
import com.threadsmith.model.FallbackPolicy;
import com.threadsmith.model.Personality;
import com.threadsmith.model.RewriteResult;
import com.threadsmith.provider.TextTransformException;
import com.threadsmith.provider.TextTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Rewrites one title through the text transformer. Never throws for a transformer
 * failure: the fallback title is returned with the error recorded instead.
 */
@Service
public class RewriteEngine {

    private static final Logger log = LoggerFactory.getLogger(RewriteEngine.class);
    private static final String QUOTE_CHARACTERS = "\"'“”‘’«»";

    private final TextTransformer textTransformer;
    private final RewriteProperties rewriteProperties;

    public RewriteEngine(TextTransformer textTransformer, RewriteProperties rewriteProperties) {
        this.textTransformer = textTransformer;
        this.rewriteProperties = rewriteProperties;
    }

    public RewriteResult rewrite(String originalText, Personality personality) {
        return rewrite(
                originalText,
                personality.getPromptTemplate(),
                personality.getTemperature() != null
                        ? personality.getTemperature()
                        : rewriteProperties.getDefaultTemperature(),
                personality.getMaxTokens() != null
                        ? personality.getMaxTokens()
                        : rewriteProperties.getDefaultMaxLength(),
                personality.getName()
        );
    }

    public RewriteResult rewrite(String originalText, String promptTemplate, double temperature, int maxLength) {
        return rewrite(originalText, promptTemplate, temperature, maxLength, null);
    }

    private RewriteResult rewrite(
            String originalText,
            String promptTemplate,
            double temperature,
            int maxLength,
            String personalityName
    ) {
        String prompt = PromptTemplates.render(promptTemplate, originalText);
        try {
            String response = textTransformer.transform(prompt, temperature, maxLength);
            String cleaned = clean(response);
            if (cleaned.isEmpty()) {
                throw new TextTransformException("Model returned an empty response");
            }
            return RewriteResult.success(originalText, cleaned, personalityName);
        } catch (RuntimeException ex) {
            String error = describe(ex);
            log.warn("Rewrite failed, keeping fallback title: {}", error);
            return RewriteResult.fallback(originalText, fallbackText(originalText), personalityName, error);
        }
    }

    String fallbackText(String originalText) {
        String original = originalText == null ? "" : originalText;
        if (rewriteProperties.getFallbackPolicy() == FallbackPolicy.ORIGINAL_WITH_MARKER) {
            return original + rewriteProperties.getFallbackMarker();
        }
        return original;
    }

    private String clean(String response) {
        if (response == null) {
            return "";
        }
        String cleaned = response.strip();
        if (!rewriteProperties.isStripQuotes()) {
            return cleaned;
        }
        while (cleaned.length() >= 2
                && QUOTE_CHARACTERS.indexOf(cleaned.charAt(0)) >= 0
                && QUOTE_CHARACTERS.indexOf(cleaned.charAt(cleaned.length() - 1)) >= 0) {
            cleaned = cleaned.substring(1, cleaned.length() - 1).strip();
        }
        return cleaned;
    }

    private static String describe(RuntimeException ex) {
        return StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
