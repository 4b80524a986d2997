package com.threadsmith.service;

import org.springframework.util.StringUtils;

/**
 * Prompt template helpers. Templates carry a single {@value #PLACEHOLDER} substitution point.
 */
public final class PromptTemplates {

    public static final String PLACEHOLDER = "{original_title}";

    public static final String DEFAULT_TEMPLATE = """
            Please rewrite the following Reddit post title in a more engaging way while keeping the main points:

            {original_title}

            Make it more conversational and add some personality. Keep the tone friendly and approachable.""";

    private PromptTemplates() {
    }

    /**
     * Substitutes the title. A template without the placeholder is returned unchanged.
     */
    public static String render(String template, String originalText) {
        if (template == null) {
            return originalText;
        }
        return template.replace(PLACEHOLDER, originalText == null ? "" : originalText);
    }

    /**
     * Builds a template from a free-form instruction, appending the title slot when the
     * instruction does not place it itself.
     */
    public static String fromInstruction(String instruction) {
        if (!StringUtils.hasText(instruction)) {
            return DEFAULT_TEMPLATE;
        }
        String trimmed = instruction.trim();
        if (trimmed.contains(PLACEHOLDER)) {
            return trimmed;
        }
        return trimmed + "\n\nTitle: " + PLACEHOLDER;
    }
}
