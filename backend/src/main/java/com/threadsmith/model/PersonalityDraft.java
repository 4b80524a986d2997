package com.threadsmith.model;

/**
 * Fields for a personality that does not exist yet.
 */
public record PersonalityDraft(
        String name,
        String description,
        String promptTemplate,
        double temperature,
        int maxLength,
        boolean isDefault
) {}
