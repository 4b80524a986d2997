package com.threadsmith.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public final class PersonalityRequests {

    private PersonalityRequests() {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record CreatePersonalityRequest(
            @NotNull(message = "telegram_id is required")
            Long telegramId,

            @NotBlank(message = "name is required")
            @Size(max = 255, message = "name must be at most 255 characters")
            String name,

            @Size(max = 2000, message = "description must be at most 2000 characters")
            String description,

            @NotBlank(message = "prompt_template is required")
            @Size(max = 4000, message = "prompt_template must be at most 4000 characters")
            String promptTemplate,

            @DecimalMin(value = "0.0", message = "temperature must be at least 0.0")
            @DecimalMax(value = "2.0", message = "temperature must be at most 2.0")
            Double temperature,

            @Min(value = 1, message = "max_tokens must be positive")
            @Max(value = 1000, message = "max_tokens must be at most 1000")
            Integer maxTokens,

            @JsonProperty("is_default")
            Boolean isDefault
    ) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record DeletePersonalityRequest(
            @NotNull(message = "telegram_id is required")
            Long telegramId,

            @NotBlank(message = "name is required")
            String name
    ) {
    }
}
