package com.threadsmith.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.threadsmith.model.Personality;

import java.time.OffsetDateTime;
import java.util.List;

public final class PersonalityResponses {

    private PersonalityResponses() {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PersonalityResponse(
            Long id,
            String name,
            String description,
            String promptTemplate,
            Double temperature,
            Integer maxTokens,
            @JsonProperty("is_default") boolean isDefault,
            OffsetDateTime createdAt
    ) {
        public static PersonalityResponse from(Personality personality) {
            return new PersonalityResponse(
                    personality.getId(),
                    personality.getName(),
                    personality.getDescription(),
                    personality.getPromptTemplate(),
                    personality.getTemperature(),
                    personality.getMaxTokens(),
                    Boolean.TRUE.equals(personality.getIsDefault()),
                    personality.getCreatedAt()
            );
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PersonalityListResponse(
            Long telegramId,
            List<PersonalityResponse> personalities
    ) {
    }

    public record PersonalityDeletedResponse(
            String status,
            String message
    ) {
    }
}
