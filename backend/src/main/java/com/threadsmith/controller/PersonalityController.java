package com.threadsmith.controller;

import com.threadsmith.controller.dto.PersonalityRequests.CreatePersonalityRequest;
import com.threadsmith.controller.dto.PersonalityRequests.DeletePersonalityRequest;
import com.threadsmith.controller.dto.PersonalityResponses.PersonalityDeletedResponse;
import com.threadsmith.controller.dto.PersonalityResponses.PersonalityListResponse;
import com.threadsmith.controller.dto.PersonalityResponses.PersonalityResponse;
import com.threadsmith.model.Personality;
import com.threadsmith.model.PersonalityDraft;
import com.threadsmith.service.PersonalityStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for managing a user's rewrite personalities.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class PersonalityController {

    private static final double DEFAULT_TEMPERATURE = 0.7;
    private static final int DEFAULT_MAX_TOKENS = 100;

    private final PersonalityStore personalityStore;

    /**
     * List personalities, creating the user and its default personality on first contact.
     */
    @GetMapping("/personalities")
    public ResponseEntity<PersonalityListResponse> list(@RequestParam("telegram_id") Long telegramId) {
        personalityStore.getOrCreateUser(telegramId);
        List<PersonalityResponse> personalities = personalityStore.listPersonalities(telegramId).stream()
                .map(PersonalityResponse::from)
                .toList();
        return ResponseEntity.ok(new PersonalityListResponse(telegramId, personalities));
    }

    @PostMapping("/personality")
    public ResponseEntity<PersonalityResponse> create(@Valid @RequestBody CreatePersonalityRequest request) {
        PersonalityDraft draft = new PersonalityDraft(
                request.name(),
                request.description(),
                request.promptTemplate(),
                request.temperature() != null ? request.temperature() : DEFAULT_TEMPERATURE,
                request.maxTokens() != null ? request.maxTokens() : DEFAULT_MAX_TOKENS,
                Boolean.TRUE.equals(request.isDefault())
        );
        Personality created = personalityStore.createPersonality(request.telegramId(), draft);
        return ResponseEntity.status(HttpStatus.CREATED).body(PersonalityResponse.from(created));
    }

    @PostMapping("/personality/delete")
    public ResponseEntity<PersonalityDeletedResponse> delete(@Valid @RequestBody DeletePersonalityRequest request) {
        personalityStore.deletePersonality(request.telegramId(), request.name());
        return ResponseEntity.ok(new PersonalityDeletedResponse(
                "deleted",
                "Personality '" + request.name() + "' deleted"
        ));
    }
}
