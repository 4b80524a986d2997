package com.threadsmith.service;

import com.threadsmith.model.AppUser;
import com.threadsmith.model.Personality;
import com.threadsmith.model.PersonalityDraft;

import java.util.List;

/**
 * Persistence of users and their rewrite personalities. Every user has exactly one
 * default personality from the moment the user exists.
 */
public interface PersonalityStore {

    String DEFAULT_PERSONALITY_NAME = "default";

    /**
     * Idempotently ensures the user exists, seeding the {@code default} personality with it.
     */
    default AppUser getOrCreateUser(long telegramId) {
        return getOrCreateUser(telegramId, null, null);
    }

    AppUser getOrCreateUser(long telegramId, String username, String firstName);

    List<Personality> listPersonalities(long telegramId);

    /**
     * @throws com.threadsmith.web.DuplicatePersonalityNameException when the name is taken for this user
     */
    Personality createPersonality(long telegramId, PersonalityDraft draft);

    /**
     * Resolves {@code "default"} to the user's default personality and any other name exactly.
     *
     * @throws com.threadsmith.web.PersonalityNotFoundException when nothing matches
     */
    Personality resolve(long telegramId, String nameOrDefault);

    /**
     * @throws com.threadsmith.web.PersonalityNotFoundException when the name does not exist
     * @throws com.threadsmith.web.LastPersonalityException when it is the user's only personality
     */
    void deletePersonality(long telegramId, String name);
}
