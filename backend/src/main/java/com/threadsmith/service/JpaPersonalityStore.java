package com.threadsmith.service;

import com.threadsmith.model.AppUser;
import com.threadsmith.model.Personality;
import com.threadsmith.model.PersonalityDraft;
import com.threadsmith.repository.AppUserRepository;
import com.threadsmith.repository.PersonalityRepository;
import com.threadsmith.web.DuplicatePersonalityNameException;
import com.threadsmith.web.LastPersonalityException;
import com.threadsmith.web.PersonalityNotFoundException;
import com.threadsmith.web.RequestValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Relational personality store. Writes that touch the default flag lock the owning user
 * row so concurrent requests for one user serialize.
 */
@Service
public class JpaPersonalityStore implements PersonalityStore {

    private static final Logger log = LoggerFactory.getLogger(JpaPersonalityStore.class);

    static final String DEFAULT_DESCRIPTION = "Default friendly personality";
    static final double DEFAULT_TEMPERATURE = 0.7;
    static final int DEFAULT_MAX_TOKENS = 100;

    private final AppUserRepository appUserRepository;
    private final PersonalityRepository personalityRepository;

    public JpaPersonalityStore(AppUserRepository appUserRepository, PersonalityRepository personalityRepository) {
        this.appUserRepository = appUserRepository;
        this.personalityRepository = personalityRepository;
    }

    @Override
    @Transactional
    public AppUser getOrCreateUser(long telegramId, String username, String firstName) {
        int inserted = appUserRepository.insertIfAbsent(telegramId, username, firstName);
        AppUser user = appUserRepository.findById(telegramId)
                .orElseThrow(() -> new IllegalStateException("User " + telegramId + " vanished after insert"));
        if (inserted > 0) {
            personalityRepository.save(seedDefault(user));
            log.info("Created user {} with default personality", telegramId);
        }
        return user;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Personality> listPersonalities(long telegramId) {
        return personalityRepository.findByUserTelegramIdOrderByIdAsc(telegramId);
    }

    @Override
    @Transactional
    public Personality createPersonality(long telegramId, PersonalityDraft draft) {
        validate(draft);
        getOrCreateUser(telegramId, null, null);
        AppUser user = lockUser(telegramId);

        String name = draft.name().trim();
        if (personalityRepository.existsByUserTelegramIdAndName(telegramId, name)) {
            throw new DuplicatePersonalityNameException(name);
        }
        if (draft.isDefault()) {
            int demoted = personalityRepository.clearDefaultForUser(telegramId);
            log.debug("Demoted {} default personalities for user {}", demoted, telegramId);
        }

        Personality personality = new Personality();
        personality.setUser(user);
        personality.setName(name);
        personality.setDescription(draft.description());
        personality.setPromptTemplate(draft.promptTemplate());
        personality.setTemperature(draft.temperature());
        personality.setMaxTokens(draft.maxLength());
        personality.setIsDefault(draft.isDefault());
        personality.setCreatedAt(OffsetDateTime.now());
        Personality saved = personalityRepository.save(personality);
        log.info("Created personality '{}' for user {} (default={})", name, telegramId, draft.isDefault());
        return saved;
    }

    @Override
    @Transactional(readOnly = true)
    public Personality resolve(long telegramId, String nameOrDefault) {
        if (!StringUtils.hasText(nameOrDefault) || DEFAULT_PERSONALITY_NAME.equals(nameOrDefault)) {
            return personalityRepository.findDefaultByUserTelegramId(telegramId)
                    .orElseThrow(() -> new PersonalityNotFoundException(DEFAULT_PERSONALITY_NAME));
        }
        return personalityRepository.findByUserTelegramIdAndName(telegramId, nameOrDefault)
                .orElseThrow(() -> new PersonalityNotFoundException(nameOrDefault));
    }

    @Override
    @Transactional
    public void deletePersonality(long telegramId, String name) {
        appUserRepository.findByTelegramIdForUpdate(telegramId)
                .orElseThrow(() -> new PersonalityNotFoundException(name));
        Personality personality = personalityRepository.findByUserTelegramIdAndName(telegramId, name)
                .orElseThrow(() -> new PersonalityNotFoundException(name));
        if (personalityRepository.countByUserTelegramId(telegramId) <= 1) {
            throw new LastPersonalityException(name);
        }

        boolean wasDefault = Boolean.TRUE.equals(personality.getIsDefault());
        personalityRepository.delete(personality);
        personalityRepository.flush();
        log.info("Deleted personality '{}' for user {}", name, telegramId);

        if (wasDefault) {
            List<Personality> remaining = personalityRepository.findByUserTelegramIdOrderByIdAsc(telegramId);
            Personality promoted = remaining.get(0);
            promoted.setIsDefault(true);
            personalityRepository.save(promoted);
            log.info("Promoted personality '{}' to default for user {}", promoted.getName(), telegramId);
        }
    }

    private AppUser lockUser(long telegramId) {
        return appUserRepository.findByTelegramIdForUpdate(telegramId)
                .orElseThrow(() -> new IllegalStateException("User " + telegramId + " not found after creation"));
    }

    private static Personality seedDefault(AppUser user) {
        Personality personality = new Personality();
        personality.setUser(user);
        personality.setName(DEFAULT_PERSONALITY_NAME);
        personality.setDescription(DEFAULT_DESCRIPTION);
        personality.setPromptTemplate(PromptTemplates.DEFAULT_TEMPLATE);
        personality.setTemperature(DEFAULT_TEMPERATURE);
        personality.setMaxTokens(DEFAULT_MAX_TOKENS);
        personality.setIsDefault(true);
        personality.setCreatedAt(OffsetDateTime.now());
        return personality;
    }

    private static void validate(PersonalityDraft draft) {
        if (draft == null || !StringUtils.hasText(draft.name())) {
            throw new RequestValidationException("name is required");
        }
        if (!StringUtils.hasText(draft.promptTemplate())) {
            throw new RequestValidationException("prompt_template is required");
        }
        if (draft.temperature() < 0.0 || draft.temperature() > 2.0) {
            throw new RequestValidationException("temperature must be between 0.0 and 2.0");
        }
        if (draft.maxLength() < 1) {
            throw new RequestValidationException("max_tokens must be positive");
        }
    }
}
