package com.threadsmith.service;

import com.threadsmith.controller.dto.ScrapeRequest;
import com.threadsmith.model.Personality;
import com.threadsmith.model.PersonalityDraft;
import com.threadsmith.web.LastPersonalityException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE, properties = {
        "spring.jpa.hibernate.ddl-auto=validate",
        "spring.flyway.enabled=true",
        "threadsmith.reddit.mode=mock",
        "threadsmith.rewrite.mode=mock",
        "threadsmith.rate-limit.mode=memory",
        "threadsmith.telegram.enabled=false"
})
class JpaPersonalityStoreIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    @DynamicPropertySource
    static void datasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @Autowired
    private PersonalityStore personalityStore;

    @Autowired
    private ScrapeService scrapeService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @AfterEach
    void cleanUp() {
        jdbcTemplate.update("DELETE FROM users");
    }

    @Test
    void getOrCreateUserIsIdempotentAndSeedsOneDefault() {
        personalityStore.getOrCreateUser(1001L, "ada", "Ada");
        personalityStore.getOrCreateUser(1001L, "ada", "Ada");

        List<Personality> personalities = personalityStore.listPersonalities(1001L);
        assertEquals(1, personalities.size());
        assertEquals("default", personalities.get(0).getName());
        assertTrue(personalities.get(0).getIsDefault());
        assertEquals(1, count("SELECT COUNT(*) FROM users WHERE telegram_id = 1001"));
    }

    @Test
    void newDefaultDemotesPreviousOne() {
        personalityStore.getOrCreateUser(1002L);
        personalityStore.createPersonality(1002L, draft("pirate", true));

        assertEquals("pirate", personalityStore.resolve(1002L, "default").getName());
        assertEquals(1, count("SELECT COUNT(*) FROM ai_personalities p WHERE p.user_id = 1002 AND p.is_default"));
    }

    @Test
    void deletingDefaultPromotesOldestRemaining() {
        personalityStore.getOrCreateUser(1003L);
        personalityStore.createPersonality(1003L, draft("pirate", false));
        personalityStore.createPersonality(1003L, draft("poet", false));

        personalityStore.deletePersonality(1003L, "default");

        assertEquals("pirate", personalityStore.resolve(1003L, null).getName());
        personalityStore.deletePersonality(1003L, "pirate");
        assertThrows(LastPersonalityException.class, () -> personalityStore.deletePersonality(1003L, "poet"));
    }

    @Test
    void concurrentDefaultCreationsLeaveExactlyOneDefault() throws Exception {
        personalityStore.getOrCreateUser(1004L);
        int writers = 6;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Personality>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String name = "style-" + i;
                Callable<Personality> task = () -> {
                    start.await();
                    return personalityStore.createPersonality(1004L, draft(name, true));
                };
                futures.add(executor.submit(task));
            }
            start.countDown();
            for (Future<Personality> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(writers + 1, personalityStore.listPersonalities(1004L).size());
        assertEquals(1, count("SELECT COUNT(*) FROM ai_personalities p WHERE p.user_id = 1004 AND p.is_default"));
    }

    @Test
    void scrapeWithMockProvidersSeedsUserAndRewritesEveryPost() {
        ScrapeService.ScrapeOutcome outcome = scrapeService.scrape(
                new ScrapeRequest("r/python", 3, "hot", null, 1005L, null, null));

        assertEquals(HttpStatus.OK, outcome.status());
        assertEquals(3, outcome.response().results().size());
        outcome.response().results().forEach(post -> {
            assertEquals("python", post.post().subreddit());
            assertEquals("default", post.personalityUsed());
            assertNull(post.rewriteError());
            assertFalse(post.aiTitle().isBlank());
        });
        assertEquals(1, personalityStore.listPersonalities(1005L).size());
    }

    private int count(String sql) {
        Integer value = jdbcTemplate.queryForObject(sql, Integer.class);
        return value == null ? 0 : value;
    }

    private static PersonalityDraft draft(String name, boolean isDefault) {
        return new PersonalityDraft(name, name + " voice", "Rewrite as " + name + ": {original_title}", 0.9, 80, isDefault);
    }
}
