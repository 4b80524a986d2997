package com.threadsmith.service;

import com.threadsmith.config.RewriteProperties;
import com.threadsmith.controller.dto.ScrapeRequest;
import com.threadsmith.controller.dto.ScrapeResponse;
import com.threadsmith.controller.dto.ScrapedPost;
import com.threadsmith.model.AppUser;
import com.threadsmith.model.Personality;
import com.threadsmith.model.RedditItem;
import com.threadsmith.provider.TextTransformException;
import com.threadsmith.provider.TextTransformer;
import com.threadsmith.web.PersonalityNotFoundException;
import com.threadsmith.web.SubredditNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScrapeServiceTest {

    private static final long USER_ID = 77L;

    @Mock
    private PersonalityStore personalityStore;

    @Mock
    private PostFetchService postFetchService;

    @Mock
    private TextTransformer textTransformer;

    private ScrapeService scrapeService;
    private Personality personality;

    @BeforeEach
    void setUp() {
        RewriteEngine rewriteEngine = new RewriteEngine(textTransformer, new RewriteProperties());
        scrapeService = new ScrapeService(personalityStore, postFetchService, rewriteEngine);

        personality = new Personality();
        personality.setName("default");
        personality.setPromptTemplate("Rewrite: {original_title}");
        personality.setTemperature(0.7);
        personality.setMaxTokens(100);
        personality.setIsDefault(true);
    }

    @Test
    void scrape_returnsOneRecordPerItemEvenWhenEveryRewriteFails() {
        stubUserAndPersonality();
        when(postFetchService.fetch("python", "hot", "week", 4)).thenReturn(items(4));
        when(textTransformer.transform(anyString(), anyDouble(), anyInt()))
                .thenThrow(new TextTransformException("model unavailable"));

        ScrapeService.ScrapeOutcome outcome = scrapeService.scrape(request(4, true));

        ScrapeResponse response = outcome.response();
        assertEquals(HttpStatus.OK, outcome.status());
        assertEquals(ScrapeResponse.STATUS_COMPLETED, response.status());
        assertEquals(4, response.results().size());
        for (ScrapedPost post : response.results()) {
            assertEquals("model unavailable", post.rewriteError());
            assertEquals(post.originalTitle(), post.aiTitle());
            assertFalse(post.aiTitle().isBlank());
        }
    }

    @Test
    void scrape_rewritesTitlesInFetchOrder() {
        stubUserAndPersonality();
        when(postFetchService.fetch("python", "hot", "week", 2)).thenReturn(items(2));
        when(textTransformer.transform("Rewrite: Title 0", 0.7, 100)).thenReturn("Fresh 0");
        when(textTransformer.transform("Rewrite: Title 1", 0.7, 100)).thenReturn("Fresh 1");

        ScrapeResponse response = scrapeService.scrape(request(2, true)).response();

        assertEquals("Fresh 0", response.results().get(0).aiTitle());
        assertEquals("Fresh 1", response.results().get(1).aiTitle());
        assertEquals("default", response.results().get(0).personalityUsed());
        assertNull(response.results().get(0).rewriteError());
        assertEquals(USER_ID, response.telegramId());
        assertNotNull(response.taskId());
    }

    @Test
    void scrape_withoutAiSkipsPersonalityAndModel() {
        when(personalityStore.getOrCreateUser(USER_ID)).thenReturn(user());
        when(postFetchService.fetch("python", "hot", "week", 3)).thenReturn(items(3));

        ScrapeResponse response = scrapeService.scrape(request(3, false)).response();

        assertEquals(3, response.results().size());
        assertNull(response.results().get(0).aiTitle());
        verify(personalityStore, never()).resolve(anyLong(), anyString());
        verifyNoInteractions(textTransformer);
    }

    @Test
    void scrape_unknownPersonalityAbortsBeforeFetching() {
        when(personalityStore.getOrCreateUser(USER_ID)).thenReturn(user());
        when(personalityStore.resolve(USER_ID, "pirate")).thenThrow(new PersonalityNotFoundException("pirate"));

        ScrapeRequest request = new ScrapeRequest("python", 5, "hot", "week", USER_ID, "pirate", true);
        ScrapeService.ScrapeOutcome outcome = scrapeService.scrape(request);

        assertEquals(HttpStatus.NOT_FOUND, outcome.status());
        assertEquals(ScrapeResponse.STATUS_FAILED, outcome.response().status());
        assertNull(outcome.response().results());
        verifyNoInteractions(postFetchService);
    }

    @Test
    void scrape_missingTelegramIdIsValidationFailure() {
        ScrapeRequest request = new ScrapeRequest("python", 5, null, null, null, null, null);

        ScrapeService.ScrapeOutcome outcome = scrapeService.scrape(request);

        assertEquals(HttpStatus.BAD_REQUEST, outcome.status());
        assertEquals("telegram_id is required", outcome.response().message());
        verifyNoInteractions(personalityStore);
    }

    @Test
    void scrape_upstreamErrorBecomesBadGatewayWithErrorText() {
        stubUserAndPersonality();
        when(postFetchService.fetch("python", "hot", "week", 5))
                .thenThrow(new IllegalStateException("Connection reset"));

        ScrapeService.ScrapeOutcome outcome = scrapeService.scrape(request(5, true));

        assertEquals(HttpStatus.BAD_GATEWAY, outcome.status());
        assertEquals("Connection reset", outcome.response().message());
    }

    @Test
    void scrapeSimple_fetchesWithoutTouchingUsers() {
        when(postFetchService.fetch("python", "new", "week", 10)).thenReturn(items(2));

        ScrapeRequest request = new ScrapeRequest("python", null, "new", null, null, null, null);
        ScrapeService.ScrapeOutcome outcome = scrapeService.scrapeSimple(request);

        assertEquals(HttpStatus.OK, outcome.status());
        assertEquals(2, outcome.response().results().size());
        assertTrue(outcome.response().message().contains("r/python"));
        verifyNoInteractions(personalityStore, textTransformer);
    }

    @Test
    void scrapeSimple_missingSubredditKeepsEnvelope() {
        when(postFetchService.fetch("nope", "hot", "week", 10)).thenThrow(new SubredditNotFoundException("nope"));

        ScrapeService.ScrapeOutcome outcome =
                scrapeService.scrapeSimple(new ScrapeRequest("nope", null, null, null, null, null, null));

        assertEquals(HttpStatus.NOT_FOUND, outcome.status());
        assertEquals(ScrapeResponse.STATUS_FAILED, outcome.response().status());
    }

    private void stubUserAndPersonality() {
        when(personalityStore.getOrCreateUser(USER_ID)).thenReturn(user());
        when(personalityStore.resolve(USER_ID, "default")).thenReturn(personality);
    }

    private static AppUser user() {
        AppUser user = new AppUser();
        user.setTelegramId(USER_ID);
        return user;
    }

    private static ScrapeRequest request(int limit, boolean useAi) {
        return new ScrapeRequest("python", limit, "hot", "week", USER_ID, "default", useAi);
    }

    private static List<RedditItem> items(int count) {
        List<RedditItem> items = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            items.add(new RedditItem("id" + i, "Title " + i, 10, "https://example.com/" + i,
                    "https://reddit.com/r/python/comments/id" + i + "/", 1700000000, "author", "python",
                    1, 0.9, "", false, false));
        }
        return items;
    }
}
