package com.threadsmith.service;

import com.threadsmith.config.RewriteProperties;
import com.threadsmith.provider.TextTransformException;
import com.threadsmith.provider.TextTransformer;
import com.threadsmith.web.RequestValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TitleEnhancementServiceTest {

    @Mock
    private TextTransformer textTransformer;

    private TitleEnhancementService service;

    @BeforeEach
    void setUp() {
        RewriteProperties properties = new RewriteProperties();
        service = new TitleEnhancementService(new RewriteEngine(textTransformer, properties), properties);
    }

    @Test
    void enhance_appendsTitleToInstructionAndEchoesExtraFields() {
        when(textTransformer.transform("Make it clickbait\n\nTitle: Rust 2.0 released", 0.7, 100))
                .thenReturn("You won't believe Rust 2.0");
        Map<String, Object> entry = new HashMap<>();
        entry.put("title", "Rust 2.0 released");
        entry.put("score", 512);

        List<Map<String, Object>> results = service.enhance(List.of(entry), "Make it clickbait");

        Map<String, Object> result = results.get(0);
        assertEquals("You won't believe Rust 2.0", result.get("ai_title"));
        assertEquals("Rust 2.0 released", result.get("original_title"));
        assertEquals(512, result.get("score"));
        assertFalse(result.containsKey("rewrite_error"));
    }

    @Test
    void enhance_marksFallbackEntries() {
        when(textTransformer.transform("Shorter: please\n\nTitle: A", 0.7, 100))
                .thenThrow(new TextTransformException("rate limited"));

        List<Map<String, Object>> results = service.enhance(List.of(Map.of("title", "A")), "Shorter: please");

        assertEquals("A", results.get(0).get("ai_title"));
        assertEquals("rate limited", results.get(0).get("rewrite_error"));
    }

    @Test
    void enhance_rejectsEntryWithoutTitle() {
        assertThrows(RequestValidationException.class,
                () -> service.enhance(List.of(Map.of("score", 1)), "anything"));
        verifyNoInteractions(textTransformer);
    }
}
