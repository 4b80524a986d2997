package com.threadsmith.service;

import com.threadsmith.config.RewriteProperties;
import com.threadsmith.model.RewriteResult;
import com.threadsmith.web.RequestValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites caller-supplied titles with a free-form instruction instead of a stored
 * personality. Used by {@code /api/enhance-titles} and by the chat bot's follow-up step.
 */
@Service
public class TitleEnhancementService {

    private static final Logger log = LoggerFactory.getLogger(TitleEnhancementService.class);

    private final RewriteEngine rewriteEngine;
    private final RewriteProperties rewriteProperties;

    public TitleEnhancementService(RewriteEngine rewriteEngine, RewriteProperties rewriteProperties) {
        this.rewriteEngine = rewriteEngine;
        this.rewriteProperties = rewriteProperties;
    }

    public List<RewriteResult> rewriteTitles(List<String> titles, String instruction) {
        String template = PromptTemplates.fromInstruction(instruction);
        List<RewriteResult> results = new ArrayList<>(titles.size());
        for (String title : titles) {
            results.add(rewriteEngine.rewrite(
                    title,
                    template,
                    rewriteProperties.getDefaultTemperature(),
                    rewriteProperties.getDefaultMaxLength()
            ));
        }
        long failed = results.stream().filter(RewriteResult::failed).count();
        log.info("Rewrote {} titles ({} kept original)", results.size(), failed);
        return results;
    }

    /**
     * Rewrites the {@code title} of every entry and returns copies carrying
     * {@code original_title}, {@code ai_title} and, on fallback, {@code rewrite_error}.
     *
     * @throws RequestValidationException when an entry has no usable title
     */
    public List<Map<String, Object>> enhance(List<Map<String, Object>> entries, String instruction) {
        List<String> titles = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            Map<String, Object> entry = entries.get(i);
            Object title = entry == null ? null : entry.get("title");
            if (!(title instanceof String text) || text.isBlank()) {
                throw new RequestValidationException("titles[" + i + "].title is required");
            }
            titles.add(text);
        }

        List<RewriteResult> rewrites = rewriteTitles(titles, instruction);
        List<Map<String, Object>> enhanced = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            RewriteResult rewrite = rewrites.get(i);
            Map<String, Object> copy = new LinkedHashMap<>(entries.get(i));
            copy.put("original_title", rewrite.originalText());
            copy.put("ai_title", rewrite.rewrittenText());
            if (rewrite.failed()) {
                copy.put("rewrite_error", rewrite.error());
            }
            enhanced.add(copy);
        }
        return enhanced;
    }
}
