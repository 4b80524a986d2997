package com.threadsmith.controller;

import com.threadsmith.controller.dto.EnhanceTitlesRequest;
import com.threadsmith.controller.dto.EnhanceTitlesResponse;
import com.threadsmith.controller.dto.ScrapeRequest;
import com.threadsmith.controller.dto.ScrapeResponse;
import com.threadsmith.service.ScrapeService;
import com.threadsmith.service.TitleEnhancementService;
import com.threadsmith.web.ApiExceptionHandler;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for fetching subreddit posts and rewriting titles.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ScrapeController {

    private static final Logger log = LoggerFactory.getLogger(ScrapeController.class);
    private static final String MALFORMED_BODY = "Malformed request body";

    private final ScrapeService scrapeService;
    private final TitleEnhancementService titleEnhancementService;

    /**
     * Fetch posts and rewrite their titles with the caller's personality.
     *
     * @param request Scrape parameters
     * @return Scrape envelope, {@code failed} with the matching status when the request was rejected
     */
    @PostMapping("/scrape")
    public ResponseEntity<ScrapeResponse> scrape(@RequestBody ScrapeRequest request) {
        ScrapeService.ScrapeOutcome outcome = scrapeService.scrape(request);
        return ResponseEntity.status(outcome.status()).body(outcome.response());
    }

    /**
     * Fetch posts without touching users or the model.
     */
    @PostMapping("/scrape-simple")
    public ResponseEntity<ScrapeResponse> scrapeSimple(@RequestBody ScrapeRequest request) {
        ScrapeService.ScrapeOutcome outcome = scrapeService.scrapeSimple(request);
        return ResponseEntity.status(outcome.status()).body(outcome.response());
    }

    @PostMapping("/enhance-titles")
    public ResponseEntity<EnhanceTitlesResponse> enhanceTitles(@Valid @RequestBody EnhanceTitlesRequest request) {
        List<Map<String, Object>> results = titleEnhancementService.enhance(request.titles(), request.prompt());
        return ResponseEntity.ok(new EnhanceTitlesResponse(
                "completed",
                "Enhanced " + results.size() + " titles",
                results
        ));
    }

    /**
     * Unreadable bodies on the scrape routes still get a {@code failed} scrape envelope.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<?> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        if (request.getRequestURI().endsWith("/enhance-titles")) {
            return ResponseEntity.badRequest()
                    .body(new ApiExceptionHandler.ApiErrorResponse("validation_error", MALFORMED_BODY));
        }
        String taskId = UUID.randomUUID().toString();
        log.warn("Scrape task {} rejected: unreadable request body", taskId);
        return ResponseEntity.badRequest().body(ScrapeResponse.failed(taskId, null, null, MALFORMED_BODY));
    }
}
