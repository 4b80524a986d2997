package com.threadsmith.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.threadsmith.config.RedditProperties;
import com.threadsmith.model.SortMode;
import com.threadsmith.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Live Reddit client. Uses the OAuth API with an application-only token when client
 * credentials are configured, and the public {@code .json} listing endpoints otherwise.
 */
@Component
@ConditionalOnProperty(prefix = "threadsmith.reddit", name = "mode", havingValue = "live", matchIfMissing = true)
public class RedditApiClient implements RedditClient {

    private static final Logger log = LoggerFactory.getLogger(RedditApiClient.class);
    private static final long TOKEN_EXPIRY_MARGIN_SECONDS = 60;

    private final RestClient restClient;
    private final RedditProperties redditProperties;
    private final Clock clock;

    private String accessToken;
    private Instant accessTokenExpiresAt = Instant.EPOCH;

    @Autowired
    public RedditApiClient(@Qualifier("redditRestClient") RestClient restClient, RedditProperties redditProperties) {
        this(restClient, redditProperties, Clock.systemUTC());
    }

    RedditApiClient(RestClient restClient, RedditProperties redditProperties, Clock clock) {
        this.restClient = restClient;
        this.redditProperties = redditProperties;
        this.clock = clock;
    }

    @Override
    public List<RedditPost> fetchPosts(String subreddit, SortMode sort, TimeWindow timeWindow, int limit) {
        UriComponentsBuilder uri = listingUri("/r/" + subreddit + "/" + sort.value())
                .queryParam("limit", limit)
                .queryParam("raw_json", 1);
        if (sort == SortMode.TOP && timeWindow != null) {
            uri.queryParam("t", timeWindow.value());
        }

        JsonNode body = get(uri.build().toUri());
        List<RedditPost> posts = new ArrayList<>();
        if (body == null) {
            return posts;
        }
        for (JsonNode child : body.path("data").path("children")) {
            JsonNode data = child.path("data");
            if (data.isMissingNode() || !data.hasNonNull("id")) {
                continue;
            }
            posts.add(toPost(data));
        }
        log.debug("Fetched {} posts from r/{} ({})", posts.size(), subreddit, sort.value());
        return posts;
    }

    @Override
    public boolean subredditExists(String subreddit) {
        URI uri = listingUri("/r/" + subreddit + "/about").queryParam("raw_json", 1).build().toUri();
        try {
            JsonNode body = get(uri);
            // Unknown names redirect to a search listing instead of a t5 subreddit object
            return body != null
                    && "t5".equals(body.path("kind").asText())
                    && body.path("data").hasNonNull("display_name");
        } catch (HttpClientErrorException ex) {
            if (ex.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)
                    || ex.getStatusCode().isSameCodeAs(HttpStatus.FORBIDDEN)) {
                log.debug("Subreddit r/{} not reachable: {}", subreddit, ex.getStatusCode());
                return false;
            }
            throw ex;
        }
    }

    private JsonNode get(URI uri) {
        RestClient.RequestHeadersSpec<?> request = restClient.get()
                .uri(uri)
                .accept(MediaType.APPLICATION_JSON);
        if (usesOAuth()) {
            request.header(HttpHeaders.AUTHORIZATION, "Bearer " + currentAccessToken());
        }
        return request.retrieve().body(JsonNode.class);
    }

    private UriComponentsBuilder listingUri(String path) {
        if (usesOAuth()) {
            return UriComponentsBuilder.fromUriString(redditProperties.getOauthBaseUrl()).path(path);
        }
        return UriComponentsBuilder.fromUriString(redditProperties.getPublicBaseUrl()).path(path + ".json");
    }

    private boolean usesOAuth() {
        return StringUtils.hasText(redditProperties.getClientId())
                && StringUtils.hasText(redditProperties.getClientSecret());
    }

    private synchronized String currentAccessToken() {
        Instant now = clock.instant();
        if (accessToken != null && now.isBefore(accessTokenExpiresAt)) {
            return accessToken;
        }

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        JsonNode token = restClient.post()
                .uri(redditProperties.getPublicBaseUrl() + "/api/v1/access_token")
                .headers(headers -> headers.setBasicAuth(
                        redditProperties.getClientId(), redditProperties.getClientSecret()))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(form)
                .retrieve()
                .body(JsonNode.class);
        if (token == null || !token.hasNonNull("access_token")) {
            throw new IllegalStateException("Reddit token endpoint returned no access_token");
        }

        long expiresIn = token.path("expires_in").asLong(3600);
        accessToken = token.get("access_token").asText();
        accessTokenExpiresAt = now.plusSeconds(Math.max(0, expiresIn - TOKEN_EXPIRY_MARGIN_SECONDS));
        log.info("Obtained Reddit application token valid for {}s", expiresIn);
        return accessToken;
    }

    private static RedditPost toPost(JsonNode data) {
        String author = data.path("author").isTextual() ? data.path("author").asText() : null;
        return new RedditPost(
                data.path("id").asText(),
                data.path("title").asText(""),
                data.path("score").asInt(0),
                data.path("url").asText(""),
                data.path("permalink").asText(""),
                data.path("created_utc").asDouble(0),
                author,
                data.path("num_comments").asInt(0),
                data.path("upvote_ratio").asDouble(0),
                data.path("selftext").asText(""),
                data.path("is_video").asBoolean(false),
                data.path("over_18").asBoolean(false)
        );
    }
}
