package com.threadsmith.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Outbound HTTP clients, one per upstream so each carries its own timeout.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    @Qualifier("redditRestClient")
    public RestClient redditRestClient(RestClient.Builder builder, RedditProperties redditProperties) {
        return builder.clone()
                .requestFactory(requestFactory(redditProperties.getTimeout()))
                .defaultHeader("User-Agent", redditProperties.getUserAgent())
                .build();
    }

    @Bean
    @Qualifier("workflowRestClient")
    public RestClient workflowRestClient(RestClient.Builder builder, WorkflowWebhookProperties webhookProperties) {
        return builder.clone()
                .requestFactory(requestFactory(webhookProperties.getTimeout()))
                .build();
    }

    private static JdkClientHttpRequestFactory requestFactory(Duration timeout) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(timeout);
        return factory;
    }
}
