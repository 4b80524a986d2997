package com.threadsmith.config;

import com.threadsmith.model.FallbackPolicy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Title rewrite pipeline settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "threadsmith.rewrite")
public class RewriteProperties {

    /**
     * {@code live} calls the hosted model, {@code mock} rewrites deterministically.
     */
    private String mode = "live";
    private FallbackPolicy fallbackPolicy = FallbackPolicy.ORIGINAL;
    private String fallbackMarker = " ✨";
    private boolean stripQuotes = true;
    private double defaultTemperature = 0.7;
    private int defaultMaxLength = 100;
}
