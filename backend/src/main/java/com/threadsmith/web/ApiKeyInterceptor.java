package com.threadsmith.web;

import com.threadsmith.config.ThreadsmithRuntimeProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rejects API calls whose static key header does not match the configured secret.
 * When no secret is configured every call is let through.
 */
public class ApiKeyInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyInterceptor.class);

    private final ThreadsmithRuntimeProperties runtimeProperties;
    private final AtomicBoolean openAccessLogged = new AtomicBoolean();

    public ApiKeyInterceptor(ThreadsmithRuntimeProperties runtimeProperties) {
        this.runtimeProperties = runtimeProperties;
    }

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response, @NonNull Object handler) {
        ThreadsmithRuntimeProperties.Security security = runtimeProperties.getSecurity();
        if (!StringUtils.hasText(security.getApiKey())) {
            if (openAccessLogged.compareAndSet(false, true)) {
                log.warn("threadsmith.security.api-key is blank; API routes accept unauthenticated calls");
            }
            return true;
        }

        String presented = request.getHeader(security.getHeaderName());
        if (presented == null || !constantTimeEquals(presented, security.getApiKey())) {
            log.warn("Rejected {} {}: missing or invalid {}", request.getMethod(), request.getRequestURI(),
                    security.getHeaderName());
            throw new InvalidApiKeyException();
        }
        return true;
    }

    private static boolean constantTimeEquals(String presented, String expected) {
        return MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
