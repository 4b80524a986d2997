package com.threadsmith.web;

import com.threadsmith.config.ThreadsmithRuntimeProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Guards every {@code /api} route except the liveness probe with {@link ApiKeyInterceptor}.
 */
@Configuration
public class ApiKeyConfig implements WebMvcConfigurer {

    private final ThreadsmithRuntimeProperties runtimeProperties;

    public ApiKeyConfig(ThreadsmithRuntimeProperties runtimeProperties) {
        this.runtimeProperties = runtimeProperties;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new ApiKeyInterceptor(runtimeProperties))
                .addPathPatterns("/api/**")
                .excludePathPatterns("/api/health");
    }
}
