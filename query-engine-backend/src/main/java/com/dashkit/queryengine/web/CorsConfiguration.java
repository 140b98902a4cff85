package com.dashkit.queryengine.web;

import com.dashkit.queryengine.config.QueryEngineProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.Arrays;

/**
 * Browser access for the dashboard front ends, driven by {@code query-engine.cors-origin}.
 */
@Configuration
@EnableConfigurationProperties(QueryEngineProperties.class)
public class CorsConfiguration implements WebMvcConfigurer {

    private final QueryEngineProperties properties;

    public CorsConfiguration(QueryEngineProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        CorsRegistration registration = registry.addMapping("/**");
        String origin = properties.getCorsOrigin();
        if (origin == null || origin.isBlank() || "*".equals(origin.trim())) {
            // credentials are allowed, so a literal "*" origin is not accepted by Spring
            registration.allowedOriginPatterns("*");
        } else {
            registration.allowedOrigins(Arrays.stream(origin.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toArray(String[]::new));
        }
        registration
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("Content-Type", "Authorization", TraceIdFilter.TENANT_ID_HEADER, TraceIdFilter.TRACE_ID_HEADER)
                .exposedHeaders(TraceIdFilter.TRACE_ID_HEADER)
                .allowCredentials(true);
    }
}
