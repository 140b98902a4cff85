package com.dashkit.queryengine.web;

import com.dashkit.queryengine.api.ErrorResponse;
import com.dashkit.queryengine.config.QueryEngineProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed-window request limit per client address. Requests over the limit get a 429 with a
 * {@code RATE_LIMIT_EXCEEDED} error body and never reach the controllers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RateLimitFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    static final String RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    static final String RESET_HEADER = "X-RateLimit-Reset";
    private static final long MAX_TRACKED_CLIENTS = 100_000;

    private final int maxRequests;
    private final long windowNanos;
    private final Ticker ticker;
    private final ObjectMapper objectMapper;
    private final Cache<String, Window> windows;

    @Autowired
    public RateLimitFilter(QueryEngineProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, Ticker.systemTicker());
    }

    RateLimitFilter(QueryEngineProperties properties, ObjectMapper objectMapper, Ticker ticker) {
        this.maxRequests = properties.getRateLimitMaxRequests();
        this.windowNanos = Math.max(properties.getRateLimitWindow().toNanos(), 1);
        this.ticker = ticker;
        this.objectMapper = objectMapper;
        this.windows = Caffeine.newBuilder()
                .expireAfterWrite(windowNanos, TimeUnit.NANOSECONDS)
                .maximumSize(MAX_TRACKED_CLIENTS)
                .ticker(ticker)
                .build();
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (maxRequests <= 0
                || !(request instanceof HttpServletRequest httpServletRequest)
                || !(response instanceof HttpServletResponse httpServletResponse)
                || HttpMethod.OPTIONS.matches(httpServletRequest.getMethod())) {
            chain.doFilter(request, response);
            return;
        }

        String client = clientKey(httpServletRequest);
        long now = ticker.read();
        Window window = windows.get(client, k -> new Window(now));
        int used = window.count.incrementAndGet();
        long resetSeconds = Math.max(TimeUnit.NANOSECONDS.toSeconds(window.start + windowNanos - now), 0);

        httpServletResponse.setHeader(LIMIT_HEADER, String.valueOf(maxRequests));
        httpServletResponse.setHeader(REMAINING_HEADER, String.valueOf(Math.max(maxRequests - used, 0)));
        httpServletResponse.setHeader(RESET_HEADER, String.valueOf(resetSeconds));

        if (used > maxRequests) {
            log.warn("Rate limit exceeded: client={}, limit={}, uri={}", client, maxRequests, httpServletRequest.getRequestURI());
            reject(httpServletResponse, resetSeconds);
            return;
        }
        chain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, long retryAfterSeconds) throws IOException {
        ErrorResponse error = ErrorResponse.builder()
                .code(RATE_LIMIT_EXCEEDED)
                .message("Too many requests, please try again later")
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(retryAfterSeconds));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), error);
    }

    private static String clientKey(HttpServletRequest request) {
        String address = request.getRemoteAddr();
        return address == null || address.isBlank() ? "anonymous" : address;
    }

    private static final class Window {
        private final long start;
        private final AtomicInteger count = new AtomicInteger();

        private Window(long start) {
            this.start = start;
        }
    }
}
