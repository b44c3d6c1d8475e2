package com.ethixai.drift.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

@Component
@Slf4j
@Order(Ordered.LOWEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final long SLOW_REQUEST_MS = 2_000;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        // scraped every few seconds
        return request.getRequestURI().startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long startedAt = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
            String query = request.getQueryString() == null ? "" : "?" + request.getQueryString();
            if (elapsedMs >= SLOW_REQUEST_MS) {
                // cycle and cleanup triggers run inline and can legitimately take a while
                log.warn("Slow admin request {} {}{} status={} elapsedMs={}", request.getMethod(),
                        request.getRequestURI(), query, response.getStatus(), elapsedMs);
            } else {
                log.info("Admin request {} {}{} status={} elapsedMs={}", request.getMethod(),
                        request.getRequestURI(), query, response.getStatus(), elapsedMs);
            }
        }
    }
}
