package com.ethixai.drift.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Beans the JPA slice does not provide: a fixed clock and a mapper for the JSON columns.
 */
@TestConfiguration
public class PersistenceTestConfig {

    public static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    @Bean
    public Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }
}
