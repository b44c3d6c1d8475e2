package com.ethixai.drift.config;

import com.ethixai.drift.exception.TransientStoreException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class DriftResilienceConfig {

    @Bean
    public Retry driftStoreRetry(DriftProperties properties) {
        DriftProperties.Worker worker = properties.getWorker();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                worker.getRetryBaseDelay(),
                2.0,
                0.2
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(worker.getRetryAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(TransientStoreException.class)
                .build();
        Retry retry = Retry.of("drift-store", config);
        retry.getEventPublisher().onRetry(event -> log.warn("Retrying drift cycle after store failure attempt={} error={}",
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
        return retry;
    }
}
