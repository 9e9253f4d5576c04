package com.components.bom.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * <h2>Resilience4j Configuration</h2>
 *
 * <p>
 * Exposes the Resilience4j registries and the named policies wrapped around the two external
 * collaborators of a lookup: the distributor catalog ({@code catalogSearch}) and the AI keyword
 * generator ({@code keywordGeneration}).
 * </p>
 */
@Configuration
public class Resilience4jConfig {

    public static final String CATALOG_SEARCH = "catalogSearch";
    public static final String KEYWORD_GENERATION = "keywordGeneration";

    @Bean
    public RetryRegistry retryRegistry() {
        return RetryRegistry.ofDefaults();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        return CircuitBreakerRegistry.ofDefaults();
    }

    /**
     * Retry for catalog searches: three attempts, half a second apart.
     *
     * @param registry the global {@link RetryRegistry}
     * @return a {@link Retry} named "catalogSearch"
     */
    @Bean
    @Qualifier("catalogRetry")
    public Retry catalogRetry(final RetryRegistry registry) {
        return registry.retry(CATALOG_SEARCH, RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(500))
                .build());
    }

    /**
     * Opens after repeated catalog failures so a whole-BOM lookup stops hammering the catalog.
     *
     * @param registry the global {@link CircuitBreakerRegistry}
     * @return a {@link CircuitBreaker} named "catalogSearch"
     */
    @Bean
    @Qualifier("catalogCircuitBreaker")
    public CircuitBreaker catalogCircuitBreaker(final CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(CATALOG_SEARCH);
    }

    @Bean
    @Qualifier("keywordRetry")
    public Retry keywordRetry(final RetryRegistry registry) {
        return registry.retry(KEYWORD_GENERATION);
    }

    @Bean
    @Qualifier("keywordCircuitBreaker")
    public CircuitBreaker keywordCircuitBreaker(final CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(KEYWORD_GENERATION);
    }
}
