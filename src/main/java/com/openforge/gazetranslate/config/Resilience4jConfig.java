package com.openforge.gazetranslate.config;

import com.openforge.gazetranslate.error.ExternalServiceException;
import com.openforge.gazetranslate.error.ValidationException;
import com.openforge.gazetranslate.ocr.OcrProperties;
import com.openforge.gazetranslate.translation.TranslationProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring, one named instance per collaborator:
 *   • "ocr"           circuit breaker + time limiter
 *   • "translation"   circuit breaker + retry + time limiter
 */
@Configuration
@EnableConfigurationProperties({OcrProperties.class, TranslationProperties.class})
public class Resilience4jConfig {

    public static final String OCR = "ocr";
    public static final String TRANSLATION = "translation";

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                .slowCallDurationThreshold(Duration.ofSeconds(20))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(RuntimeException.class)
                // bad input says nothing about the remote service's health
                .ignoreExceptions(ValidationException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(OCR);
        registry.circuitBreaker(TRANSLATION);
        return registry;
    }

    @Bean
    public CircuitBreaker ocrCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(OCR);
    }

    @Bean
    public CircuitBreaker translationCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(TRANSLATION);
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(500))
                // network errors, 429 and 5xx only
                .retryOnException(e -> e instanceof ExternalServiceException ese && ese.isRetryable())
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(TRANSLATION);
        return registry;
    }

    @Bean
    public Retry translationRetry(RetryRegistry registry) {
        return registry.retry(TRANSLATION);
    }

    // ── Time Limiter ─────────────────────────────────────────────────────────

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(OcrProperties ocrProps, TranslationProperties translationProps) {
        TimeLimiterRegistry registry = TimeLimiterRegistry.of(TimeLimiterConfig.ofDefaults());
        registry.timeLimiter(OCR, TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(ocrProps.timeoutSeconds()))
                .cancelRunningFuture(true)
                .build());
        registry.timeLimiter(TRANSLATION, TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(translationProps.timeoutSeconds()))
                .cancelRunningFuture(true)
                .build());
        return registry;
    }

    @Bean
    public TimeLimiter ocrTimeLimiter(TimeLimiterRegistry registry) {
        return registry.timeLimiter(OCR);
    }

    @Bean
    public TimeLimiter translationTimeLimiter(TimeLimiterRegistry registry) {
        return registry.timeLimiter(TRANSLATION);
    }
}
