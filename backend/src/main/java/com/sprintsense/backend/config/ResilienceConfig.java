package com.sprintsense.backend.config;

import com.sprintsense.backend.resilience.CircuitBreaker;
import com.sprintsense.backend.resilience.RetryPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * One circuit breaker per downstream dependency of the prioritization core.
 */
@Configuration
public class ResilienceConfig {

    @Value("${sprintsense.ai.circuit-breaker.failure-threshold:5}")
    private int failureThreshold;

    @Value("${sprintsense.ai.circuit-breaker.recovery-timeout-seconds:60}")
    private long recoveryTimeoutSeconds;

    @Value("${sprintsense.ai.retry.max-attempts:1}")
    private int retryMaxAttempts;

    @Value("${sprintsense.ai.retry.initial-delay-ms:1000}")
    private long retryInitialDelayMs;

    @Value("${sprintsense.ai.retry.max-delay-ms:10000}")
    private long retryMaxDelayMs;

    @Value("${sprintsense.ai.retry.jitter-fraction:0.1}")
    private double retryJitterFraction;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RetryPolicy retryPolicy() {
        if (retryMaxAttempts <= 1) {
            return RetryPolicy.none();
        }
        return RetryPolicy.exponential(retryMaxAttempts,
                Duration.ofMillis(retryInitialDelayMs),
                Duration.ofMillis(retryMaxDelayMs),
                retryJitterFraction);
    }

    @Bean
    public CircuitBreaker cacheCircuitBreaker(RetryPolicy retryPolicy, Clock clock) {
        return breaker("redis-cache", retryPolicy, clock);
    }

    @Bean
    public CircuitBreaker goalSourceCircuitBreaker(RetryPolicy retryPolicy, Clock clock) {
        return breaker("goal-source", retryPolicy, clock);
    }

    @Bean
    public CircuitBreaker workItemSourceCircuitBreaker(RetryPolicy retryPolicy, Clock clock) {
        return breaker("work-item-source", retryPolicy, clock);
    }

    private CircuitBreaker breaker(String name, RetryPolicy retryPolicy, Clock clock) {
        return new CircuitBreaker(name, failureThreshold, Duration.ofSeconds(recoveryTimeoutSeconds),
                retryPolicy, clock);
    }
}
