package com.triagepilot.orchestrator.resilience;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    RetryPolicy retryPolicy(@Value("${triagepilot.retry.max-attempts:3}")      int maxAttempts,
                            @Value("${triagepilot.retry.base-delay-ms:1000}")  long baseDelayMs,
                            @Value("${triagepilot.retry.max-delay-ms:30000}")  long maxDelayMs,
                            @Value("${triagepilot.retry.jitter:0.2}")          double jitter) {
        return new RetryPolicy(maxAttempts,
                Duration.ofMillis(baseDelayMs),
                Duration.ofMillis(maxDelayMs),
                jitter,
                new TransientFailureClassifier());
    }
}
