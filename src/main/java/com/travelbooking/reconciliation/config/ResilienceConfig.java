package com.travelbooking.reconciliation.config;

import com.travelbooking.reconciliation.exception.GatewayException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;

/**
 * Circuit breaker and retry settings for calls to the payment gateway.
 * <p>
 * The circuit breaker wraps the whole retried call, so one logical verify counts once.
 * Only gateway-side faults (unreachable, malformed body) count towards opening it;
 * a rejected request says nothing about gateway health.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordException(throwable -> throwable instanceof GatewayException
                        && ((GatewayException) throwable).isGatewayFault())
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public RetryTemplate gatewayRetryTemplate(ChapaProperties properties) {
        ChapaProperties.Retry retry = properties.getRetry();

        ExponentialBackOffPolicy backOffPolicy = new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(retry.getInitialBackoffMs());
        backOffPolicy.setMultiplier(retry.getMultiplier());
        backOffPolicy.setMaxInterval(retry.getMaxBackoffMs());

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(new GatewayRetryPolicy(retry.getMaxAttempts()));
        retryTemplate.setBackOffPolicy(backOffPolicy);
        return retryTemplate;
    }
}
