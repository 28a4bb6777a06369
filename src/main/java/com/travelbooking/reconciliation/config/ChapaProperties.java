package com.travelbooking.reconciliation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Chapa gateway credentials and client tuning, bound from the {@code chapa.*} properties.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "chapa")
public class ChapaProperties {

    private String secretKey;
    private String baseUrl = "https://api.chapa.co/v1";

    /**
     * Where Chapa posts the payment callback (our webhook endpoint).
     */
    private String callbackUrl;

    /**
     * Where the guest lands after checkout.
     */
    private String returnUrl;

    private String txRefPrefix = "ALX";
    private String checkoutTitle = "ALX Travel App";

    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(30);

    private Retry retry = new Retry();

    public boolean isConfigured() {
        return secretKey != null && !secretKey.isBlank();
    }

    @Getter
    @Setter
    public static class Retry {
        private int maxAttempts = 3;
        private long initialBackoffMs = 1000;
        private double multiplier = 2.0;
        private long maxBackoffMs = 10000;
    }
}
