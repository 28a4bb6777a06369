package com.travelbooking.reconciliation.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client used for the Chapa API.
 */
@Configuration
@Slf4j
public class GatewayClientConfig {

    @Bean
    public RestTemplate chapaRestTemplate(RestTemplateBuilder builder, ChapaProperties properties) {
        RestTemplate restTemplate = builder
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(properties.getReadTimeout())
                .additionalInterceptors(loggingInterceptor())
                .build();

        log.info("Chapa client configured for {} (connect timeout {}, read timeout {})",
                properties.getBaseUrl(), properties.getConnectTimeout(), properties.getReadTimeout());
        if (!properties.isConfigured()) {
            log.warn("chapa.secret-key is not set; gateway calls will be rejected");
        }
        return restTemplate;
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            log.info("Making {} request to {}", request.getMethod(), request.getURI());

            ClientHttpResponse response = execution.execute(request, body);

            log.info("Response status: {} ({}ms)",
                    response.getStatusCode().value(), System.currentTimeMillis() - startTime);
            return response;
        };
    }
}
