package com.travelbooking.reconciliation.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.travelbooking.reconciliation.config.ChapaProperties;
import com.travelbooking.reconciliation.dto.GatewayCheckout;
import com.travelbooking.reconciliation.dto.GatewayInitiationRequest;
import com.travelbooking.reconciliation.dto.GatewayVerificationResult;
import com.travelbooking.reconciliation.exception.GatewayException;
import com.travelbooking.reconciliation.exception.GatewayException.Kind;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Chapa implementation of {@link PaymentGatewayClient}.
 * <p>
 * Every call goes through the {@code chapaGateway} circuit breaker and the gateway retry
 * template, which retries only UNREACHABLE failures. Chapa wraps every answer in a
 * {@code {status, message, data}} envelope; anything but {@code status=success} is
 * reported as INVALID_REQUEST with Chapa's message.
 */
@Component
@Slf4j
public class ChapaGatewayClient implements PaymentGatewayClient {

    private static final String GATEWAY_NAME = "Chapa";
    private static final String CIRCUIT_BREAKER_NAME = "chapaGateway";

    private final RestTemplate restTemplate;
    private final ChapaProperties properties;
    private final RetryTemplate retryTemplate;
    private final CircuitBreaker circuitBreaker;
    private final ObjectMapper objectMapper;

    public ChapaGatewayClient(@Qualifier("chapaRestTemplate") RestTemplate restTemplate,
                              ChapaProperties properties,
                              @Qualifier("gatewayRetryTemplate") RetryTemplate retryTemplate,
                              CircuitBreakerRegistry circuitBreakerRegistry,
                              ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.properties = properties;
        this.retryTemplate = retryTemplate;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
        this.objectMapper = objectMapper;
    }

    @Override
    public GatewayCheckout initiate(GatewayInitiationRequest request) {
        Map<String, Object> payload = buildInitiationPayload(request);
        log.info("Initializing payment for tx_ref: {}", request.getTxRef());

        JsonNode data = execute(request.getTxRef(),
                () -> exchange(HttpMethod.POST, "/transaction/initialize", payload, request.getTxRef()));

        String checkoutUrl = data.path("checkout_url").asText(null);
        if (checkoutUrl == null || checkoutUrl.isBlank()) {
            throw new GatewayException(Kind.MALFORMED_RESPONSE,
                    "Gateway response has no checkout_url", GATEWAY_NAME, request.getTxRef());
        }

        return GatewayCheckout.builder()
                .checkoutUrl(checkoutUrl)
                .txRef(request.getTxRef())
                .build();
    }

    @Override
    public GatewayVerificationResult verify(String txRef) {
        log.info("Verifying payment for tx_ref: {}", txRef);

        JsonNode data = execute(txRef,
                () -> exchange(HttpMethod.GET, "/transaction/verify/{txRef}", null, txRef));

        return GatewayVerificationResult.builder()
                .txRef(textOrNull(data, "tx_ref") != null ? textOrNull(data, "tx_ref") : txRef)
                .rawStatus(textOrNull(data, "status"))
                .amount(parseAmount(data.get("amount"), txRef))
                .currency(textOrNull(data, "currency"))
                .gatewayTransactionId(textOrNull(data, "id"))
                .gatewayReference(textOrNull(data, "reference"))
                .failureReason(textOrNull(data, "failure_reason"))
                .build();
    }

    @Override
    public String getGatewayName() {
        return GATEWAY_NAME;
    }

    private JsonNode execute(String txRef, Supplier<JsonNode> call) {
        if (!properties.isConfigured()) {
            throw new GatewayException(Kind.UNAUTHORIZED,
                    "Chapa secret key not configured", GATEWAY_NAME, txRef);
        }
        try {
            return circuitBreaker.executeSupplier(() -> retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying gateway call for tx_ref {} (attempt {})", txRef, context.getRetryCount() + 1);
                }
                return call.get();
            }));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker open, not calling gateway for tx_ref {}", txRef);
            throw new GatewayException(Kind.UNREACHABLE,
                    "Payment gateway circuit breaker is open. Service temporarily unavailable.",
                    GATEWAY_NAME, txRef, e);
        }
    }

    private JsonNode exchange(HttpMethod method, String path, Object body, String txRef) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(properties.getSecretKey());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));

        ResponseEntity<String> response;
        try {
            if (method == HttpMethod.GET) {
                response = restTemplate.exchange(properties.getBaseUrl() + path, method,
                        new HttpEntity<>(headers), String.class, txRef);
            } else {
                response = restTemplate.exchange(properties.getBaseUrl() + path, method,
                        new HttpEntity<>(body, headers), String.class);
            }
        } catch (HttpClientErrorException e) {
            throw clientError(e, txRef);
        } catch (HttpServerErrorException e) {
            log.error("Gateway server error {} for tx_ref {}", e.getStatusCode().value(), txRef);
            throw new GatewayException(Kind.UNREACHABLE,
                    "Payment gateway returned HTTP " + e.getStatusCode().value(), GATEWAY_NAME, txRef, e);
        } catch (ResourceAccessException e) {
            log.error("Request failed: {}", e.getMessage());
            throw new GatewayException(Kind.UNREACHABLE,
                    "Failed to connect to payment gateway: " + e.getMessage(), GATEWAY_NAME, txRef, e);
        } catch (RestClientException e) {
            throw new GatewayException(Kind.MALFORMED_RESPONSE,
                    "Unreadable response from payment gateway: " + e.getMessage(), GATEWAY_NAME, txRef, e);
        }

        JsonNode envelope = parse(response.getBody(), txRef);
        String status = envelope.path("status").asText("");
        if (!"success".equalsIgnoreCase(status)) {
            String message = envelope.path("message").asText("Payment gateway request was not successful");
            log.error("API error: {}", message);
            throw new GatewayException(Kind.INVALID_REQUEST, message, GATEWAY_NAME, txRef);
        }

        JsonNode data = envelope.get("data");
        if (data == null || !data.isObject()) {
            throw new GatewayException(Kind.MALFORMED_RESPONSE,
                    "Gateway response has no data object", GATEWAY_NAME, txRef);
        }
        return data;
    }

    private GatewayException clientError(HttpClientErrorException e, String txRef) {
        HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
        if (status == HttpStatus.UNAUTHORIZED || status == HttpStatus.FORBIDDEN) {
            log.error("Gateway rejected credentials ({})", e.getStatusCode().value());
            return new GatewayException(Kind.UNAUTHORIZED,
                    "Payment gateway rejected our credentials", GATEWAY_NAME, txRef, e);
        }

        String message = "Payment gateway error: HTTP " + e.getStatusCode().value();
        try {
            JsonNode body = objectMapper.readTree(e.getResponseBodyAsString());
            if (body != null && body.hasNonNull("message")) {
                message = "Payment gateway error: " + body.get("message").asText();
            }
        } catch (JsonProcessingException parseError) {
            log.debug("Error body for tx_ref {} is not JSON", txRef);
        }
        log.error("API error: {}", message);
        return new GatewayException(Kind.INVALID_REQUEST, message, GATEWAY_NAME, txRef, e);
    }

    private JsonNode parse(String body, String txRef) {
        if (body == null || body.isBlank()) {
            throw new GatewayException(Kind.MALFORMED_RESPONSE,
                    "Empty response from payment gateway", GATEWAY_NAME, txRef);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.error("Invalid JSON response for tx_ref {}: {}", txRef, body);
            throw new GatewayException(Kind.MALFORMED_RESPONSE,
                    "Invalid response from payment gateway", GATEWAY_NAME, txRef, e);
        }
    }

    private Map<String, Object> buildInitiationPayload(GatewayInitiationRequest request) {
        Map<String, Object> required = new LinkedHashMap<>();
        required.put("amount", request.getAmount() != null ? request.getAmount().toPlainString() : null);
        required.put("currency", request.getCurrency());
        required.put("email", request.getEmail());
        required.put("first_name", request.getFirstName());
        required.put("last_name", request.getLastName());
        required.put("tx_ref", request.getTxRef());

        for (Map.Entry<String, Object> field : required.entrySet()) {
            if (field.getValue() == null || field.getValue().toString().isBlank()) {
                throw new GatewayException(Kind.INVALID_REQUEST,
                        "Missing required field: " + field.getKey(), GATEWAY_NAME, request.getTxRef());
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>(required);
        putIfPresent(payload, "phone_number", request.getPhoneNumber());
        putIfPresent(payload, "callback_url", request.getCallbackUrl());
        putIfPresent(payload, "return_url", request.getReturnUrl());

        Map<String, Object> customization = new LinkedHashMap<>();
        putIfPresent(customization, "title", request.getTitle());
        putIfPresent(customization, "description", request.getDescription());
        if (!customization.isEmpty()) {
            payload.put("customization", customization);
        }
        if (request.getBookingId() != null) {
            payload.put("meta", Map.of("booking_id", request.getBookingId()));
        }
        return payload;
    }

    private static void putIfPresent(Map<String, Object> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static BigDecimal parseAmount(JsonNode amount, String txRef) {
        if (amount == null || amount.isNull()) {
            return null;
        }
        try {
            return new BigDecimal(amount.asText());
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparsable amount '{}' for tx_ref {}", amount.asText(), txRef);
            return null;
        }
    }
}
