package com.travelbooking.reconciliation.exception;

/**
 * Thrown when a call to the payment gateway does not produce a usable answer.
 * <p>
 * A GatewayException never implies anything about the payment itself: callers must
 * leave payment and booking state untouched and surface the error or retry later.
 */
public class GatewayException extends ReconciliationException {

    /**
     * Failure categories. Only {@link #UNREACHABLE} is worth retrying automatically.
     */
    public enum Kind {
        /**
         * Gateway rejected our credentials, or none are configured.
         */
        UNAUTHORIZED,

        /**
         * Gateway rejected the request itself (bad field, unknown reference).
         */
        INVALID_REQUEST,

        /**
         * Network failure, timeout, 5xx, or circuit breaker open.
         */
        UNREACHABLE,

        /**
         * Gateway answered with a body we cannot interpret.
         */
        MALFORMED_RESPONSE
    }

    private final Kind kind;
    private final String gatewayName;
    private final String txRef;

    public GatewayException(Kind kind, String message, String gatewayName, String txRef) {
        super(message);
        this.kind = kind;
        this.gatewayName = gatewayName;
        this.txRef = txRef;
    }

    public GatewayException(Kind kind, String message, String gatewayName, String txRef, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.gatewayName = gatewayName;
        this.txRef = txRef;
    }

    public Kind getKind() {
        return kind;
    }

    public String getGatewayName() {
        return gatewayName;
    }

    public String getTxRef() {
        return txRef;
    }

    public boolean isRetryable() {
        return kind == Kind.UNREACHABLE;
    }

    /**
     * True when the fault is on the gateway side rather than in our request or credentials.
     * These are the failures the circuit breaker counts.
     */
    public boolean isGatewayFault() {
        return kind == Kind.UNREACHABLE || kind == Kind.MALFORMED_RESPONSE;
    }
}
