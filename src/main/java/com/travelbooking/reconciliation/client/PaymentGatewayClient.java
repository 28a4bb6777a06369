package com.travelbooking.reconciliation.client;

import com.travelbooking.reconciliation.dto.GatewayCheckout;
import com.travelbooking.reconciliation.dto.GatewayInitiationRequest;
import com.travelbooking.reconciliation.dto.GatewayVerificationResult;
import com.travelbooking.reconciliation.exception.GatewayException;

/**
 * Interface for talking to the hosted payment gateway.
 * <p>
 * Implementations own transport concerns (auth, timeouts, retry of transient failures)
 * and report every problem as a {@link GatewayException}; they never interpret the
 * gateway's payment status themselves.
 */
public interface PaymentGatewayClient {

    /**
     * Opens a hosted checkout for a payment.
     *
     * @param request payment, guest and redirect details
     * @return the checkout URL the guest should be sent to
     * @throws GatewayException if the checkout could not be created
     */
    GatewayCheckout initiate(GatewayInitiationRequest request) throws GatewayException;

    /**
     * Fetches the gateway's current view of a transaction.
     *
     * @param txRef the reference we supplied at initiation
     * @throws GatewayException if the gateway could not give a definite answer
     */
    GatewayVerificationResult verify(String txRef) throws GatewayException;

    /**
     * Returns the name of this gateway, used in logs and error messages.
     */
    String getGatewayName();
}
