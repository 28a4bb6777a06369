package com.travelbooking.reconciliation.config;

import com.travelbooking.reconciliation.exception.GatewayException;
import org.springframework.retry.RetryContext;
import org.springframework.retry.policy.SimpleRetryPolicy;

import java.util.Map;

/**
 * Retries gateway calls only while the last failure was {@link GatewayException.Kind#UNREACHABLE}.
 * Auth and request errors would fail the same way again; malformed bodies need a human.
 */
public class GatewayRetryPolicy extends SimpleRetryPolicy {

    public GatewayRetryPolicy(int maxAttempts) {
        super(maxAttempts, Map.of(GatewayException.class, true), true);
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable lastThrowable = context.getLastThrowable();
        if (lastThrowable instanceof GatewayException && !((GatewayException) lastThrowable).isRetryable()) {
            return false;
        }
        return super.canRetry(context);
    }
}
