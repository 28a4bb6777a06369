package com.travelbooking.reconciliation.reconciler;

import com.travelbooking.reconciliation.entity.PaymentStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Translates gateway status text into our payment status vocabulary.
 * <p>
 * This is the only place raw gateway status strings are interpreted. The mapping is
 * total: anything unrecognized resolves to FAILED so an unknown state can never be
 * mistaken for settlement.
 */
@Component
@Slf4j
public class GatewayStatusMapper {

    private static final Map<String, PaymentStatus> STATUS_MAPPING = Map.of(
            "success", PaymentStatus.COMPLETED,
            "pending", PaymentStatus.PROCESSING,
            "failed", PaymentStatus.FAILED,
            "cancelled", PaymentStatus.CANCELLED
    );

    public PaymentStatus map(String rawStatus) {
        String normalized = rawStatus == null ? "" : rawStatus.trim().toLowerCase(Locale.ROOT);
        PaymentStatus mapped = STATUS_MAPPING.get(normalized);
        if (mapped == null) {
            log.warn("Unknown gateway status '{}', treating payment as FAILED", rawStatus);
            return PaymentStatus.FAILED;
        }
        return mapped;
    }
}
