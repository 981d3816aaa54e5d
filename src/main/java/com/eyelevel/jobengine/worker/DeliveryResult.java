package com.eyelevel.jobengine.worker;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

/**
 * How a worker should settle a delivery with the broker.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DeliveryResult {

    public enum Outcome {
        /**
         * Acknowledge the message with the processor's data.
         */
        COMPLETED,
        /**
         * Fail the message without redelivery.
         */
        REJECTED,
        /**
         * Acknowledge the message without running anything, the ledger no longer wants it.
         */
        SKIPPED
    }

    private final Outcome outcome;
    private final Map<String, Object> data;
    private final String reason;

    static DeliveryResult completed(final Map<String, Object> data) {
        return new DeliveryResult(Outcome.COMPLETED, data, null);
    }

    static DeliveryResult rejected(final String reason) {
        return new DeliveryResult(Outcome.REJECTED, null, reason);
    }

    static DeliveryResult skipped(final String reason) {
        return new DeliveryResult(Outcome.SKIPPED, Map.of("skipped", reason), reason);
    }
}
