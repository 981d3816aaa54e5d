package com.eyelevel.jobengine.broker;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A snapshot of a claimed broker message. The id equals the id of the ledger row it belongs to.
 */
@Value
@Builder(toBuilder = true)
public class QueueMessage {
    String id;
    String queueName;
    JobPayload payload;
    int priority;
    /**
     * Number of deliveries that already failed. The current delivery is attempt {@code attemptsMade + 1}.
     */
    int attemptsMade;
    int maxAttempts;
    MessageState state;
    String lockOwner;
    Instant lockExpiresAt;
    Instant createdAt;
    String failedReason;
    int stalledCount;

    public int currentAttempt() {
        return attemptsMade + 1;
    }

    /**
     * Whether a failure of the current delivery exhausts the message's attempts.
     */
    public boolean isFinalAttempt() {
        return currentAttempt() >= maxAttempts;
    }
}
