package com.eyelevel.jobengine.broker;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An at-least-once message broker with one logical queue per job-type category.
 * <p>
 * Queues order waiting messages by priority (lower first) and then by arrival. A failed delivery is
 * retried with exponential backoff until the queue's attempt limit; finished messages are pruned
 * according to the queue's retention policies. Message ids are unique per queue.
 */
public interface QueueBackend {

    /**
     * Highest priority value a message may carry. Redis scores hold the priority in the bits above a
     * 32-bit arrival sequence and stay exact only up to 2^53.
     */
    int MAX_PRIORITY = (1 << 21) - 1;

    /**
     * Adds a message to a queue.
     *
     * @throws IllegalArgumentException if {@code priority} is outside 0..{@link #MAX_PRIORITY}.
     * @throws com.eyelevel.jobengine.exception.DuplicateMessageException if the id is already known.
     * @throws com.eyelevel.jobengine.exception.QueueBackendException      if the broker cannot be reached.
     */
    void enqueue(String queueName, String messageId, JobPayload payload, int priority);

    static void checkPriority(final int priority) {
        if (priority < 0 || priority > MAX_PRIORITY) {
            throw new IllegalArgumentException("Priority out of range: " + priority);
        }
    }

    /**
     * Claims the next due message and locks it for {@code lockDuration} on behalf of {@code workerId}.
     */
    Optional<QueueMessage> claim(String queueName, String workerId, Duration lockDuration);

    /**
     * Pushes the lock of an in-flight message forward. Returns false if the worker lost the lock.
     */
    boolean extendLock(String queueName, String messageId, String workerId, Duration lockDuration);

    /**
     * Moves an in-flight message to the completed set. Returns false if the worker lost the lock.
     */
    boolean complete(QueueMessage message, Map<String, Object> result);

    /**
     * Reports a failed delivery. Retryable failures are redelivered after the backoff delay while
     * attempts remain.
     */
    FailureOutcome fail(QueueMessage message, String reason, boolean retryable);

    /**
     * Removes a message that is not currently being processed.
     *
     * @return true if the message was removed, false if it does not exist or is locked by a worker.
     */
    boolean remove(String queueName, String messageId);

    Optional<MessageState> getState(String queueName, String messageId);

    /**
     * Releases messages whose worker lock expired, putting them back in the waiting set or failing
     * them once they stalled more often than the queue allows.
     */
    List<StalledMessage> recoverStalled(String queueName);

    QueueCounts getCounts(String queueName);
}
