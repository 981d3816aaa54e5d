package com.eyelevel.jobengine.broker.memory;

import com.eyelevel.jobengine.broker.*;
import com.eyelevel.jobengine.exception.DuplicateMessageException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A single-process broker for local development and tests. Messages live only as long as the JVM,
 * so a restart loses queued work; the stale job watchdog is what brings such jobs back.
 */
@Slf4j
public class InMemoryQueueBackend implements QueueBackend {

    private static final String STALLED_REASON = "job stalled more than allowable limit";

    private final QueueRegistry queueRegistry;
    private final Clock clock;
    private final Map<String, QueueState> queues = new ConcurrentHashMap<>();

    public InMemoryQueueBackend(final QueueRegistry queueRegistry, final Clock clock) {
        this.queueRegistry = queueRegistry;
        this.clock = clock;
    }

    @Override
    public void enqueue(final String queueName, final String messageId, final JobPayload payload, final int priority) {
        QueueBackend.checkPriority(priority);
        final QueueDefinition definition = queueRegistry.getByName(queueName);
        final QueueState queue = stateOf(queueName);
        synchronized (queue) {
            if (queue.messages.containsKey(messageId)) {
                throw new DuplicateMessageException(queueName, messageId);
            }
            final Entry entry = new Entry();
            entry.id = messageId;
            entry.payload = payload;
            entry.priority = priority;
            entry.sequence = ++queue.sequence;
            entry.maxAttempts = definition.getAttempts();
            entry.state = MessageState.WAITING;
            entry.createdAt = clock.instant();
            queue.messages.put(messageId, entry);
        }
        log.debug("Enqueued message {} on queue '{}' with priority {}.", messageId, queueName, priority);
    }

    @Override
    public Optional<QueueMessage> claim(final String queueName, final String workerId, final Duration lockDuration) {
        final QueueState queue = stateOf(queueName);
        synchronized (queue) {
            final Instant now = clock.instant();
            promoteDueMessages(queue, now);
            final Optional<Entry> next = queue.messages.values().stream()
                                                       .filter(e -> e.state == MessageState.WAITING)
                                                       .min(Comparator.comparingInt((Entry e) -> e.priority)
                                                                      .thenComparingLong(e -> e.sequence));
            next.ifPresent(entry -> {
                entry.state = MessageState.ACTIVE;
                entry.lockOwner = workerId;
                entry.lockExpiresAt = now.plus(lockDuration);
            });
            return next.map(entry -> toMessage(queueName, entry));
        }
    }

    @Override
    public boolean extendLock(final String queueName, final String messageId, final String workerId,
                              final Duration lockDuration) {
        final QueueState queue = stateOf(queueName);
        synchronized (queue) {
            final Entry entry = lockedEntry(queue, messageId, workerId);
            if (entry == null) {
                return false;
            }
            entry.lockExpiresAt = clock.instant().plus(lockDuration);
            return true;
        }
    }

    @Override
    public boolean complete(final QueueMessage message, final Map<String, Object> result) {
        final QueueDefinition definition = queueRegistry.getByName(message.getQueueName());
        final QueueState queue = stateOf(message.getQueueName());
        synchronized (queue) {
            final Entry entry = lockedEntry(queue, message.getId(), message.getLockOwner());
            if (entry == null) {
                return false;
            }
            finish(entry, MessageState.COMPLETED);
            entry.result = result;
            prune(queue, MessageState.COMPLETED, definition.getRemoveOnComplete());
            return true;
        }
    }

    @Override
    public FailureOutcome fail(final QueueMessage message, final String reason, final boolean retryable) {
        final QueueDefinition definition = queueRegistry.getByName(message.getQueueName());
        final QueueState queue = stateOf(message.getQueueName());
        synchronized (queue) {
            final Entry entry = lockedEntry(queue, message.getId(), message.getLockOwner());
            if (entry == null) {
                return FailureOutcome.DISCARDED;
            }
            entry.attemptsMade++;
            entry.failedReason = reason;
            entry.lockOwner = null;
            entry.lockExpiresAt = null;
            if (retryable && entry.attemptsMade < entry.maxAttempts) {
                entry.state = MessageState.DELAYED;
                entry.dueAt = clock.instant().plus(definition.backoffFor(entry.attemptsMade));
                return FailureOutcome.RETRY_SCHEDULED;
            }
            finish(entry, MessageState.FAILED);
            prune(queue, MessageState.FAILED, definition.getRemoveOnFail());
            return FailureOutcome.EXHAUSTED;
        }
    }

    @Override
    public boolean remove(final String queueName, final String messageId) {
        final QueueState queue = stateOf(queueName);
        synchronized (queue) {
            final Entry entry = queue.messages.get(messageId);
            if (entry == null || entry.state == MessageState.ACTIVE) {
                return false;
            }
            queue.messages.remove(messageId);
            return true;
        }
    }

    @Override
    public Optional<MessageState> getState(final String queueName, final String messageId) {
        final QueueState queue = stateOf(queueName);
        synchronized (queue) {
            return Optional.ofNullable(queue.messages.get(messageId)).map(entry -> entry.state);
        }
    }

    @Override
    public List<StalledMessage> recoverStalled(final String queueName) {
        final QueueDefinition definition = queueRegistry.getByName(queueName);
        final QueueState queue = stateOf(queueName);
        final List<StalledMessage> stalled = new ArrayList<>();
        synchronized (queue) {
            final Instant now = clock.instant();
            for (final Entry entry : queue.messages.values()) {
                if (entry.state != MessageState.ACTIVE || entry.lockExpiresAt.isAfter(now)) {
                    continue;
                }
                entry.stalledCount++;
                entry.lockOwner = null;
                entry.lockExpiresAt = null;
                if (entry.stalledCount > definition.getMaxStalledCount()) {
                    entry.failedReason = STALLED_REASON;
                    finish(entry, MessageState.FAILED);
                } else {
                    entry.state = MessageState.WAITING;
                }
                stalled.add(new StalledMessage(queueName, entry.id, entry.state));
            }
            prune(queue, MessageState.FAILED, definition.getRemoveOnFail());
        }
        return stalled;
    }

    @Override
    public QueueCounts getCounts(final String queueName) {
        final QueueState queue = stateOf(queueName);
        synchronized (queue) {
            final Map<MessageState, Long> counts = new EnumMap<>(MessageState.class);
            queue.messages.values().forEach(entry -> counts.merge(entry.state, 1L, Long::sum));
            return new QueueCounts(counts.getOrDefault(MessageState.WAITING, 0L),
                                   counts.getOrDefault(MessageState.DELAYED, 0L),
                                   counts.getOrDefault(MessageState.ACTIVE, 0L),
                                   counts.getOrDefault(MessageState.COMPLETED, 0L),
                                   counts.getOrDefault(MessageState.FAILED, 0L));
        }
    }

    private QueueState stateOf(final String queueName) {
        queueRegistry.getByName(queueName);
        return queues.computeIfAbsent(queueName, name -> new QueueState());
    }

    private void promoteDueMessages(final QueueState queue, final Instant now) {
        queue.messages.values().stream()
                      .filter(e -> e.state == MessageState.DELAYED && !e.dueAt.isAfter(now))
                      .forEach(e -> {
                          e.state = MessageState.WAITING;
                          e.dueAt = null;
                      });
    }

    private Entry lockedEntry(final QueueState queue, final String messageId, final String workerId) {
        final Entry entry = queue.messages.get(messageId);
        if (entry == null || entry.state != MessageState.ACTIVE || !Objects.equals(entry.lockOwner, workerId)) {
            return null;
        }
        return entry;
    }

    private void finish(final Entry entry, final MessageState state) {
        entry.state = state;
        entry.finishedAt = clock.instant();
        entry.lockOwner = null;
        entry.lockExpiresAt = null;
    }

    /**
     * Drops finished messages older than the policy's age, then the oldest ones beyond its count.
     */
    private void prune(final QueueState queue, final MessageState state, final RetentionPolicy policy) {
        final Instant cutoff = clock.instant().minus(policy.maxAge());
        queue.messages.values().removeIf(e -> e.state == state && e.finishedAt.isBefore(cutoff));

        final List<Entry> finished = queue.messages.values().stream()
                                                   .filter(e -> e.state == state)
                                                   .sorted(Comparator.comparing((Entry e) -> e.finishedAt)
                                                                     .thenComparingLong(e -> e.sequence))
                                                   .toList();
        final int excess = finished.size() - policy.maxCount();
        for (int i = 0; i < excess; i++) {
            queue.messages.remove(finished.get(i).id);
        }
    }

    private QueueMessage toMessage(final String queueName, final Entry entry) {
        return QueueMessage.builder()
                           .id(entry.id)
                           .queueName(queueName)
                           .payload(entry.payload)
                           .priority(entry.priority)
                           .attemptsMade(entry.attemptsMade)
                           .maxAttempts(entry.maxAttempts)
                           .state(entry.state)
                           .lockOwner(entry.lockOwner)
                           .lockExpiresAt(entry.lockExpiresAt)
                           .createdAt(entry.createdAt)
                           .failedReason(entry.failedReason)
                           .stalledCount(entry.stalledCount)
                           .build();
    }

    private static final class QueueState {
        private final Map<String, Entry> messages = new LinkedHashMap<>();
        private long sequence;
    }

    private static final class Entry {
        private String id;
        private JobPayload payload;
        private int priority;
        private long sequence;
        private int attemptsMade;
        private int maxAttempts;
        private int stalledCount;
        private MessageState state;
        private String lockOwner;
        private Instant lockExpiresAt;
        private Instant dueAt;
        private Instant createdAt;
        private Instant finishedAt;
        private String failedReason;
        private Map<String, Object> result;
    }
}
