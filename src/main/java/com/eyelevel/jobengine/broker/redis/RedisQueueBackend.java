package com.eyelevel.jobengine.broker.redis;

import com.eyelevel.jobengine.broker.*;
import com.eyelevel.jobengine.common.json.JsonParser;
import com.eyelevel.jobengine.common.json.JsonSerializer;
import com.eyelevel.jobengine.exception.DuplicateMessageException;
import com.eyelevel.jobengine.exception.QueueBackendException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.scripting.support.ResourceScriptSource;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

/**
 * A {@link QueueBackend} on Redis sorted sets and hashes.
 * <p>
 * Each queue keeps its waiting, delayed, active, completed and failed members in sorted sets and
 * one hash per message. Every state change runs as a Lua script so claim, lock and retry
 * bookkeeping stay atomic across worker processes.
 */
@Slf4j
public class RedisQueueBackend implements QueueBackend {

    private static final String STALLED_REASON = "job stalled more than allowable limit";

    private static final RedisScript<Long> ENQUEUE = script("enqueue", Long.class);
    private static final RedisScript<String> CLAIM = script("claim", String.class);
    private static final RedisScript<Long> EXTEND_LOCK = script("extend_lock", Long.class);
    private static final RedisScript<Long> COMPLETE = script("complete", Long.class);
    private static final RedisScript<Long> FAIL = script("fail", Long.class);
    private static final RedisScript<Long> REMOVE = script("remove", Long.class);
    private static final RedisScript<String> STALLED = script("stalled", String.class);

    private final StringRedisTemplate redisTemplate;
    private final QueueRegistry queueRegistry;
    private final JsonSerializer jsonSerializer;
    private final JsonParser jsonParser;
    private final Clock clock;
    private final String keyPrefix;

    public RedisQueueBackend(final StringRedisTemplate redisTemplate, final QueueRegistry queueRegistry,
                             final JsonSerializer jsonSerializer, final JsonParser jsonParser, final Clock clock,
                             final String keyPrefix) {
        this.redisTemplate = redisTemplate;
        this.queueRegistry = queueRegistry;
        this.jsonSerializer = jsonSerializer;
        this.jsonParser = jsonParser;
        this.clock = clock;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public void enqueue(final String queueName, final String messageId, final JobPayload payload, final int priority) {
        QueueBackend.checkPriority(priority);
        final QueueDefinition definition = queueRegistry.getByName(queueName);
        final RedisQueueKeys keys = keys(queueName);
        final Long added = execute("enqueue", queueName, () -> redisTemplate.execute(
                ENQUEUE, List.of(keys.message(messageId), keys.waiting(), keys.sequence()),
                messageId, jsonSerializer.serialize(payload), String.valueOf(priority),
                String.valueOf(definition.getAttempts()), now()));
        if (added == null || added == 0L) {
            throw new DuplicateMessageException(queueName, messageId);
        }
        log.debug("Enqueued message {} on Redis queue '{}' with priority {}.", messageId, queueName, priority);
    }

    @Override
    public Optional<QueueMessage> claim(final String queueName, final String workerId, final Duration lockDuration) {
        final RedisQueueKeys keys = keys(queueName);
        final String messageId = execute("claim", queueName, () -> redisTemplate.execute(
                CLAIM, List.of(keys.waiting(), keys.delayed(), keys.active()),
                keys.messagePrefix(), workerId, now(), String.valueOf(lockDuration.toMillis())));
        if (messageId == null) {
            return Optional.empty();
        }
        final Map<Object, Object> fields = execute("read", queueName,
                                                   () -> redisTemplate.opsForHash().entries(keys.message(messageId)));
        return Optional.of(toMessage(queueName, messageId, fields));
    }

    @Override
    public boolean extendLock(final String queueName, final String messageId, final String workerId,
                              final Duration lockDuration) {
        final RedisQueueKeys keys = keys(queueName);
        final Long extended = execute("extend lock", queueName, () -> redisTemplate.execute(
                EXTEND_LOCK, List.of(keys.message(messageId), keys.active()),
                messageId, workerId, now(), String.valueOf(lockDuration.toMillis())));
        return Long.valueOf(1L).equals(extended);
    }

    @Override
    public boolean complete(final QueueMessage message, final Map<String, Object> result) {
        final QueueDefinition definition = queueRegistry.getByName(message.getQueueName());
        final RedisQueueKeys keys = keys(message.getQueueName());
        final RetentionPolicy retention = definition.getRemoveOnComplete();
        final Long completed = execute("complete", message.getQueueName(), () -> redisTemplate.execute(
                COMPLETE, List.of(keys.message(message.getId()), keys.active(), keys.completed()),
                message.getId(), message.getLockOwner(), now(),
                jsonSerializer.serialize(result == null ? Map.of() : result),
                String.valueOf(retention.maxAge().toMillis()), String.valueOf(retention.maxCount()),
                keys.messagePrefix()));
        return Long.valueOf(1L).equals(completed);
    }

    @Override
    public FailureOutcome fail(final QueueMessage message, final String reason, final boolean retryable) {
        final QueueDefinition definition = queueRegistry.getByName(message.getQueueName());
        final RedisQueueKeys keys = keys(message.getQueueName());
        final RetentionPolicy retention = definition.getRemoveOnFail();
        final Long outcome = execute("fail", message.getQueueName(), () -> redisTemplate.execute(
                FAIL, List.of(keys.message(message.getId()), keys.active(), keys.delayed(), keys.failed()),
                message.getId(), message.getLockOwner(), now(), reason == null ? "" : reason,
                retryable ? "1" : "0", String.valueOf(definition.getBackoffDelay().toMillis()),
                String.valueOf(retention.maxAge().toMillis()), String.valueOf(retention.maxCount()),
                keys.messagePrefix()));
        if (outcome == null || outcome < 0) {
            return FailureOutcome.DISCARDED;
        }
        return outcome == 1L ? FailureOutcome.RETRY_SCHEDULED : FailureOutcome.EXHAUSTED;
    }

    @Override
    public boolean remove(final String queueName, final String messageId) {
        final RedisQueueKeys keys = keys(queueName);
        final Long removed = execute("remove", queueName, () -> redisTemplate.execute(
                REMOVE, List.of(keys.message(messageId), keys.waiting(), keys.delayed(), keys.completed(),
                                keys.failed()),
                messageId));
        if (Long.valueOf(-1L).equals(removed)) {
            log.debug("Message {} on queue '{}' is locked by a worker and was not removed.", messageId, queueName);
        }
        return Long.valueOf(1L).equals(removed);
    }

    @Override
    public Optional<MessageState> getState(final String queueName, final String messageId) {
        final Object state = execute("read state", queueName,
                                     () -> redisTemplate.opsForHash().get(keys(queueName).message(messageId), "state"));
        return Optional.ofNullable(state).map(value -> MessageState.valueOf(value.toString()));
    }

    @Override
    public List<StalledMessage> recoverStalled(final String queueName) {
        final QueueDefinition definition = queueRegistry.getByName(queueName);
        final RedisQueueKeys keys = keys(queueName);
        final RetentionPolicy retention = definition.getRemoveOnFail();
        final String entries = execute("recover stalled", queueName, () -> redisTemplate.execute(
                STALLED, List.of(keys.active(), keys.waiting(), keys.failed()),
                now(), String.valueOf(definition.getMaxStalledCount()), keys.messagePrefix(),
                String.valueOf(retention.maxAge().toMillis()), String.valueOf(retention.maxCount()),
                STALLED_REASON));
        if (!StringUtils.hasText(entries)) {
            return List.of();
        }
        final List<StalledMessage> stalled = new ArrayList<>();
        for (final String entry : entries.split(",")) {
            final int separator = entry.lastIndexOf(':');
            stalled.add(new StalledMessage(queueName, entry.substring(0, separator),
                                           MessageState.valueOf(entry.substring(separator + 1))));
        }
        return stalled;
    }

    @Override
    public QueueCounts getCounts(final String queueName) {
        final RedisQueueKeys keys = keys(queueName);
        return execute("count", queueName, () -> new QueueCounts(size(keys.waiting()), size(keys.delayed()),
                                                                 size(keys.active()), size(keys.completed()),
                                                                 size(keys.failed())));
    }

    private long size(final String key) {
        final Long size = redisTemplate.opsForZSet().zCard(key);
        return size == null ? 0L : size;
    }

    private RedisQueueKeys keys(final String queueName) {
        queueRegistry.getByName(queueName);
        return RedisQueueKeys.of(keyPrefix, queueName);
    }

    private String now() {
        return String.valueOf(clock.millis());
    }

    private QueueMessage toMessage(final String queueName, final String messageId, final Map<Object, Object> fields) {
        return QueueMessage.builder()
                           .id(messageId)
                           .queueName(queueName)
                           .payload(jsonParser.parseObject(field(fields, "payload"), JobPayload.class))
                           .priority(intField(fields, "priority"))
                           .attemptsMade(intField(fields, "attemptsMade"))
                           .maxAttempts(intField(fields, "maxAttempts"))
                           .stalledCount(intField(fields, "stalledCount"))
                           .state(MessageState.valueOf(field(fields, "state")))
                           .lockOwner(field(fields, "lockOwner"))
                           .lockExpiresAt(instantField(fields, "lockExpiresAt"))
                           .createdAt(instantField(fields, "createdAt"))
                           .failedReason(field(fields, "failedReason"))
                           .build();
    }

    private static String field(final Map<Object, Object> fields, final String name) {
        final Object value = fields.get(name);
        return value == null ? null : value.toString();
    }

    private static int intField(final Map<Object, Object> fields, final String name) {
        final String value = field(fields, name);
        return value == null ? 0 : (int) Double.parseDouble(value);
    }

    private static Instant instantField(final Map<Object, Object> fields, final String name) {
        final String value = field(fields, name);
        return value == null ? null : Instant.ofEpochMilli((long) Double.parseDouble(value));
    }

    private <T> T execute(final String operation, final String queueName, final Supplier<T> command) {
        try {
            return command.get();
        } catch (final DataAccessException e) {
            log.error("Redis {} failed for queue '{}'.", operation, queueName, e);
            throw new QueueBackendException("Redis " + operation + " failed for queue " + queueName, e);
        }
    }

    private static <T> RedisScript<T> script(final String name, final Class<T> resultType) {
        final DefaultRedisScript<T> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource("redis/" + name + ".lua")));
        script.setResultType(resultType);
        return script;
    }
}
