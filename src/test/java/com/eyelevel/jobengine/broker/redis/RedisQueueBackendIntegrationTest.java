package com.eyelevel.jobengine.broker.redis;

import com.eyelevel.jobengine.broker.QueueBackend;
import com.eyelevel.jobengine.broker.QueueBackendContract;
import com.eyelevel.jobengine.broker.QueueRegistry;
import com.eyelevel.jobengine.common.json.jackson.JacksonJsonParser;
import com.eyelevel.jobengine.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.jobengine.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/**
 * Runs the shared broker behaviour against the Lua scripts on a real Redis. Skipped when no Docker
 * daemon is available.
 */
@Testcontainers(disabledWithoutDocker = true)
class RedisQueueBackendIntegrationTest extends QueueBackendContract {

    private static final int REDIS_PORT = 6379;

    @Container
    private static final GenericContainer<?> REDIS =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(REDIS_PORT);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
                new RedisStandaloneConfiguration(REDIS.getHost(), REDIS.getMappedPort(REDIS_PORT)));
        connectionFactory.afterPropertiesSet();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        if (connectionFactory != null) {
            connectionFactory.destroy();
        }
    }

    @Override
    protected QueueBackend createBackend(final QueueRegistry registry, final MutableClock clock) {
        redisTemplate.execute((RedisCallback<Void>) connection -> {
            connection.serverCommands().flushDb();
            return null;
        });
        final ObjectMapper objectMapper = new ObjectMapper();
        return new RedisQueueBackend(redisTemplate, registry, new JacksonJsonSerializer(objectMapper),
                                     new JacksonJsonParser(objectMapper), clock, "jobs-it");
    }
}
