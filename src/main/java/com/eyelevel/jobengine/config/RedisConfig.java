package com.eyelevel.jobengine.config;

import com.eyelevel.jobengine.broker.QueueBackend;
import com.eyelevel.jobengine.broker.QueueRegistry;
import com.eyelevel.jobengine.broker.redis.RedisQueueBackend;
import com.eyelevel.jobengine.common.json.JsonParser;
import com.eyelevel.jobengine.common.json.JsonSerializer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;

/**
 * Redis configuration for the job queues. Active unless another broker type is selected.
 */
@Configuration
@ConditionalOnProperty(prefix = "app.jobs.broker", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisConfig {

    @Bean
    public StringRedisTemplate jobQueueRedisTemplate(final RedisConnectionFactory connectionFactory) {
        return new StringRedisTemplate(connectionFactory);
    }

    @Bean
    public QueueBackend redisQueueBackend(final StringRedisTemplate jobQueueRedisTemplate,
                                          final QueueRegistry queueRegistry,
                                          final JsonSerializer jsonSerializer,
                                          final JsonParser jsonParser,
                                          final Clock clock,
                                          final JobEngineProperties properties) {
        return new RedisQueueBackend(jobQueueRedisTemplate, queueRegistry, jsonSerializer, jsonParser, clock,
                                     properties.getBroker().getRedis().getKeyPrefix());
    }
}
