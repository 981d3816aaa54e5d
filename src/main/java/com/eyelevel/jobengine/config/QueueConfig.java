package com.eyelevel.jobengine.config;

import com.eyelevel.jobengine.broker.QueueBackend;
import com.eyelevel.jobengine.broker.QueueDefinition;
import com.eyelevel.jobengine.broker.QueueRegistry;
import com.eyelevel.jobengine.broker.RetentionPolicy;
import com.eyelevel.jobengine.broker.memory.InMemoryQueueBackend;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the queue topology from {@link JobEngineProperties} and, for {@code broker.type=memory},
 * the single-process broker. The Redis broker is wired in {@link RedisConfig}; with
 * {@code broker.type=none} no {@link QueueBackend} bean exists at all.
 */
@Slf4j
@Configuration
public class QueueConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public QueueRegistry queueRegistry(final JobEngineProperties properties) {
        final List<QueueDefinition> definitions = properties.getQueues().entrySet().stream()
                                                            .map(QueueConfig::toDefinition)
                                                            .toList();
        return new QueueRegistry(definitions);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.jobs.broker", name = "type", havingValue = "memory")
    public QueueBackend inMemoryQueueBackend(final QueueRegistry queueRegistry, final Clock clock) {
        log.warn("Using the in-memory broker. Queued messages are lost when this process stops.");
        return new InMemoryQueueBackend(queueRegistry, clock);
    }

    static QueueDefinition toDefinition(final Map.Entry<String, JobEngineProperties.Queue> entry) {
        final JobEngineProperties.Queue queue = entry.getValue();
        return QueueDefinition.builder()
                              .name(entry.getKey())
                              .jobTypes(Set.copyOf(queue.getJobTypes()))
                              .concurrency(queue.getConcurrency())
                              .attempts(queue.getAttempts())
                              .backoffDelay(queue.getBackoffDelay())
                              .lockDuration(queue.getLockDuration())
                              .pollInterval(queue.getPollInterval())
                              .stalledInterval(queue.getStalledInterval())
                              .maxStalledCount(queue.getMaxStalledCount())
                              .removeOnComplete(toPolicy(queue.getRemoveOnComplete()))
                              .removeOnFail(toPolicy(queue.getRemoveOnFail()))
                              .build();
    }

    private static RetentionPolicy toPolicy(final JobEngineProperties.Retention retention) {
        return new RetentionPolicy(retention.getAge(), retention.getCount());
    }
}
