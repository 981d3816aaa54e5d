package com.eyelevel.jobengine.broker;

import com.eyelevel.jobengine.model.JobType;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Resolves a job type to the queue that carries it. A type absent from every queue is
 * "not wired yet": submissions for it are recorded and cancelled rather than rejected.
 */
@Slf4j
public class QueueRegistry {

    private final Map<String, QueueDefinition> queuesByName;
    private final Map<JobType, QueueDefinition> queuesByType;

    public QueueRegistry(final Collection<QueueDefinition> definitions) {
        final Map<String, QueueDefinition> byName = new LinkedHashMap<>();
        final Map<JobType, QueueDefinition> byType = new EnumMap<>(JobType.class);
        for (final QueueDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.getName(), definition) != null) {
                throw new IllegalStateException("Queue '" + definition.getName() + "' is defined twice.");
            }
            for (final JobType type : definition.getJobTypes()) {
                final QueueDefinition previous = byType.putIfAbsent(type, definition);
                if (previous != null) {
                    throw new IllegalStateException(String.format("Job type %s is routed to both '%s' and '%s'.",
                                                                  type, previous.getName(), definition.getName()));
                }
            }
        }
        this.queuesByName = Collections.unmodifiableMap(byName);
        this.queuesByType = Collections.unmodifiableMap(byType);
        log.info("Registered {} queue(s) covering {} job type(s).", byName.size(), byType.size());
    }

    public Optional<QueueDefinition> queueFor(final JobType type) {
        return Optional.ofNullable(queuesByType.get(type));
    }

    public Optional<QueueDefinition> findByName(final String name) {
        return Optional.ofNullable(queuesByName.get(name));
    }

    public QueueDefinition getByName(final String name) {
        return findByName(name).orElseThrow(() -> new IllegalArgumentException("Unknown queue: " + name));
    }

    public Collection<QueueDefinition> all() {
        return queuesByName.values();
    }
}
