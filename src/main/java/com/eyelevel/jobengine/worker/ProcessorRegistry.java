package com.eyelevel.jobengine.worker;

import com.eyelevel.jobengine.broker.QueueDefinition;
import com.eyelevel.jobengine.model.JobType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Maps each job type to the single {@link JobProcessor} bean that handles it.
 */
@Slf4j
@Component
public class ProcessorRegistry {

    private final Map<JobType, JobProcessor> processors = new EnumMap<>(JobType.class);

    @Autowired
    public ProcessorRegistry(final ObjectProvider<JobProcessor> jobProcessors) {
        this(jobProcessors.orderedStream().toList());
    }

    public ProcessorRegistry(final List<JobProcessor> jobProcessors) {
        for (final JobProcessor processor : jobProcessors) {
            for (final JobType type : processor.supportedTypes()) {
                final JobProcessor existing = processors.putIfAbsent(type, processor);
                if (existing != null) {
                    throw new IllegalStateException(String.format("Job type %s is handled by both %s and %s.", type,
                                                                  existing.getClass().getSimpleName(),
                                                                  processor.getClass().getSimpleName()));
                }
            }
        }
        log.info("Registered processors for job types: {}", processors.keySet());
    }

    public Optional<JobProcessor> find(final JobType type) {
        return Optional.ofNullable(processors.get(type));
    }

    public boolean coversAny(final QueueDefinition queue) {
        return queue.getJobTypes().stream().anyMatch(processors::containsKey);
    }
}
