package com.eyelevel.jobengine.broker;

import com.eyelevel.jobengine.model.JobType;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * The effective settings of one logical queue. Several related job types may share a queue.
 */
@Value
@Builder
public class QueueDefinition {
    String name;
    Set<JobType> jobTypes;
    int concurrency;
    int attempts;
    Duration backoffDelay;
    Duration lockDuration;
    Duration pollInterval;
    Duration stalledInterval;
    int maxStalledCount;
    RetentionPolicy removeOnComplete;
    RetentionPolicy removeOnFail;

    /**
     * Exponential backoff: the n-th failure waits {@code backoffDelay * 2^(n-1)}.
     *
     * @param failedAttempts the number of failed attempts including the one just reported, at least 1.
     */
    public Duration backoffFor(final int failedAttempts) {
        final int exponent = Math.max(0, Math.min(failedAttempts - 1, 20));
        return backoffDelay.multipliedBy(1L << exponent);
    }
}
