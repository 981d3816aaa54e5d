package com.eyelevel.jobengine.broker;

/**
 * What the broker did with a delivery that a worker reported as failed.
 */
public enum FailureOutcome {
    /**
     * The message will be redelivered after its backoff delay.
     */
    RETRY_SCHEDULED,
    /**
     * No attempts remain, or the failure was not retryable; the message is in the failed set.
     */
    EXHAUSTED,
    /**
     * The broker no longer tracks the message under this worker's lock (removed or stalled away).
     */
    DISCARDED
}
