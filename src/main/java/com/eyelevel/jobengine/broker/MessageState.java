package com.eyelevel.jobengine.broker;

/**
 * Where a message currently sits inside a queue.
 */
public enum MessageState {
    /**
     * Ready to be claimed, ordered by priority then arrival.
     */
    WAITING,
    /**
     * Waiting out a retry backoff.
     */
    DELAYED,
    /**
     * Claimed by a worker that holds its lock.
     */
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
