package com.eyelevel.jobengine.broker;

/**
 * Number of messages per state in one queue.
 */
public record QueueCounts(long waiting, long delayed, long active, long completed, long failed) {
}
