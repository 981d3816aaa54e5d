package com.eyelevel.jobengine.broker;

import java.time.Duration;

/**
 * Bounds how many finished messages a queue keeps, and for how long.
 */
public record RetentionPolicy(Duration maxAge, int maxCount) {
}
