package com.eyelevel.jobengine.service.tracking;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A row of another domain table whose status mirrors a job, as seen by the stale job watchdog.
 */
@Value
@Builder
public class TrackedEntity {
    String id;
    String tenantId;
    String status;
    Instant updatedAt;
    String jobId;
}
