package com.eyelevel.jobengine.service.tracking;

import lombok.Builder;
import lombok.Value;

/**
 * A status change of a tracked entity. A null {@code jobId} keeps the current job reference.
 */
@Value
@Builder
public class TrackedEntityUpdate {
    String status;
    String jobId;
}
