package com.eyelevel.jobengine.worker;

import lombok.Builder;
import lombok.Value;

/**
 * A lifecycle signal of a worker, published as a Spring application event.
 * <p>
 * COMPLETED and FAILED are published only when the ledger accepted the terminal status, so
 * listeners never act on a job that was cancelled meanwhile. ERROR marks a failed attempt that
 * may still be retried.
 */
@Value
@Builder
public class WorkerEvent {
    WorkerEventType type;
    String queueName;
    String jobId;
    /**
     * The stored file the job works on, if any.
     */
    String fileId;
    int attempt;
    Integer progress;
    String error;
}
