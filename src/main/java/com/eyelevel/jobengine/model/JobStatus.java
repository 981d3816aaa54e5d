package com.eyelevel.jobengine.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Defines the lifecycle states of a {@link JobRecord} in the ledger.
 * <p>
 * The permitted transitions are QUEUED → PROCESSING → {COMPLETED, FAILED} and
 * QUEUED | PROCESSING → CANCELLED. A terminal state is never left.
 */
public enum JobStatus {
    /**
     * The job has been written to the ledger and handed to the broker, waiting for a worker.
     */
    QUEUED,
    /**
     * A worker has claimed the job and its processor is running.
     */
    PROCESSING,
    /**
     * The processor finished successfully and its output has been attached.
     */
    COMPLETED,
    /**
     * The job failed permanently: processor error on the final attempt, enqueue failure,
     * or exhausted recovery attempts.
     */
    FAILED,
    /**
     * The job was cancelled by a caller, or its type has no registered queue.
     */
    CANCELLED;

    public static final Set<JobStatus> ACTIVE_STATUSES = EnumSet.of(QUEUED, PROCESSING);

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Returns the statuses a record must currently be in for a move to this status to be legal.
     * QUEUED is only ever assigned on creation, so nothing may transition into it.
     */
    public Set<JobStatus> allowedPredecessors() {
        return switch (this) {
            case QUEUED -> EnumSet.noneOf(JobStatus.class);
            case PROCESSING -> EnumSet.of(QUEUED, PROCESSING);
            case COMPLETED -> EnumSet.of(PROCESSING);
            // QUEUED -> FAILED is reserved for system failures (enqueue errors, recovery).
            case FAILED, CANCELLED -> EnumSet.of(QUEUED, PROCESSING);
        };
    }
}
