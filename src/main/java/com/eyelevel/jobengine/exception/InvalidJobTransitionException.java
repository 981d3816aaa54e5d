package com.eyelevel.jobengine.exception;

import com.eyelevel.jobengine.model.JobStatus;

import java.io.Serial;

/**
 * Raised when a caller asks for a status the ledger state machine can never reach from any state,
 * such as moving a job back to QUEUED.
 */
public class InvalidJobTransitionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -1720548842296410377L;

    public InvalidJobTransitionException(String jobId, JobStatus target) {
        super("Job " + jobId + " cannot transition to " + target);
    }
}
