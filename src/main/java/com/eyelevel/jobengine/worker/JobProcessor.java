package com.eyelevel.jobengine.worker;

import com.eyelevel.jobengine.model.JobType;

import java.util.Set;

/**
 * The work behind one or more job types. Implementations are Spring beans; the
 * {@link ProcessorRegistry} collects them and a queue's worker only starts once some processor
 * covers one of its types.
 * <p>
 * Delivery is at least once: a job may be handed to {@link #process} again after a crash or a
 * stalled lock, so implementations must tolerate repeated invocation.
 */
public interface JobProcessor {

    Set<JobType> supportedTypes();

    /**
     * Runs the job.
     *
     * @return a successful result whose data becomes the job's output, or an unsuccessful one that
     * fails the job without a retry.
     *
     * @throws Exception to fail this attempt. The broker redelivers the job until its attempts run out.
     */
    ProcessingResult process(JobExecution execution) throws Exception;
}
