package com.eyelevel.jobengine.worker;

import com.eyelevel.jobengine.broker.JobPayload;
import lombok.Getter;

import java.util.function.BooleanSupplier;
import java.util.function.IntConsumer;

/**
 * What a processor sees of the job it is running.
 */
@Getter
public class JobExecution {

    private final String jobId;
    private final String queueName;
    private final JobPayload payload;
    /**
     * 1-based number of this delivery.
     */
    private final int attempt;
    private final int maxAttempts;
    private final IntConsumer progressSink;
    private final BooleanSupplier cancellationCheck;

    public JobExecution(final String jobId, final String queueName, final JobPayload payload, final int attempt,
                        final int maxAttempts, final IntConsumer progressSink,
                        final BooleanSupplier cancellationCheck) {
        this.jobId = jobId;
        this.queueName = queueName;
        this.payload = payload;
        this.attempt = attempt;
        this.maxAttempts = maxAttempts;
        this.progressSink = progressSink;
        this.cancellationCheck = cancellationCheck;
    }

    /**
     * Reports advisory progress, 0 to 100. Ignored once the job is no longer processing.
     */
    public void reportProgress(final int progress) {
        progressSink.accept(progress);
    }

    /**
     * Whether the job was cancelled while running. Long-running processors should check this
     * between steps and return early; their result is discarded either way.
     */
    public boolean isCancellationRequested() {
        return cancellationCheck.getAsBoolean();
    }

    public Object option(final String name) {
        return payload.getOptions() == null ? null : payload.getOptions().get(name);
    }
}
