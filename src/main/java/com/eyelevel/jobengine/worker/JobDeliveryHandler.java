package com.eyelevel.jobengine.worker;

import com.eyelevel.jobengine.broker.JobPayload;
import com.eyelevel.jobengine.broker.MessageState;
import com.eyelevel.jobengine.broker.QueueMessage;
import com.eyelevel.jobengine.broker.StalledMessage;
import com.eyelevel.jobengine.exception.MessageProcessingFailedException;
import com.eyelevel.jobengine.model.JobStatus;
import com.eyelevel.jobengine.service.job.JobQueueService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Runs one broker delivery against the ledger.
 * <p>
 * The ledger row is claimed first by moving it to PROCESSING. Rows that are terminal or missing
 * (a cancelled job, a job already finished by an earlier delivery) are skipped. Processor errors
 * are recorded on the row and rethrown as {@link MessageProcessingFailedException} so the broker's
 * retry policy decides whether the job runs again; only the final attempt marks the row FAILED.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobDeliveryHandler {

    static final String STALLED_LIMIT_REASON = "job stalled more than allowable limit";

    private final JobQueueService jobQueueService;
    private final ProcessorRegistry processorRegistry;
    private final ApplicationEventPublisher eventPublisher;

    public DeliveryResult handle(final QueueMessage message) {
        final String jobId = message.getId();
        final JobPayload payload = message.getPayload();
        log.info("[{}] Received job {} of type {} (attempt {}/{}).", message.getQueueName(), jobId,
                 payload.getType(), message.currentAttempt(), message.getMaxAttempts());

        if (!jobQueueService.updateStatus(jobId, JobStatus.PROCESSING, null, null)) {
            log.warn("[{}] Could not claim job {}. It may be cancelled, finished or unknown to the ledger.",
                     message.getQueueName(), jobId);
            return DeliveryResult.skipped("Job is not active in the ledger");
        }

        final Optional<JobProcessor> processor = processorRegistry.find(payload.getType());
        if (processor.isEmpty()) {
            return reject(message, "No processor registered for job type " + payload.getType());
        }

        final JobExecution execution = new JobExecution(jobId, message.getQueueName(), payload,
                                                        message.currentAttempt(), message.getMaxAttempts(),
                                                        progress -> reportProgress(message, progress),
                                                        () -> jobQueueService.isCancelled(jobId));
        final ProcessingResult result;
        try {
            result = processor.get().process(execution);
            if (result == null) {
                throw new IllegalStateException("Processor returned no result");
            }
        } catch (final Exception e) {
            throw failAttempt(message, e);
        }

        if (!result.isSuccess()) {
            return reject(message, result.getError() == null ? "Processing failed" : result.getError());
        }
        if (jobQueueService.updateStatus(jobId, JobStatus.COMPLETED, result.getData(), null)) {
            publish(WorkerEventType.COMPLETED, message, null, null);
        } else {
            log.warn("[{}] Job {} finished but the ledger no longer accepts its result.", message.getQueueName(),
                     jobId);
        }
        return DeliveryResult.completed(result.getData());
    }

    /**
     * Reacts to a message whose worker lock expired. When the broker gave up on it the ledger row
     * is failed as well; otherwise the message is simply waiting for another delivery.
     */
    public void onStalled(final StalledMessage stalled) {
        final String detail = stalled.state() == MessageState.FAILED
                              ? STALLED_LIMIT_REASON
                              : "Worker lock expired, job returned to the queue";
        if (stalled.state() == MessageState.FAILED) {
            jobQueueService.updateStatus(stalled.messageId(), JobStatus.FAILED, null, detail);
        }
        eventPublisher.publishEvent(WorkerEvent.builder()
                                               .type(WorkerEventType.STALLED)
                                               .queueName(stalled.queueName())
                                               .jobId(stalled.messageId())
                                               .error(detail)
                                               .build());
    }

    /**
     * Makes sure the ledger agrees with a broker that ran out of attempts for a message.
     */
    public void onAttemptsExhausted(final QueueMessage message, final String reason) {
        if (jobQueueService.updateStatus(message.getId(), JobStatus.FAILED, null, reason)) {
            publish(WorkerEventType.FAILED, message, null, reason);
        }
    }

    private DeliveryResult reject(final QueueMessage message, final String reason) {
        if (jobQueueService.updateStatus(message.getId(), JobStatus.FAILED, null, reason)) {
            publish(WorkerEventType.FAILED, message, null, reason);
        }
        return DeliveryResult.rejected(reason);
    }

    private MessageProcessingFailedException failAttempt(final QueueMessage message, final Exception e) {
        final String error = describe(e);
        if (message.isFinalAttempt()) {
            if (jobQueueService.updateStatus(message.getId(), JobStatus.FAILED, null, error)) {
                publish(WorkerEventType.FAILED, message, null, error);
            }
        } else {
            jobQueueService.updateStatus(message.getId(), JobStatus.PROCESSING, null, error);
        }
        publish(WorkerEventType.ERROR, message, null, error);
        log.error("[{}] Job {} failed on attempt {}/{}. Handing it back to the broker.", message.getQueueName(),
                  message.getId(), message.currentAttempt(), message.getMaxAttempts(), e);
        return new MessageProcessingFailedException("Processing failed for job " + message.getId(), e);
    }

    private void reportProgress(final QueueMessage message, final int progress) {
        jobQueueService.updateProgress(message.getId(), progress);
        publish(WorkerEventType.PROGRESS, message, progress, null);
    }

    private void publish(final WorkerEventType type, final QueueMessage message, final Integer progress,
                         final String error) {
        eventPublisher.publishEvent(WorkerEvent.builder()
                                               .type(type)
                                               .queueName(message.getQueueName())
                                               .jobId(message.getId())
                                               .fileId(message.getPayload().getFileId())
                                               .attempt(message.currentAttempt())
                                               .progress(progress)
                                               .error(error)
                                               .build());
    }

    private static String describe(final Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
