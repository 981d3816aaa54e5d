package com.eyelevel.jobengine.service.job;

import com.eyelevel.jobengine.broker.JobPayload;
import com.eyelevel.jobengine.broker.QueueBackend;
import com.eyelevel.jobengine.broker.QueueDefinition;
import com.eyelevel.jobengine.broker.QueueRegistry;
import com.eyelevel.jobengine.config.JobEngineProperties;
import com.eyelevel.jobengine.dto.job.JobPage;
import com.eyelevel.jobengine.dto.job.JobStatusSummary;
import com.eyelevel.jobengine.dto.job.JobSubmission;
import com.eyelevel.jobengine.dto.job.JobView;
import com.eyelevel.jobengine.exception.InvalidJobTransitionException;
import com.eyelevel.jobengine.exception.apiclient.BadRequestException;
import com.eyelevel.jobengine.exception.apiclient.NotFoundException;
import com.eyelevel.jobengine.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.jobengine.model.JobRecord;
import com.eyelevel.jobengine.model.JobStatus;
import com.eyelevel.jobengine.model.JobType;
import com.eyelevel.jobengine.model.JobUpdate;
import com.eyelevel.jobengine.repository.JobStore;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * The entry point for submitting, inspecting and cancelling jobs, and the only component that
 * moves a job through its lifecycle.
 * <p>
 * The ledger is always written before the broker is touched: a job is persisted as QUEUED and then
 * enqueued under its own id, and a cancellation is recorded before the broker message is removed.
 * Status changes are compare-and-set against the states the target may be reached from, so a
 * late write from a worker can never overwrite a cancellation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobQueueService {

    static final String UNSUPPORTED_JOB_TYPE = "UNSUPPORTED_JOB_TYPE";
    static final String ENQUEUE_FAILED_MESSAGE = "Failed to enqueue job";

    private final JobStore jobStore;
    private final QueueRegistry queueRegistry;
    private final ObjectProvider<QueueBackend> queueBackendProvider;
    private final JobEngineProperties properties;
    private final Validator validator;
    private final Clock clock;

    /**
     * Records a new job and hands it to the broker.
     *
     * @return the ledger id of the job, which is also its broker message id.
     *
     * @throws ServiceUnavailableException if no broker is configured (nothing is written) or the
     *                                     broker rejected the message (the job is marked FAILED).
     * @throws BadRequestException         if the submission is invalid.
     */
    public String createJob(final JobSubmission submission) {
        final QueueBackend backend = queueBackendProvider.getIfAvailable();
        if (backend == null) {
            throw new ServiceUnavailableException("Queue service not available - no broker configured");
        }
        validate(submission);

        final JobRecord record = JobRecord.builder()
                                          .type(submission.getType())
                                          .tenantId(submission.getTenantId())
                                          .userId(submission.getUserId())
                                          .fileId(submission.getFileId())
                                          .productId(submission.getProductId())
                                          .status(JobStatus.QUEUED)
                                          .priority(Optional.ofNullable(submission.getPriority())
                                                            .orElse(properties.getDefaultPriority()))
                                          .input(submission.getOptions() == null
                                                 ? new HashMap<>()
                                                 : new HashMap<>(submission.getOptions()))
                                          .build();
        final String jobId = jobStore.create(record);
        record.setId(jobId);
        log.info("Created job {} of type {} for tenant {}.", jobId, record.getType(), record.getTenantId());

        dispatch(record, backend);
        return jobId;
    }

    /**
     * Enqueues an already persisted QUEUED record under its own id and priority.
     * <p>
     * A type with no queue cancels the record instead of failing the caller. A broker error marks
     * the record FAILED and is reported as {@link ServiceUnavailableException}; nothing retries it.
     */
    public void dispatch(final JobRecord record) {
        final QueueBackend backend = queueBackendProvider.getIfAvailable();
        if (backend == null) {
            throw enqueueFailure(record, null);
        }
        dispatch(record, backend);
    }

    private void dispatch(final JobRecord record, final QueueBackend backend) {
        final Optional<QueueDefinition> queue = queueRegistry.queueFor(record.getType());
        if (queue.isEmpty()) {
            cancelUnsupported(record);
            return;
        }

        final JobPayload payload = JobPayload.builder()
                                             .type(record.getType())
                                             .tenantId(record.getTenantId())
                                             .userId(record.getUserId())
                                             .fileId(record.getFileId())
                                             .productId(record.getProductId())
                                             .options(record.getInput())
                                             .build();
        try {
            backend.enqueue(queue.get().getName(), record.getId(), payload, record.getPriority());
        } catch (final RuntimeException e) {
            throw enqueueFailure(record, e);
        }
        log.info("Job {} added to queue '{}' with priority {}.", record.getId(), queue.get().getName(),
                 record.getPriority());
    }

    public JobView getJobStatus(final String jobId, final String tenantId) {
        return JobView.from(findForTenant(jobId, tenantId));
    }

    /**
     * Lists a tenant's jobs, newest first.
     *
     * @param page  1-based page number; values below 1 are treated as 1.
     * @param limit page size, clamped to the configured maximum. Defaults to the configured size.
     */
    public JobPage listJobs(final String tenantId, final JobStatus status, final JobType type, final Integer page,
                            final Integer limit) {
        final JobEngineProperties.Listing listing = properties.getListing();
        final int effectivePage = page == null ? 1 : Math.max(1, page);
        final int effectiveLimit = limit == null
                                   ? listing.getDefaultPageSize()
                                   : Math.min(listing.getMaxPageSize(), Math.max(1, limit));

        final Page<JobRecord> result = jobStore.findByTenant(
                tenantId, status, type,
                PageRequest.of(effectivePage - 1, effectiveLimit, Sort.by(Sort.Direction.DESC, "createdAt")));
        return JobPage.builder()
                      .jobs(result.getContent().stream().map(JobView::from).toList())
                      .page(effectivePage)
                      .limit(effectiveLimit)
                      .total(result.getTotalElements())
                      .totalPages(result.getTotalPages())
                      .build();
    }

    public JobStatusSummary getStatusSummary(final String tenantId) {
        final Map<JobStatus, Long> byStatus = jobStore.countByStatus(tenantId);
        return JobStatusSummary.builder()
                               .tenantId(tenantId)
                               .total(byStatus.values().stream().mapToLong(Long::longValue).sum())
                               .byStatus(byStatus)
                               .byType(jobStore.countByType(tenantId))
                               .build();
    }

    /**
     * Cancels a queued or running job. The ledger is updated first; removing the broker message is
     * best effort, and a running processor is not interrupted.
     *
     * @throws NotFoundException   if the job does not exist for this tenant.
     * @throws BadRequestException if the job already completed or failed.
     */
    public void cancelJob(final String jobId, final String tenantId) {
        final JobRecord record = findForTenant(jobId, tenantId);
        if (record.getStatus() == JobStatus.CANCELLED) {
            log.debug("Job {} is already cancelled.", jobId);
            return;
        }
        rejectIfFinished(record.getStatus());

        if (!updateStatus(jobId, JobStatus.CANCELLED, null, null)) {
            // Lost a race with a worker; report what the job turned into.
            final JobStatus current = findForTenant(jobId, tenantId).getStatus();
            if (current == JobStatus.CANCELLED) {
                return;
            }
            rejectIfFinished(current);
        }
        log.info("Job {} cancelled by tenant {}.", jobId, tenantId);
        removeFromBroker(record);
    }

    /**
     * Records advisory progress for a running job. Values are clamped to 0..100 and the write is
     * skipped unless the job is PROCESSING.
     */
    public void updateProgress(final String jobId, final int progress) {
        final int clamped = Math.max(0, Math.min(100, progress));
        if (!jobStore.updateProgress(jobId, clamped)) {
            log.debug("Ignored progress {} for job {}: not processing.", clamped, jobId);
        }
    }

    /**
     * Moves a job to {@code status}, attaching output and error when given.
     * <p>
     * {@code startedAt} is set by the first move to PROCESSING only; {@code completedAt} by any
     * terminal status.
     *
     * @return false if the job is missing or its current status cannot reach {@code status}.
     *
     * @throws InvalidJobTransitionException if {@code status} is QUEUED, which is only assigned on
     *                                       creation.
     */
    public boolean updateStatus(final String jobId, final JobStatus status, final Map<String, Object> output,
                                final String error) {
        final Set<JobStatus> predecessors = status.allowedPredecessors();
        if (predecessors.isEmpty()) {
            throw new InvalidJobTransitionException(jobId, status);
        }
        final Instant now = clock.instant();
        final JobUpdate update = JobUpdate.builder()
                                          .status(status)
                                          .output(output)
                                          .error(error)
                                          .startedAtIfUnset(status == JobStatus.PROCESSING ? now : null)
                                          .completedAt(status.isTerminal() ? now : null)
                                          .build();
        final boolean applied = jobStore.updateIfStatus(jobId, predecessors, update);
        if (!applied) {
            log.warn("Dropped transition of job {} to {}: job is missing or already left {}.", jobId, status,
                     predecessors);
        }
        return applied;
    }

    /**
     * Whether a caller cancelled the job. Processors poll this to stop early.
     */
    public boolean isCancelled(final String jobId) {
        return jobStore.findById(jobId)
                       .map(record -> record.getStatus() == JobStatus.CANCELLED)
                       .orElse(false);
    }

    private JobRecord findForTenant(final String jobId, final String tenantId) {
        return jobStore.findById(jobId, tenantId)
                       .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
    }

    private void validate(final JobSubmission submission) {
        if (submission == null) {
            throw new BadRequestException("Job submission is required");
        }
        final Set<ConstraintViolation<JobSubmission>> violations = validator.validate(submission);
        if (!violations.isEmpty()) {
            final String message = violations.stream()
                                             .map(ConstraintViolation::getMessage)
                                             .sorted()
                                             .collect(Collectors.joining(", "));
            throw new BadRequestException("Invalid job submission: " + message);
        }
    }

    private static void rejectIfFinished(final JobStatus status) {
        if (status == JobStatus.COMPLETED || status == JobStatus.FAILED) {
            throw new BadRequestException("Cannot cancel completed or failed job");
        }
    }

    private void cancelUnsupported(final JobRecord record) {
        final String message = "Job type " + record.getType() + " is not yet supported";
        final Map<String, Object> output = new LinkedHashMap<>();
        output.put("reason", UNSUPPORTED_JOB_TYPE);
        output.put("message", message);
        output.put("jobType", record.getType().name());
        updateStatus(record.getId(), JobStatus.CANCELLED, output, null);
        log.warn("No queue registered for job type {}. Job {} was cancelled.", record.getType(), record.getId());
    }

    private ServiceUnavailableException enqueueFailure(final JobRecord record, final RuntimeException cause) {
        log.error("Failed to enqueue job {} of type {}. Marking it as FAILED.", record.getId(), record.getType(),
                  cause);
        updateStatus(record.getId(), JobStatus.FAILED, null, ENQUEUE_FAILED_MESSAGE);
        return new ServiceUnavailableException(ENQUEUE_FAILED_MESSAGE + " " + record.getId(), cause);
    }

    private void removeFromBroker(final JobRecord record) {
        final QueueBackend backend = queueBackendProvider.getIfAvailable();
        final Optional<QueueDefinition> queue = queueRegistry.queueFor(record.getType());
        if (backend == null || queue.isEmpty()) {
            return;
        }
        try {
            if (!backend.remove(queue.get().getName(), record.getId())) {
                log.info("Job {} was not removed from queue '{}': absent or being processed.", record.getId(),
                         queue.get().getName());
            }
        } catch (final RuntimeException e) {
            log.error("Failed to remove cancelled job {} from queue '{}'.", record.getId(), queue.get().getName(), e);
        }
    }
}
