package com.eyelevel.jobengine.scheduler;

import com.eyelevel.jobengine.broker.QueueBackend;
import com.eyelevel.jobengine.broker.QueueDefinition;
import com.eyelevel.jobengine.broker.QueueRegistry;
import com.eyelevel.jobengine.config.JobEngineProperties;
import com.eyelevel.jobengine.model.JobRecord;
import com.eyelevel.jobengine.model.JobStatus;
import com.eyelevel.jobengine.model.JobUpdate;
import com.eyelevel.jobengine.repository.JobStore;
import com.eyelevel.jobengine.service.job.JobQueueService;
import com.eyelevel.jobengine.service.tracking.TrackedEntity;
import com.eyelevel.jobengine.service.tracking.TrackedEntityTracker;
import com.eyelevel.jobengine.service.tracking.TrackedEntityUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.util.CollectionUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Finds work orphaned by crashed workers or exhausted broker retries and re-queues it.
 * <p>
 * A tracked entity that stayed in an in-flight status longer than the stale threshold gets a new
 * job record (the broker never accepts a message id twice) and is pointed at it. Each replacement
 * counts against the entity's recovery budget; once the budget is spent the entity and its job are
 * failed for good. The stuck job record itself is left as it was.
 * <p>
 * Only one tick runs at a time in this process. A tick never throws.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StaleJobWatchdog {

    static final String SYSTEM_USER = "system";

    private final List<TrackedEntityTracker> trackers;
    private final JobStore jobStore;
    private final JobQueueService jobQueueService;
    private final QueueRegistry queueRegistry;
    private final ObjectProvider<QueueBackend> queueBackendProvider;
    private final JobEngineProperties properties;
    private final Clock clock;

    private final AtomicBoolean recovering = new AtomicBoolean(false);

    public RecoveryReport recoverStaleJobs() {
        final QueueBackend backend = queueBackendProvider.getIfAvailable();
        if (backend == null) {
            return RecoveryReport.skippedRun();
        }
        if (!recovering.compareAndSet(false, true)) {
            log.debug("Skipping stale job recovery: previous run still in progress.");
            return RecoveryReport.skippedRun();
        }

        final Tally tally = new Tally();
        try {
            final Instant threshold = clock.instant().minus(properties.getWatchdog().getStaleThreshold());
            for (final TrackedEntityTracker tracker : trackers) {
                scan(tracker, threshold, backend, tally);
            }
        } catch (final RuntimeException e) {
            log.error("Stale job recovery failed.", e);
        } finally {
            recovering.set(false);
        }

        final RecoveryReport report = new RecoveryReport(false, tally.scanned, tally.recovered, tally.failed,
                                                         tally.errors);
        if (report.scanned() > 0) {
            log.info("Stale job recovery finished: {}", report);
        }
        return report;
    }

    private void scan(final TrackedEntityTracker tracker, final Instant threshold, final QueueBackend backend,
                      final Tally tally) {
        final Optional<QueueDefinition> queue = queueRegistry.queueFor(tracker.jobType());
        if (queue.isEmpty()) {
            log.warn("No queue carries {} jobs; skipping recovery of {} entities.", tracker.jobType(), tracker.name());
            return;
        }

        final List<TrackedEntity> stale;
        try {
            stale = tracker.findStale(threshold);
        } catch (final RuntimeException e) {
            log.error("Could not look up stale {} entities.", tracker.name(), e);
            tally.errors++;
            return;
        }
        if (CollectionUtils.isEmpty(stale)) {
            return;
        }

        log.info("Found {} stale {} entit(ies) to recover.", stale.size(), tracker.name());
        tally.scanned += stale.size();
        for (final TrackedEntity entity : stale) {
            try {
                if (recover(tracker, entity, queue.get(), backend)) {
                    tally.recovered++;
                } else {
                    tally.failed++;
                }
            } catch (final RuntimeException e) {
                tally.errors++;
                log.error("Failed to recover {} {}.", tracker.name(), entity.getId(), e);
            }
        }
    }

    /**
     * @return true if the entity was re-queued, false if it was failed for good.
     */
    private boolean recover(final TrackedEntityTracker tracker, final TrackedEntity entity,
                            final QueueDefinition queue, final QueueBackend backend) {
        final JobEngineProperties.Watchdog settings = properties.getWatchdog();
        final String oldJobId = entity.getJobId();
        final Optional<JobRecord> oldJob = Optional.ofNullable(oldJobId).flatMap(jobStore::findById);
        final int recoveryCount = oldJob.map(JobRecord::getRecoveryCount).orElse(0);

        if (recoveryCount >= settings.getMaxRecoveryAttempts()) {
            final String error = "Job failed after " + recoveryCount + " recovery attempts";
            log.warn("{} {} exceeded max recovery attempts ({}). Marking it as FAILED.", tracker.name(),
                     entity.getId(), recoveryCount);
            if (oldJob.isPresent()) {
                jobQueueService.updateStatus(oldJobId, JobStatus.FAILED, null, error);
            }
            tracker.update(entity.getId(), TrackedEntityUpdate.builder().status(tracker.failedStatus()).build());
            return false;
        }

        log.info("Re-queuing {} {} (was {} since {}, attempt {}/{}).", tracker.name(), entity.getId(),
                 entity.getStatus(), entity.getUpdatedAt(), recoveryCount + 1, settings.getMaxRecoveryAttempts());
        if (oldJobId != null) {
            removeOldMessage(backend, queue, oldJobId);
        }

        final Instant now = clock.instant();
        final Map<String, Object> input = new HashMap<>(tracker.recoveryOptions(entity));
        input.put("recoveredAt", now.toString());
        final JobRecord replacement = JobRecord.builder()
                                               .type(tracker.jobType())
                                               .tenantId(entity.getTenantId())
                                               .userId(oldJob.map(JobRecord::getUserId).orElse(SYSTEM_USER))
                                               .fileId(oldJob.map(JobRecord::getFileId).orElse(null))
                                               .productId(oldJob.map(JobRecord::getProductId).orElse(null))
                                               .status(JobStatus.QUEUED)
                                               .priority(settings.getRecoveryPriority())
                                               .input(input)
                                               .recoveryCount(recoveryCount + 1)
                                               .recoveredFrom(oldJobId)
                                               .build();
        final String newJobId = jobStore.create(replacement);
        replacement.setId(newJobId);

        try {
            tracker.update(entity.getId(), TrackedEntityUpdate.builder()
                                                              .status(tracker.initialStatus())
                                                              .jobId(newJobId)
                                                              .build());
        } catch (final RuntimeException e) {
            try {
                abandonReplacement(tracker, entity, oldJob, replacement);
            } catch (final RuntimeException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        jobQueueService.dispatch(replacement);
        log.info("Re-queued {} {} with new job {}.", tracker.name(), entity.getId(), newJobId);
        return true;
    }

    /**
     * Fails a replacement whose entity could not be repointed. The attempt still counts against the
     * budget: the old job carries the new recovery count, since the entity keeps pointing at it.
     */
    private void abandonReplacement(final TrackedEntityTracker tracker, final TrackedEntity entity,
                                    final Optional<JobRecord> oldJob, final JobRecord replacement) {
        final String error = "Recovery aborted: " + tracker.name() + " " + entity.getId() + " could not be repointed";
        log.warn("Could not repoint {} {} to job {}. Marking the replacement as FAILED.", tracker.name(),
                 entity.getId(), replacement.getId());
        jobQueueService.updateStatus(replacement.getId(), JobStatus.FAILED, null, error);
        oldJob.ifPresent(job -> jobStore.update(job.getId(), JobUpdate.builder()
                                                                     .recoveryCount(replacement.getRecoveryCount())
                                                                     .build()));
    }

    private void removeOldMessage(final QueueBackend backend, final QueueDefinition queue, final String oldJobId) {
        try {
            if (backend.remove(queue.getName(), oldJobId)) {
                log.info("Removed stale message {} from queue '{}'.", oldJobId, queue.getName());
            }
        } catch (final RuntimeException e) {
            log.warn("Could not remove stale message {} from queue '{}'.", oldJobId, queue.getName(), e);
        }
    }

    public boolean isRecovering() {
        return recovering.get();
    }

    private static final class Tally {
        private int scanned;
        private int recovered;
        private int failed;
        private int errors;
    }
}
