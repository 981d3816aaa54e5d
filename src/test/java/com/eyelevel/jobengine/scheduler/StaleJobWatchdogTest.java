package com.eyelevel.jobengine.scheduler;

import com.eyelevel.jobengine.broker.MessageState;
import com.eyelevel.jobengine.broker.QueueBackend;
import com.eyelevel.jobengine.broker.QueueMessage;
import com.eyelevel.jobengine.exception.apiclient.NotFoundException;
import com.eyelevel.jobengine.model.JobRecord;
import com.eyelevel.jobengine.model.JobStatus;
import com.eyelevel.jobengine.model.JobType;
import com.eyelevel.jobengine.service.tracking.TrackedEntity;
import com.eyelevel.jobengine.service.tracking.TrackedEntityTracker;
import com.eyelevel.jobengine.service.tracking.TrackedEntityUpdate;
import com.eyelevel.jobengine.support.TestJobEngine;
import com.eyelevel.jobengine.support.TestQueues;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class StaleJobWatchdogTest {

    private TestJobEngine engine;
    private FakeTracker tracker;

    @BeforeEach
    void setUp() {
        engine = new TestJobEngine();
        tracker = new FakeTracker(JobType.CITATION_DETECTION);
    }

    private StaleJobWatchdog watchdog(final TrackedEntityTracker... trackers) {
        return new StaleJobWatchdog(List.of(trackers), engine.jobStore(), engine.jobQueueService(),
                                    engine.queueRegistry(), engine.backendProvider(), engine.properties(),
                                    engine.clock());
    }

    private Instant minutesAgo(final int minutes) {
        return engine.clock().instant().minus(Duration.ofMinutes(minutes));
    }

    private JobRecord withRecoveryCount(final String jobId, final int recoveryCount) {
        final JobRecord record = engine.job(jobId);
        record.setRecoveryCount(recoveryCount);
        return engine.jobStore().put(record);
    }

    @Test
    @DisplayName("Should re-queue a stale entity under a new job record")
    void testRecoversStaleEntity() {
        // Given
        final String oldJobId = engine.submit(JobType.CITATION_DETECTION, "file-1");
        tracker.add("doc-1", "PROCESSING", minutesAgo(10), oldJobId);
        final Instant now = engine.clock().instant();

        // When
        final RecoveryReport report = watchdog(tracker).recoverStaleJobs();

        // Then
        assertThat(report).isEqualTo(new RecoveryReport(false, 1, 1, 0, 0));

        final String newJobId = tracker.jobIdOf("doc-1");
        assertThat(newJobId).isNotEqualTo(oldJobId);
        assertThat(tracker.statusOf("doc-1")).isEqualTo("QUEUED");

        final JobRecord replacement = engine.job(newJobId);
        assertThat(replacement.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(replacement.getType()).isEqualTo(JobType.CITATION_DETECTION);
        assertThat(replacement.getRecoveryCount()).isEqualTo(1);
        assertThat(replacement.getRecoveredFrom()).isEqualTo(oldJobId);
        assertThat(replacement.getPriority()).isEqualTo(1);
        assertThat(replacement.getUserId()).isEqualTo("user-1");
        assertThat(replacement.getFileId()).isEqualTo("file-1");
        assertThat(replacement.getInput()).containsEntry("documentId", "doc-1")
                                          .containsEntry("recoveredAt", now.toString());

        assertThat(engine.job(oldJobId).getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(engine.queueBackend().getState(TestQueues.CITATION, oldJobId)).isEmpty();
        final QueueMessage message = engine.queueBackend()
                                           .claim(TestQueues.CITATION, "worker-1", Duration.ofSeconds(30))
                                           .orElseThrow();
        assertThat(message.getId()).isEqualTo(newJobId);
        assertThat(message.getPriority()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should fail the entity and its job once the recovery budget is spent")
    void testRecoveryBudgetExhausted() {
        // Given
        final String oldJobId = engine.submit(JobType.CITATION_DETECTION, "file-1");
        withRecoveryCount(oldJobId, 3);
        tracker.add("doc-1", "PROCESSING", minutesAgo(10), oldJobId);

        // When
        final RecoveryReport report = watchdog(tracker).recoverStaleJobs();

        // Then
        assertThat(report).isEqualTo(new RecoveryReport(false, 1, 0, 1, 0));
        assertThat(tracker.statusOf("doc-1")).isEqualTo("FAILED");
        assertThat(tracker.jobIdOf("doc-1")).isEqualTo(oldJobId);

        final JobRecord oldJob = engine.job(oldJobId);
        assertThat(oldJob.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(oldJob.getError()).isEqualTo("Job failed after 3 recovery attempts");
        assertThat(engine.jobStore().all()).hasSize(1);
    }

    @Test
    @DisplayName("Should count recoveries along the chain of replacement jobs")
    void testRecoveryChain() {
        // Given
        final String oldJobId = engine.submit(JobType.CITATION_DETECTION, "file-1");
        withRecoveryCount(oldJobId, 2);
        tracker.add("doc-1", "PROCESSING", minutesAgo(10), oldJobId);

        // When
        watchdog(tracker).recoverStaleJobs();

        // Then
        final JobRecord replacement = engine.job(tracker.jobIdOf("doc-1"));
        assertThat(replacement.getRecoveryCount()).isEqualTo(3);

        // When the replacement stalls too
        tracker.touch("doc-1", "PROCESSING", minutesAgo(10));
        final RecoveryReport report = watchdog(tracker).recoverStaleJobs();

        // Then
        assertThat(report.failed()).isEqualTo(1);
        assertThat(engine.job(replacement.getId()).getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(engine.job(replacement.getId()).getError()).isEqualTo("Job failed after 3 recovery attempts");
    }

    @Test
    @DisplayName("Should recover an entity that has no job record as the system user")
    void testEntityWithoutJob() {
        // Given
        tracker.add("doc-1", "QUEUED", minutesAgo(10), null);

        // When
        final RecoveryReport report = watchdog(tracker).recoverStaleJobs();

        // Then
        assertThat(report.recovered()).isEqualTo(1);
        final JobRecord replacement = engine.job(tracker.jobIdOf("doc-1"));
        assertThat(replacement.getUserId()).isEqualTo(StaleJobWatchdog.SYSTEM_USER);
        assertThat(replacement.getTenantId()).isEqualTo(TestJobEngine.TENANT);
        assertThat(replacement.getRecoveryCount()).isEqualTo(1);
        assertThat(replacement.getRecoveredFrom()).isNull();
    }

    @Test
    @DisplayName("Should keep recovering other entities when one of them fails")
    void testContinuesAfterEntityFailure() {
        // Given
        tracker.add("doc-1", "PROCESSING", minutesAgo(10), null);
        tracker.add("doc-2", "PROCESSING", minutesAgo(10), null);
        tracker.failUpdatesOf("doc-1");

        // When
        final RecoveryReport report = watchdog(tracker).recoverStaleJobs();

        // Then
        assertThat(report).isEqualTo(new RecoveryReport(false, 2, 1, 0, 1));
        assertThat(tracker.statusOf("doc-2")).isEqualTo("QUEUED");
        assertThat(watchdog(tracker).isRecovering()).isFalse();

        final List<JobRecord> unreferenced = engine.jobStore().all().stream()
                                                   .filter(job -> !job.getId().equals(tracker.jobIdOf("doc-2")))
                                                   .toList();
        assertThat(unreferenced).hasSize(1);
        assertThat(unreferenced.get(0).getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(unreferenced.get(0).getError()).isEqualTo("Recovery aborted: document doc-1 could not be repointed");
        assertThat(engine.queueBackend().getState(TestQueues.CITATION, unreferenced.get(0).getId())).isEmpty();
    }

    @Test
    @DisplayName("Should spend the recovery budget even when the entity can never be repointed")
    void testRepointFailuresAreBounded() {
        // Given
        final String oldJobId = engine.submit(JobType.CITATION_DETECTION, "file-1");
        tracker.add("doc-1", "PROCESSING", minutesAgo(10), oldJobId);
        tracker.failUpdatesOf("doc-1");
        final StaleJobWatchdog watchdog = watchdog(tracker);

        // When
        for (int tick = 0; tick < 5; tick++) {
            watchdog.recoverStaleJobs();
        }

        // Then
        final List<JobRecord> replacements = engine.jobStore().all().stream()
                                                   .filter(job -> oldJobId.equals(job.getRecoveredFrom()))
                                                   .toList();
        assertThat(replacements).hasSize(3)
                                .allSatisfy(job -> assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED));
        assertThat(replacements).extracting(JobRecord::getRecoveryCount).containsExactlyInAnyOrder(1, 2, 3);
        final JobRecord oldJob = engine.job(oldJobId);
        assertThat(oldJob.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(oldJob.getError()).isEqualTo("Job failed after 3 recovery attempts");
    }

    @Test
    @DisplayName("Should skip a tick while the previous one is still running")
    void testOverlappingTickIsSkipped() throws Exception {
        // Given
        final CountDownLatch scanning = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger scans = new AtomicInteger();
        final FakeTracker blocking = new FakeTracker(JobType.CITATION_DETECTION) {
            @Override
            public List<TrackedEntity> findStale(final Instant threshold) {
                scans.incrementAndGet();
                scanning.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.findStale(threshold);
            }
        };
        blocking.add("doc-1", "PROCESSING", minutesAgo(10), null);
        final StaleJobWatchdog watchdog = watchdog(blocking);
        final CompletableFuture<RecoveryReport> first = CompletableFuture.supplyAsync(watchdog::recoverStaleJobs);
        assertThat(scanning.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        final RecoveryReport second = watchdog.recoverStaleJobs();
        release.countDown();

        // Then
        assertThat(second.skipped()).isTrue();
        assertThat(first.get(5, TimeUnit.SECONDS).recovered()).isEqualTo(1);
        assertThat(scans).hasValue(1);
        assertThat(engine.jobStore().all()).hasSize(1);
    }

    @Test
    @DisplayName("Should ignore entities updated within the stale threshold")
    void testFreshEntityIgnored() {
        tracker.add("doc-1", "PROCESSING", minutesAgo(2), null);

        final RecoveryReport report = watchdog(tracker).recoverStaleJobs();

        assertThat(report.scanned()).isZero();
        assertThat(engine.jobStore().all()).isEmpty();
    }

    @Test
    @DisplayName("Should skip trackers whose job type has no queue")
    void testTrackerWithoutQueue() {
        final FakeTracker unrouted = new FakeTracker(JobType.EDITORIAL_FULL);
        unrouted.add("doc-1", "PROCESSING", minutesAgo(10), null);

        final RecoveryReport report = watchdog(unrouted).recoverStaleJobs();

        assertThat(report.scanned()).isZero();
        assertThat(unrouted.statusOf("doc-1")).isEqualTo("PROCESSING");
    }

    @Test
    @DisplayName("Should do nothing without a broker")
    void testNoBroker() {
        // Given
        tracker.add("doc-1", "PROCESSING", minutesAgo(10), null);
        final StaleJobWatchdog watchdog = new StaleJobWatchdog(
                List.of(tracker), engine.jobStore(), engine.jobQueueService(), engine.queueRegistry(),
                new StaticListableBeanFactory().getBeanProvider(QueueBackend.class), engine.properties(),
                engine.clock());

        // When
        final RecoveryReport report = watchdog.recoverStaleJobs();

        // Then
        assertThat(report.skipped()).isTrue();
        assertThat(tracker.statusOf("doc-1")).isEqualTo("PROCESSING");
    }

    @Test
    @DisplayName("Should leave a message that a worker holds in place")
    void testActiveMessageNotRemoved() {
        // Given
        final String oldJobId = engine.submit(JobType.CITATION_DETECTION, "file-1");
        engine.queueBackend().claim(TestQueues.CITATION, "slow-worker", Duration.ofMinutes(30));
        tracker.add("doc-1", "PROCESSING", minutesAgo(10), oldJobId);

        // When
        final RecoveryReport report = watchdog(tracker).recoverStaleJobs();

        // Then
        assertThat(report.recovered()).isEqualTo(1);
        assertThat(engine.queueBackend().getState(TestQueues.CITATION, oldJobId)).contains(MessageState.ACTIVE);
    }

    /**
     * Keeps tracked entities in a map, like a domain table would.
     */
    private class FakeTracker implements TrackedEntityTracker {

        private final JobType jobType;
        private final Map<String, TrackedEntity> entities = new LinkedHashMap<>();
        private final Set<String> failingUpdates = new HashSet<>();

        FakeTracker(final JobType jobType) {
            this.jobType = jobType;
        }

        void add(final String id, final String status, final Instant updatedAt, final String jobId) {
            entities.put(id, TrackedEntity.builder()
                                          .id(id)
                                          .tenantId(TestJobEngine.TENANT)
                                          .status(status)
                                          .updatedAt(updatedAt)
                                          .jobId(jobId)
                                          .build());
        }

        void touch(final String id, final String status, final Instant updatedAt) {
            add(id, status, updatedAt, jobIdOf(id));
        }

        void failUpdatesOf(final String id) {
            failingUpdates.add(id);
        }

        String statusOf(final String id) {
            return entities.get(id).getStatus();
        }

        String jobIdOf(final String id) {
            return entities.get(id).getJobId();
        }

        @Override
        public String name() {
            return "document";
        }

        @Override
        public JobType jobType() {
            return jobType;
        }

        @Override
        public List<TrackedEntity> findStale(final Instant threshold) {
            return entities.values().stream()
                           .filter(e -> Set.of("QUEUED", "PROCESSING").contains(e.getStatus()))
                           .filter(e -> e.getUpdatedAt().isBefore(threshold))
                           .toList();
        }

        @Override
        public void update(final String entityId, final TrackedEntityUpdate update) {
            if (failingUpdates.contains(entityId)) {
                throw new NotFoundException("Document not found: " + entityId);
            }
            final TrackedEntity current = entities.get(entityId);
            entities.put(entityId, TrackedEntity.builder()
                                                .id(entityId)
                                                .tenantId(current.getTenantId())
                                                .status(update.getStatus())
                                                .updatedAt(engine.clock().instant())
                                                .jobId(update.getJobId() == null ? current.getJobId()
                                                                                 : update.getJobId())
                                                .build());
        }

        @Override
        public String initialStatus() {
            return "QUEUED";
        }

        @Override
        public String failedStatus() {
            return "FAILED";
        }

        @Override
        public Map<String, Object> recoveryOptions(final TrackedEntity entity) {
            return Map.of("documentId", entity.getId());
        }
    }
}
