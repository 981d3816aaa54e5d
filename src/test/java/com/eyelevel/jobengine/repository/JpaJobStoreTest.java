package com.eyelevel.jobengine.repository;

import com.eyelevel.jobengine.common.json.jackson.JacksonJsonParser;
import com.eyelevel.jobengine.common.json.jackson.JacksonJsonSerializer;
import com.eyelevel.jobengine.model.JobRecord;
import com.eyelevel.jobengine.model.JobStatus;
import com.eyelevel.jobengine.model.JobType;
import com.eyelevel.jobengine.model.JobUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the JPA ledger against an embedded database. Every store write commits in its own
 * transaction, so the test itself runs without one.
 */
@DataJpaTest
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Import({JpaJobStore.class, JpaJobStoreTest.ClockConfig.class, JacksonJsonSerializer.class,
         JacksonJsonParser.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class JpaJobStoreTest {

    @TestConfiguration
    static class ClockConfig {
        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }
    }

    @Autowired
    private JobStore jobStore;

    @Autowired
    private JobRecordRepository jobRecordRepository;

    @BeforeEach
    void setUp() {
        jobRecordRepository.deleteAll();
    }

    private String create(final String tenantId, final JobType type) {
        return jobStore.create(JobRecord.builder()
                                        .type(type)
                                        .tenantId(tenantId)
                                        .userId("user-1")
                                        .fileId("file-1")
                                        .status(JobStatus.QUEUED)
                                        .priority(10)
                                        .input(Map.of("language", "en"))
                                        .build());
    }

    @Test
    @DisplayName("Should persist a record with its input and timestamps")
    void testCreate() {
        // When
        final String jobId = create("tenant-a", JobType.PDF_ACCESSIBILITY);

        // Then
        final JobRecord record = jobStore.findById(jobId).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(record.getInput()).containsEntry("language", "en");
        assertThat(record.getOutput()).isNull();
        assertThat(record.getCreatedAt()).isNotNull();
        assertThat(jobStore.findById(jobId, "tenant-a")).isPresent();
        assertThat(jobStore.findById(jobId, "tenant-b")).isEmpty();
    }

    @Test
    @DisplayName("Should apply an update only while the record is in an expected status")
    void testUpdateIfStatus() {
        // Given
        final String jobId = create("tenant-a", JobType.PDF_ACCESSIBILITY);
        final Instant startedAt = Instant.parse("2026-03-01T09:00:00Z");

        // When
        final boolean started = jobStore.updateIfStatus(jobId, EnumSet.of(JobStatus.QUEUED, JobStatus.PROCESSING),
                                                        JobUpdate.builder()
                                                                 .status(JobStatus.PROCESSING)
                                                                 .startedAtIfUnset(startedAt)
                                                                 .build());
        final boolean completed = jobStore.updateIfStatus(jobId, EnumSet.of(JobStatus.PROCESSING),
                                                          JobUpdate.builder()
                                                                   .status(JobStatus.COMPLETED)
                                                                   .output(Map.of("score", 92))
                                                                   .build());
        final boolean lateFailure = jobStore.updateIfStatus(jobId, EnumSet.of(JobStatus.QUEUED, JobStatus.PROCESSING),
                                                            JobUpdate.builder()
                                                                     .status(JobStatus.FAILED)
                                                                     .error("late")
                                                                     .build());

        // Then
        assertThat(started).isTrue();
        assertThat(completed).isTrue();
        assertThat(lateFailure).isFalse();
        final JobRecord record = jobStore.findById(jobId).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(record.getOutput()).containsEntry("score", 92);
        assertThat(record.getError()).isNull();
        assertThat(record.getStartedAt()).isEqualTo(startedAt);
    }

    @Test
    @DisplayName("Should report a missing record instead of failing")
    void testUpdateMissing() {
        assertThat(jobStore.update("missing", JobUpdate.builder().status(JobStatus.FAILED).build())).isFalse();
        assertThat(jobStore.updateIfStatus("missing", EnumSet.allOf(JobStatus.class),
                                           JobUpdate.builder().status(JobStatus.FAILED).build())).isFalse();
        assertThat(jobStore.updateProgress("missing", 10)).isFalse();
    }

    @Test
    @DisplayName("Should only write progress while the job is processing")
    void testUpdateProgress() {
        // Given
        final String jobId = create("tenant-a", JobType.PDF_ACCESSIBILITY);

        // When / Then
        assertThat(jobStore.updateProgress(jobId, 30)).isFalse();

        jobStore.update(jobId, JobUpdate.builder().status(JobStatus.PROCESSING).build());
        assertThat(jobStore.updateProgress(jobId, 30)).isTrue();
        assertThat(jobStore.findById(jobId).orElseThrow().getProgress()).isEqualTo(30);
    }

    @Test
    @DisplayName("Should page and filter a tenant's jobs")
    void testFindByTenant() {
        // Given
        create("tenant-a", JobType.PDF_ACCESSIBILITY);
        create("tenant-a", JobType.PDF_ACCESSIBILITY);
        final String citation = create("tenant-a", JobType.CITATION_DETECTION);
        create("tenant-b", JobType.PDF_ACCESSIBILITY);
        jobStore.update(citation, JobUpdate.builder().status(JobStatus.CANCELLED).build());

        final PageRequest firstTwo = PageRequest.of(0, 2, Sort.by(Sort.Direction.DESC, "createdAt"));

        // When
        final Page<JobRecord> all = jobStore.findByTenant("tenant-a", null, null, firstTwo);
        final Page<JobRecord> cancelled = jobStore.findByTenant("tenant-a", JobStatus.CANCELLED, null, firstTwo);
        final Page<JobRecord> accessibility = jobStore.findByTenant("tenant-a", JobStatus.QUEUED,
                                                                    JobType.PDF_ACCESSIBILITY, firstTwo);

        // Then
        assertThat(all.getTotalElements()).isEqualTo(3);
        assertThat(all.getContent()).hasSize(2);
        assertThat(cancelled.getContent()).extracting(JobRecord::getId).containsExactly(citation);
        assertThat(accessibility.getTotalElements()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should count a tenant's jobs by status and by type")
    void testCounts() {
        // Given
        create("tenant-a", JobType.PDF_ACCESSIBILITY);
        final String cancelled = create("tenant-a", JobType.VPAT_GENERATION);
        create("tenant-b", JobType.PDF_ACCESSIBILITY);
        jobStore.update(cancelled, JobUpdate.builder().status(JobStatus.CANCELLED).build());

        // When / Then
        assertThat(jobStore.countByStatus("tenant-a")).containsOnly(Map.entry(JobStatus.QUEUED, 1L),
                                                                    Map.entry(JobStatus.CANCELLED, 1L));
        assertThat(jobStore.countByType("tenant-a")).containsOnly(Map.entry(JobType.PDF_ACCESSIBILITY, 1L),
                                                                  Map.entry(JobType.VPAT_GENERATION, 1L));
    }
}
