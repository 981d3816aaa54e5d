package com.eyelevel.jobengine.repository;

import com.eyelevel.jobengine.model.JobRecord;
import com.eyelevel.jobengine.model.JobStatus;
import com.eyelevel.jobengine.model.JobType;
import com.eyelevel.jobengine.model.JobUpdate;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable persistence of {@link JobRecord}s. Holds no business rules: transition checks live in
 * the queue service, which uses {@link #updateIfStatus} to apply them atomically.
 */
public interface JobStore {

    /**
     * Inserts a new record and returns the id the ledger assigned to it.
     */
    String create(JobRecord record);

    Optional<JobRecord> findById(String id);

    /**
     * Looks a record up within one tenant. A record of another tenant is reported as absent.
     */
    Optional<JobRecord> findById(String id, String tenantId);

    /**
     * Applies the non-null fields of {@code update}.
     *
     * @return false if the record does not exist.
     */
    boolean update(String id, JobUpdate update);

    /**
     * Applies {@code update} only if the record's current status is one of {@code expected}. The
     * check and the write happen under a row lock.
     *
     * @return true if the update was applied.
     */
    boolean updateIfStatus(String id, Set<JobStatus> expected, JobUpdate update);

    /**
     * Writes the progress column alone, and only while the record is PROCESSING.
     */
    boolean updateProgress(String id, int progress);

    Page<JobRecord> findByTenant(String tenantId, JobStatus status, JobType type, Pageable pageable);

    Map<JobStatus, Long> countByStatus(String tenantId);

    Map<JobType, Long> countByType(String tenantId);
}
