package com.eyelevel.jobengine.repository;

import com.eyelevel.jobengine.dto.metric.JobStatusCount;
import com.eyelevel.jobengine.dto.metric.JobTypeCount;
import com.eyelevel.jobengine.model.JobRecord;
import com.eyelevel.jobengine.model.JobStatus;
import com.eyelevel.jobengine.model.JobType;
import com.eyelevel.jobengine.model.JobUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link JobStore} backed by Spring Data JPA.
 * <p>
 * Every write runs in its own transaction so that a ledger change is committed before the caller
 * talks to the broker, and is retried when the database reports a transient failure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    private final JobRecordRepository jobRecordRepository;
    private final Clock clock;

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 200, multiplier = 2))
    public String create(final JobRecord record) {
        final JobRecord saved = jobRecordRepository.saveAndFlush(record);
        log.debug("Created job record {} of type {} for tenant {}.", saved.getId(), saved.getType(),
                  saved.getTenantId());
        return saved.getId();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobRecord> findById(final String id) {
        return jobRecordRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<JobRecord> findById(final String id, final String tenantId) {
        return jobRecordRepository.findByIdAndTenantId(id, tenantId);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 200, multiplier = 2))
    public boolean update(final String id, final JobUpdate update) {
        return jobRecordRepository.findByIdForUpdate(id)
                                  .map(record -> {
                                      update.applyTo(record);
                                      return true;
                                  })
                                  .orElse(false);
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 200, multiplier = 2))
    public boolean updateIfStatus(final String id, final Set<JobStatus> expected, final JobUpdate update) {
        final Optional<JobRecord> locked = jobRecordRepository.findByIdForUpdate(id);
        if (locked.isEmpty()) {
            return false;
        }
        final JobRecord record = locked.get();
        if (!expected.contains(record.getStatus())) {
            log.debug("Skipped update of job {}: status is {}, expected one of {}.", id, record.getStatus(),
                      expected);
            return false;
        }
        update.applyTo(record);
        return true;
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    @Retryable(retryFor = TransientDataAccessException.class, maxAttempts = 3,
               backoff = @Backoff(delay = 200, multiplier = 2))
    public boolean updateProgress(final String id, final int progress) {
        return jobRecordRepository.updateProgressIfStatus(id, progress, JobStatus.PROCESSING, clock.instant()) > 0;
    }

    @Override
    @Transactional(readOnly = true)
    public Page<JobRecord> findByTenant(final String tenantId, final JobStatus status, final JobType type,
                                        final Pageable pageable) {
        return jobRecordRepository.findByTenant(tenantId, status, type, pageable);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<JobStatus, Long> countByStatus(final String tenantId) {
        final Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (final JobStatusCount row : jobRecordRepository.countByStatus(tenantId)) {
            counts.put(row.getStatus(), row.getCount());
        }
        return counts;
    }

    @Override
    @Transactional(readOnly = true)
    public Map<JobType, Long> countByType(final String tenantId) {
        final Map<JobType, Long> counts = new EnumMap<>(JobType.class);
        for (final JobTypeCount row : jobRecordRepository.countByType(tenantId)) {
            counts.put(row.getType(), row.getCount());
        }
        return counts;
    }
}
