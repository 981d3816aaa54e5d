package com.eyelevel.jobengine.repository;

import com.eyelevel.jobengine.dto.metric.JobStatusCount;
import com.eyelevel.jobengine.dto.metric.JobTypeCount;
import com.eyelevel.jobengine.model.JobRecord;
import com.eyelevel.jobengine.model.JobStatus;
import com.eyelevel.jobengine.model.JobType;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link JobRecord} ledger.
 */
@Repository
public interface JobRecordRepository extends JpaRepository<JobRecord, String> {

    Optional<JobRecord> findByIdAndTenantId(String id, String tenantId);

    /**
     * Loads a record under a row lock. Used by compare-and-set status updates so that two writers
     * racing on the same job are serialised by the database.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM JobRecord j WHERE j.id = :id")
    Optional<JobRecord> findByIdForUpdate(@Param("id") String id);

    /**
     * Writes progress only while the job is in the given status.
     *
     * @return the number of rows updated, 0 if the job is missing or in another status.
     */
    @Modifying
    @Query("UPDATE JobRecord j SET j.progress = :progress, j.updatedAt = :now WHERE j.id = :id AND j.status = :status")
    int updateProgressIfStatus(@Param("id") String id,
                               @Param("progress") int progress,
                               @Param("status") JobStatus status,
                               @Param("now") Instant now);

    @Query(value = "SELECT j FROM JobRecord j WHERE j.tenantId = :tenantId "
                   + "AND (:status IS NULL OR j.status = :status) AND (:type IS NULL OR j.type = :type)",
           countQuery = "SELECT COUNT(j) FROM JobRecord j WHERE j.tenantId = :tenantId "
                        + "AND (:status IS NULL OR j.status = :status) AND (:type IS NULL OR j.type = :type)")
    Page<JobRecord> findByTenant(@Param("tenantId") String tenantId,
                                 @Param("status") JobStatus status,
                                 @Param("type") JobType type,
                                 Pageable pageable);

    @Query("SELECT new com.eyelevel.jobengine.dto.metric.JobStatusCount(j.status, COUNT(j)) "
           + "FROM JobRecord j WHERE j.tenantId = :tenantId GROUP BY j.status")
    List<JobStatusCount> countByStatus(@Param("tenantId") String tenantId);

    @Query("SELECT new com.eyelevel.jobengine.dto.metric.JobTypeCount(j.type, COUNT(j)) "
           + "FROM JobRecord j WHERE j.tenantId = :tenantId GROUP BY j.type")
    List<JobTypeCount> countByType(@Param("tenantId") String tenantId);
}
