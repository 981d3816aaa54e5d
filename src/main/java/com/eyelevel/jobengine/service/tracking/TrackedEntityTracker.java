package com.eyelevel.jobengine.service.tracking;

import com.eyelevel.jobengine.model.JobType;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Adapts one domain table to the stale job watchdog: how to find rows stuck in an in-flight
 * status, which job type re-runs them, and how to point them at a replacement job.
 */
public interface TrackedEntityTracker {

    /**
     * Short name used in logs and recovery reports.
     */
    String name();

    JobType jobType();

    /**
     * Entities in an in-flight status whose last update happened before {@code threshold}.
     */
    List<TrackedEntity> findStale(Instant threshold);

    void update(String entityId, TrackedEntityUpdate update);

    /**
     * Status an entity gets when it is handed a fresh job.
     */
    String initialStatus();

    /**
     * Status an entity gets when recovery gives up on it.
     */
    String failedStatus();

    /**
     * Options the replacement job needs to process the entity.
     */
    Map<String, Object> recoveryOptions(TrackedEntity entity);
}
