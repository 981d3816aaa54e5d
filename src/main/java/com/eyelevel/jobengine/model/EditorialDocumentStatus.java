package com.eyelevel.jobengine.model;

import java.util.Set;

/**
 * Lifecycle of an {@link EditorialDocument}. QUEUED and ANALYZING mirror an in-flight
 * citation detection job.
 */
public enum EditorialDocumentStatus {
    UPLOADED,
    QUEUED,
    ANALYZING,
    COMPLETED,
    FAILED;

    public static final Set<EditorialDocumentStatus> IN_FLIGHT_STATUSES = Set.of(QUEUED, ANALYZING);
}
