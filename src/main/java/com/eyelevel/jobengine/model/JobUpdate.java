package com.eyelevel.jobengine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A partial update of a {@link JobRecord}. Only non-null fields are written.
 * {@code startedAtIfUnset} is applied only when the record has no start time yet.
 */
@Value
@Builder
public class JobUpdate {
    JobStatus status;
    Map<String, Object> output;
    String error;
    Instant startedAtIfUnset;
    Instant completedAt;
    Integer recoveryCount;

    public void applyTo(final JobRecord record) {
        if (status != null) {
            record.setStatus(status);
        }
        if (output != null) {
            record.setOutput(output);
        }
        if (error != null) {
            record.setError(error);
        }
        if (startedAtIfUnset != null && record.getStartedAt() == null) {
            record.setStartedAt(startedAtIfUnset);
        }
        if (completedAt != null) {
            record.setCompletedAt(completedAt);
        }
        if (recoveryCount != null) {
            record.setRecoveryCount(recoveryCount);
        }
    }
}
