package com.eyelevel.jobengine.dto.job;

import com.eyelevel.jobengine.model.JobRecord;
import com.eyelevel.jobengine.model.JobStatus;
import com.eyelevel.jobengine.model.JobType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * The externally visible fields of a job.
 */
@Value
@Builder
public class JobView {
    String id;
    JobType type;
    JobStatus status;
    int progress;
    int priority;
    Map<String, Object> output;
    String error;
    int recoveryCount;
    String recoveredFrom;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;

    public static JobView from(final JobRecord record) {
        return JobView.builder()
                      .id(record.getId())
                      .type(record.getType())
                      .status(record.getStatus())
                      .progress(record.getProgress())
                      .priority(record.getPriority())
                      .output(record.getOutput())
                      .error(record.getError())
                      .recoveryCount(record.getRecoveryCount())
                      .recoveredFrom(record.getRecoveredFrom())
                      .createdAt(record.getCreatedAt())
                      .startedAt(record.getStartedAt())
                      .completedAt(record.getCompletedAt())
                      .build();
    }
}
