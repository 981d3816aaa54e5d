package com.eyelevel.jobengine.dto.job;

import com.eyelevel.jobengine.model.JobStatus;
import com.eyelevel.jobengine.model.JobType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class JobStatusSummary {
    String tenantId;
    long total;
    Map<JobStatus, Long> byStatus;
    Map<JobType, Long> byType;
}
