package com.eyelevel.jobengine.dto.metric;

import com.eyelevel.jobengine.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Number of a tenant's jobs in one status. Built by a JPQL constructor expression.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusCount {
    private JobStatus status;
    private Long count;
}
