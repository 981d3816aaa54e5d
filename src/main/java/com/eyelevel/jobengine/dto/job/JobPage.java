package com.eyelevel.jobengine.dto.job;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One page of a tenant's jobs, newest first. {@code page} is 1-based.
 */
@Value
@Builder
public class JobPage {
    List<JobView> jobs;
    int page;
    int limit;
    long total;
    int totalPages;
}
