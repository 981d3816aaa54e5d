package com.eyelevel.jobengine.dto.job;

import com.eyelevel.jobengine.broker.QueueBackend;
import com.eyelevel.jobengine.model.JobType;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * A request to run one job. {@code options} are stored as the job's input and handed to the
 * processor untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobSubmission {

    @NotNull(message = "type is required")
    private JobType type;

    @NotBlank(message = "tenantId is required")
    private String tenantId;

    @NotBlank(message = "userId is required")
    private String userId;

    private String fileId;

    private String productId;

    /**
     * Lower values are serviced first. Defaults to the configured default priority when absent.
     */
    @Min(value = 0, message = "priority must not be negative")
    @Max(value = QueueBackend.MAX_PRIORITY, message = "priority must not exceed " + QueueBackend.MAX_PRIORITY)
    private Integer priority;

    @Builder.Default
    private Map<String, Object> options = new HashMap<>();
}
