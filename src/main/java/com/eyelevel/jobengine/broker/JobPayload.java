package com.eyelevel.jobengine.broker;

import com.eyelevel.jobengine.model.JobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * The data carried by a broker message. The ledger row keyed by the message id holds the
 * authoritative copy; this is what a worker needs to start processing without a ledger read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobPayload {
    private JobType type;
    private String tenantId;
    private String userId;
    private String fileId;
    private String productId;
    @Builder.Default
    private Map<String, Object> options = new HashMap<>();
}
