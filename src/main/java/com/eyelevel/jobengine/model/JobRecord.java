package com.eyelevel.jobengine.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.DynamicUpdate;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * A single row of the job ledger. The ledger is the source of truth for a job's lifecycle;
 * the broker only carries a message keyed by {@link #id}.
 */
@Entity
@Table(name = "job", indexes = {
        @Index(name = "idx_job_tenant_created", columnList = "tenantId, createdAt"),
        @Index(name = "idx_job_status", columnList = "status")
})
@DynamicUpdate
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 64)
    private JobType type;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String userId;

    private String fileId;

    private String productId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private JobStatus status;

    @Builder.Default
    @Column(nullable = false)
    private int progress = 0;

    @Builder.Default
    @Column(nullable = false)
    private int priority = 0;

    /**
     * Submission options, opaque to the engine. Recovered jobs also carry {@code recoveredAt} here.
     */
    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> input = new HashMap<>();

    /**
     * Processor-defined result payload, decoded per job type by the consumer.
     */
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> output;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Builder.Default
    @Column(nullable = false)
    private int recoveryCount = 0;

    /**
     * The id of the stuck job this record replaced, if it was created by recovery.
     */
    private String recoveredFrom;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    private Instant startedAt;

    private Instant completedAt;
}
