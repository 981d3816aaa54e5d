package com.eyelevel.jobengine.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * A manuscript submitted for citation detection. Its status mirrors the job referenced by
 * {@link #jobId}; the stale job watchdog uses {@link #updatedAt} to detect orphaned work.
 */
@Entity
@Table(name = "editorial_document", indexes = {
        @Index(name = "idx_editorial_document_status_updated", columnList = "status, updatedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EditorialDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    private String originalName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private EditorialDocumentStatus status;

    private String jobId;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;
}
