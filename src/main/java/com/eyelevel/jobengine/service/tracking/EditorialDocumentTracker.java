package com.eyelevel.jobengine.service.tracking;

import com.eyelevel.jobengine.exception.apiclient.NotFoundException;
import com.eyelevel.jobengine.model.EditorialDocument;
import com.eyelevel.jobengine.model.EditorialDocumentStatus;
import com.eyelevel.jobengine.model.JobType;
import com.eyelevel.jobengine.repository.EditorialDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Tracks editorial documents going through citation detection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EditorialDocumentTracker implements TrackedEntityTracker {

    private final EditorialDocumentRepository editorialDocumentRepository;
    private final Clock clock;

    @Override
    public String name() {
        return "editorial-document";
    }

    @Override
    public JobType jobType() {
        return JobType.CITATION_DETECTION;
    }

    @Override
    @Transactional(readOnly = true)
    public List<TrackedEntity> findStale(final Instant threshold) {
        return editorialDocumentRepository.findByStatusInAndUpdatedAtBefore(EditorialDocumentStatus.IN_FLIGHT_STATUSES,
                                                                            threshold)
                                          .stream()
                                          .map(EditorialDocumentTracker::toTrackedEntity)
                                          .toList();
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void update(final String entityId, final TrackedEntityUpdate update) {
        final EditorialDocument document = editorialDocumentRepository.findById(entityId).orElseThrow(
                () -> new NotFoundException("Editorial document not found: " + entityId));
        document.setStatus(EditorialDocumentStatus.valueOf(update.getStatus()));
        if (update.getJobId() != null) {
            document.setJobId(update.getJobId());
        }
        document.setUpdatedAt(clock.instant());
        editorialDocumentRepository.save(document);
        log.debug("Editorial document {} is now {} (job {}).", entityId, document.getStatus(), document.getJobId());
    }

    @Override
    public String initialStatus() {
        return EditorialDocumentStatus.QUEUED.name();
    }

    @Override
    public String failedStatus() {
        return EditorialDocumentStatus.FAILED.name();
    }

    @Override
    public Map<String, Object> recoveryOptions(final TrackedEntity entity) {
        return Map.of("documentId", entity.getId());
    }

    private static TrackedEntity toTrackedEntity(final EditorialDocument document) {
        return TrackedEntity.builder()
                            .id(document.getId())
                            .tenantId(document.getTenantId())
                            .status(document.getStatus().name())
                            .updatedAt(document.getUpdatedAt())
                            .jobId(document.getJobId())
                            .build();
    }
}
