package com.eyelevel.jobengine.repository;

import com.eyelevel.jobengine.model.EditorialDocument;
import com.eyelevel.jobengine.model.EditorialDocumentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

@Repository
public interface EditorialDocumentRepository extends JpaRepository<EditorialDocument, String> {

    /**
     * Finds documents stuck in one of the given statuses since before {@code threshold}.
     */
    List<EditorialDocument> findByStatusInAndUpdatedAtBefore(Collection<EditorialDocumentStatus> statuses,
                                                            Instant threshold);
}
