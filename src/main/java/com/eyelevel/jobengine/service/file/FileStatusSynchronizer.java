package com.eyelevel.jobengine.service.file;

import com.eyelevel.jobengine.model.FileStatus;
import com.eyelevel.jobengine.repository.StoredFileRepository;
import com.eyelevel.jobengine.worker.WorkerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Mirrors the outcome of a job onto the stored file it worked on: PROCESSED when the job
 * completed, ERROR when it failed. Best effort; a failed update is logged and never affects the job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileStatusSynchronizer {

    private final StoredFileRepository storedFileRepository;
    private final Clock clock;

    @EventListener
    public void onWorkerEvent(final WorkerEvent event) {
        if (event.getFileId() == null) {
            return;
        }
        final FileStatus status = switch (event.getType()) {
            case COMPLETED -> FileStatus.PROCESSED;
            case FAILED -> FileStatus.ERROR;
            default -> null;
        };
        if (status == null) {
            return;
        }
        try {
            if (storedFileRepository.updateStatus(event.getFileId(), status, clock.instant()) == 0) {
                log.warn("Stored file {} of job {} not found; status {} was not recorded.", event.getFileId(),
                         event.getJobId(), status);
                return;
            }
            log.info("Stored file {} marked {} after job {}.", event.getFileId(), status, event.getJobId());
        } catch (final RuntimeException e) {
            log.error("Failed to mark stored file {} as {} after job {}.", event.getFileId(), status,
                      event.getJobId(), e);
        }
    }
}
