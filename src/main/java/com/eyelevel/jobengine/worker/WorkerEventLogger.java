package com.eyelevel.jobengine.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class WorkerEventLogger {

    @EventListener
    public void onWorkerEvent(final WorkerEvent event) {
        switch (event.getType()) {
            case COMPLETED -> log.info("[{}] Job {} completed.", event.getQueueName(), event.getJobId());
            case FAILED -> log.error("[{}] Job {} failed on attempt {}: {}", event.getQueueName(), event.getJobId(),
                                     event.getAttempt(), event.getError());
            case PROGRESS -> log.debug("[{}] Job {} progress: {}%", event.getQueueName(), event.getJobId(),
                                       event.getProgress());
            case STALLED -> log.warn("[{}] Job {} stalled: {}", event.getQueueName(), event.getJobId(),
                                     event.getError());
            case ERROR -> log.warn("[{}] Job {} attempt {} failed and may be retried: {}", event.getQueueName(),
                                   event.getJobId(), event.getAttempt(), event.getError());
        }
    }
}
