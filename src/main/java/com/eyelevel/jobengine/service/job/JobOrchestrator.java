package com.eyelevel.jobengine.service.job;

import com.eyelevel.jobengine.broker.QueueBackend;
import com.eyelevel.jobengine.broker.QueueDefinition;
import com.eyelevel.jobengine.broker.QueueRegistry;
import com.eyelevel.jobengine.config.JobEngineProperties;
import com.eyelevel.jobengine.scheduler.StaleJobWatchdog;
import com.eyelevel.jobengine.worker.JobDeliveryHandler;
import com.eyelevel.jobengine.worker.ProcessorRegistry;
import com.eyelevel.jobengine.worker.QueueWorker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Starts and stops the queue workers and the stale job watchdog together with the application
 * context.
 * <p>
 * A worker is started for every queue at least one registered processor can serve. The watchdog
 * runs once right after the workers are up, to pick up work orphaned by the previous shutdown,
 * and then at a fixed delay. Without a broker nothing is started.
 */
@Slf4j
@Service
public class JobOrchestrator implements SmartLifecycle {

    private final QueueRegistry queueRegistry;
    private final ObjectProvider<QueueBackend> queueBackendProvider;
    private final ProcessorRegistry processorRegistry;
    private final JobDeliveryHandler deliveryHandler;
    private final StaleJobWatchdog staleJobWatchdog;
    private final JobEngineProperties properties;
    private final TaskScheduler taskScheduler;

    private final List<QueueWorker> workers = new ArrayList<>();
    private ScheduledFuture<?> watchdogSchedule;
    private volatile boolean running;

    public JobOrchestrator(final QueueRegistry queueRegistry,
                           final ObjectProvider<QueueBackend> queueBackendProvider,
                           final ProcessorRegistry processorRegistry,
                           final JobDeliveryHandler deliveryHandler,
                           final StaleJobWatchdog staleJobWatchdog,
                           final JobEngineProperties properties,
                           @Qualifier("jobEngineTaskScheduler") final TaskScheduler taskScheduler) {
        this.queueRegistry = queueRegistry;
        this.queueBackendProvider = queueBackendProvider;
        this.processorRegistry = processorRegistry;
        this.deliveryHandler = deliveryHandler;
        this.staleJobWatchdog = staleJobWatchdog;
        this.properties = properties;
        this.taskScheduler = taskScheduler;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;

        final QueueBackend backend = queueBackendProvider.getIfAvailable();
        if (backend == null) {
            log.warn("No broker configured. Job workers and stale job recovery are disabled.");
            return;
        }

        log.info("Starting job workers...");
        for (final QueueDefinition queue : queueRegistry.all()) {
            if (!processorRegistry.coversAny(queue)) {
                log.info("No processor registered for queue '{}'. Its worker is not started.", queue.getName());
                continue;
            }
            final QueueWorker worker = new QueueWorker(queue, backend, deliveryHandler, taskScheduler);
            worker.start();
            workers.add(worker);
        }
        log.info("{} job worker(s) started.", workers.size());

        final JobEngineProperties.Watchdog watchdog = properties.getWatchdog();
        if (watchdog.isEnabled()) {
            watchdogSchedule = taskScheduler.scheduleWithFixedDelay(staleJobWatchdog::recoverStaleJobs,
                                                                    taskScheduler.getClock().instant(),
                                                                    watchdog.getInterval());
            log.info("Stale job watchdog scheduled every {} (threshold {}, max {} recovery attempts).",
                     watchdog.getInterval(), watchdog.getStaleThreshold(), watchdog.getMaxRecoveryAttempts());
        }
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        if (watchdogSchedule != null) {
            watchdogSchedule.cancel(false);
            watchdogSchedule = null;
        }
        log.info("Stopping {} job worker(s)...", workers.size());
        workers.forEach(QueueWorker::stop);
        workers.clear();
        running = false;
        log.info("All job workers stopped.");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Starts after the rest of the context and stops before it, so workers never run against a
     * closing data source.
     */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1000;
    }

    public synchronized List<QueueWorker> getActiveWorkers() {
        return workers.stream().filter(QueueWorker::isRunning).toList();
    }
}
