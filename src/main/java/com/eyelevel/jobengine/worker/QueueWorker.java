package com.eyelevel.jobengine.worker;

import com.eyelevel.jobengine.broker.*;
import com.eyelevel.jobengine.exception.MessageProcessingFailedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Consumes one queue with bounded concurrency.
 * <p>
 * A poller thread claims messages while a processing slot is free and hands them to a fixed pool
 * of {@code concurrency} threads. While a message is in flight its broker lock is extended every
 * half lock period; messages whose lock expired anyway (a crashed process) are swept back by the
 * stalled check. A failing delivery never stops the worker.
 */
@Slf4j
public class QueueWorker {

    private static final long STOP_TIMEOUT_SECONDS = 10;

    private final QueueDefinition queue;
    private final QueueBackend queueBackend;
    private final JobDeliveryHandler deliveryHandler;
    private final TaskScheduler taskScheduler;
    private final String workerId;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Map<String, QueueMessage> inFlight = new ConcurrentHashMap<>();
    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();

    private Semaphore slots;
    private ExecutorService processingPool;
    private Thread pollerThread;
    private ScheduledFuture<?> lockRenewal;
    private ScheduledFuture<?> stalledCheck;

    public QueueWorker(final QueueDefinition queue, final QueueBackend queueBackend,
                       final JobDeliveryHandler deliveryHandler, final TaskScheduler taskScheduler) {
        this.queue = queue;
        this.queueBackend = queueBackend;
        this.deliveryHandler = deliveryHandler;
        this.taskScheduler = taskScheduler;
        this.workerId = queue.getName() + ":" + UUID.randomUUID();
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        final int concurrency = queue.getConcurrency();
        slots = new Semaphore(concurrency);
        processingPool = Executors.newFixedThreadPool(concurrency,
                                                      new CustomizableThreadFactory(queue.getName() + "-worker-"));
        lockRenewal = taskScheduler.scheduleAtFixedRate(this::extendLocks, queue.getLockDuration().dividedBy(2));
        stalledCheck = taskScheduler.scheduleWithFixedDelay(this::recoverStalled, queue.getStalledInterval());

        pollerThread = new Thread(this::poll, queue.getName() + "-poller");
        pollerThread.start();
        log.info("Worker {} started for queue '{}' with concurrency {}.", workerId, queue.getName(), concurrency);
    }

    /**
     * Stops claiming new messages and waits a bounded time for in-flight deliveries. Deliveries
     * that outlive the wait keep running; their locks stop being extended and the broker will
     * redeliver them.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        lockRenewal.cancel(false);
        stalledCheck.cancel(false);
        pollerThread.interrupt();
        processingPool.shutdown();
        try {
            pollerThread.join(TimeUnit.SECONDS.toMillis(STOP_TIMEOUT_SECONDS));
            if (!processingPool.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Worker {} stopped with {} job(s) still running.", workerId, inFlight.size());
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Worker {} stopped. Processed: {}, failed: {}.", workerId, processedCount.get(), failedCount.get());
    }

    /**
     * Claims and processes a single message on the calling thread.
     *
     * @return false if the queue had nothing due.
     */
    public boolean processNext() {
        final Optional<QueueMessage> message = queueBackend.claim(queue.getName(), workerId, queue.getLockDuration());
        message.ifPresent(this::process);
        return message.isPresent();
    }

    /**
     * Runs one sweep of expired locks on this worker's queue.
     */
    public void recoverStalled() {
        try {
            final List<StalledMessage> stalled = queueBackend.recoverStalled(queue.getName());
            stalled.forEach(deliveryHandler::onStalled);
        } catch (final RuntimeException e) {
            log.error("Stalled job check failed for queue '{}'.", queue.getName(), e);
        }
    }

    private void poll() {
        while (running.get()) {
            try {
                if (!slots.tryAcquire(queue.getPollInterval().toMillis(), TimeUnit.MILLISECONDS)) {
                    continue;
                }
                final Optional<QueueMessage> message = claimQuietly();
                if (message.isEmpty()) {
                    slots.release();
                    Thread.sleep(queue.getPollInterval().toMillis());
                    continue;
                }
                processingPool.execute(() -> {
                    try {
                        process(message.get());
                    } finally {
                        slots.release();
                    }
                });
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (final RejectedExecutionException e) {
                log.debug("Worker {} is shutting down, no further jobs are accepted.", workerId);
                break;
            }
        }
    }

    private Optional<QueueMessage> claimQuietly() {
        try {
            return queueBackend.claim(queue.getName(), workerId, queue.getLockDuration());
        } catch (final RuntimeException e) {
            log.error("Worker {} could not claim from queue '{}'.", workerId, queue.getName(), e);
            return Optional.empty();
        }
    }

    private void process(final QueueMessage message) {
        inFlight.put(message.getId(), message);
        try {
            final DeliveryResult result = deliveryHandler.handle(message);
            switch (result.getOutcome()) {
                case COMPLETED, SKIPPED -> queueBackend.complete(message, result.getData());
                case REJECTED -> {
                    queueBackend.fail(message, result.getReason(), false);
                    failedCount.incrementAndGet();
                }
            }
            processedCount.incrementAndGet();
        } catch (final MessageProcessingFailedException e) {
            failedCount.incrementAndGet();
            handBack(message, e.getCause() == null ? e : e.getCause(), false);
        } catch (final RuntimeException e) {
            failedCount.incrementAndGet();
            log.error("Unexpected error while handling job {} on queue '{}'.", message.getId(), queue.getName(), e);
            handBack(message, e, true);
        } finally {
            inFlight.remove(message.getId());
        }
    }

    private void handBack(final QueueMessage message, final Throwable cause, final boolean syncLedgerOnExhaustion) {
        final String reason = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        try {
            final FailureOutcome outcome = queueBackend.fail(message, reason, true);
            log.info("Job {} on queue '{}' handed back to the broker: {}.", message.getId(), queue.getName(), outcome);
            if (outcome == FailureOutcome.EXHAUSTED && syncLedgerOnExhaustion) {
                deliveryHandler.onAttemptsExhausted(message, reason);
            }
        } catch (final RuntimeException e) {
            log.error("Could not report failure of job {} to queue '{}'. The lock will expire and the job will be "
                      + "redelivered.", message.getId(), queue.getName(), e);
        }
    }

    private void extendLocks() {
        for (final QueueMessage message : inFlight.values()) {
            try {
                if (!queueBackend.extendLock(queue.getName(), message.getId(), workerId, queue.getLockDuration())) {
                    log.warn("Worker {} lost the lock of job {}.", workerId, message.getId());
                }
            } catch (final RuntimeException e) {
                log.error("Could not extend the lock of job {} on queue '{}'.", message.getId(), queue.getName(), e);
            }
        }
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getQueueName() {
        return queue.getName();
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getProcessedCount() {
        return processedCount.get();
    }

    public long getFailedCount() {
        return failedCount.get();
    }
}
