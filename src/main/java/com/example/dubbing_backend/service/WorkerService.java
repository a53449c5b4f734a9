package com.example.dubbing_backend.service;

import com.example.dubbing_backend.config.WorkerExecutorProperties;
import com.example.dubbing_backend.exception.JobCancelledException;
import com.example.dubbing_backend.exception.StageException;
import com.example.dubbing_backend.model.DubbingJob;
import com.example.dubbing_backend.model.WorkItem;
import com.example.dubbing_backend.service.Interfaces.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Worker pool front end: claims due work items while threads are free and runs one job per thread.
 * Decides after a failed attempt whether the queue delivers the job again or the job is FAILED.
 */
@Service
public class WorkerService {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkerService.class);

    private final WorkQueue queue;
    private final DubbingPipeline pipeline;
    private final JobService jobService;
    private final Executor workerExecutor;
    private final WorkerExecutorProperties workerProperties;
    private final String workerId;
    private final AtomicInteger inFlight = new AtomicInteger();

    public WorkerService(WorkQueue queue,
                         DubbingPipeline pipeline,
                         JobService jobService,
                         @Qualifier("workerTaskExecutor") Executor workerExecutor,
                         WorkerExecutorProperties workerProperties) {
        this.queue = queue;
        this.pipeline = pipeline;
        this.jobService = jobService;
        this.workerExecutor = workerExecutor;
        this.workerProperties = workerProperties;
        this.workerId = ManagementFactory.getRuntimeMXBean().getName() + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    @Scheduled(fixedDelayString = "${worker.poll-interval-ms:3000}")
    public void poll() {
        if (!workerProperties.isEnabled()) {
            return;
        }
        int free = Math.max(1, workerProperties.getExecutorThreads()) - inFlight.get();
        if (free <= 0) {
            LOGGER.debug("Worker poll tick - all threads busy inFlight={}", inFlight.get());
            return;
        }
        List<WorkItem> items = queue.claim(free, workerId);
        if (items.isEmpty()) {
            LOGGER.debug("Worker poll tick - no work claimed");
            return;
        }
        LOGGER.info("Worker claimed items count={} jobs={}", items.size(),
                items.stream().map(WorkItem::getJobId).collect(Collectors.toList()));
        items.forEach(this::submit);
    }

    @Scheduled(fixedDelayString = "${worker.stale-sweep-interval-ms:60000}")
    public void recoverStaleClaims() {
        if (!workerProperties.isEnabled()) {
            return;
        }
        queue.recoverStale(Duration.ofMinutes(Math.max(1, workerProperties.getStaleClaimMinutes())));
    }

    int inFlight() {
        return inFlight.get();
    }

    private void submit(WorkItem item) {
        inFlight.incrementAndGet();
        try {
            workerExecutor.execute(() -> {
                try {
                    process(item);
                } finally {
                    inFlight.decrementAndGet();
                }
            });
        } catch (TaskRejectedException e) {
            inFlight.decrementAndGet();
            LOGGER.warn("Worker executor rejected jobId={}", item.getJobId());
            handleFailure(item, new IllegalStateException("worker pool saturated", e));
        }
    }

    /**
     * Runs one delivery of a work item to a local outcome. Never throws.
     */
    void process(WorkItem item) {
        UUID jobId = item.getJobId();
        long t0 = System.nanoTime();
        LOGGER.info("JOB START jobId={} itemId={} attempt={}/{}", jobId, item.getId(), item.getAttempts(), item.getMaxAttempts());
        try {
            pipeline.run(jobId);
            queue.complete(item);
            LOGGER.info("JOB DONE jobId={} in={}ms", jobId, (System.nanoTime() - t0) / 1_000_000);
        } catch (JobCancelledException e) {
            queue.complete(item);
            LOGGER.info("JOB CANCELLED jobId={} in={}ms", jobId, (System.nanoTime() - t0) / 1_000_000);
        } catch (Exception e) {
            try {
                handleFailure(item, e);
            } catch (Exception inner) {
                LOGGER.error("Failure handling itself failed jobId={} - item left for stale recovery", jobId, inner);
            }
            LOGGER.info("JOB FAILED jobId={} in={}ms", jobId, (System.nanoTime() - t0) / 1_000_000);
        }
    }

    void handleFailure(WorkItem item, Exception e) {
        UUID jobId = item.getJobId();
        String message = messageOf(e);
        boolean permanent = e instanceof StageException stageException && !stageException.isRetryable();

        Optional<DubbingJob> updated = jobService.recordFailedAttempt(jobId, message);
        if (updated.isEmpty()) {
            queue.complete(item);
            LOGGER.info("Job finalized elsewhere, dropping failure jobId={} error={}", jobId, message);
            return;
        }
        DubbingJob job = updated.get();
        boolean exhausted = permanent
                || job.getRetryCount() >= job.getMaxRetries()
                || !item.hasDeliveriesLeft();
        if (exhausted) {
            jobService.markFailed(jobId, message, stackTop(e));
            queue.bury(item, message);
            LOGGER.error("Job {} failed permanently retryCount={}/{} permanent={}: {}",
                    jobId, job.getRetryCount(), job.getMaxRetries(), permanent, e.toString(), e);
            return;
        }
        Duration delay = queue.retryLater(item, message);
        LOGGER.warn("Job {} attempt failed, retrying retryCount={}/{} delayMs={} error={}",
                jobId, job.getRetryCount(), job.getMaxRetries(), delay == null ? -1 : delay.toMillis(), message);
    }

    static String messageOf(Throwable e) {
        return e.getMessage() != null && !e.getMessage().isBlank() ? e.getMessage() : e.getClass().getSimpleName();
    }

    static String stackTop(Throwable ex) {
        var sw = new java.io.StringWriter();
        ex.printStackTrace(new java.io.PrintWriter(sw));
        var s = sw.toString();
        return s.length() > 2000 ? s.substring(0, 2000) + "...(truncated)" : s;
    }
}
