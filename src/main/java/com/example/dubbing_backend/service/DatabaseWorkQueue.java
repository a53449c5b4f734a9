package com.example.dubbing_backend.service;

import com.example.dubbing_backend.config.DubbingProperties;
import com.example.dubbing_backend.model.WorkItem;
import com.example.dubbing_backend.repository.WorkItemRepository;
import com.example.dubbing_backend.service.Interfaces.WorkQueue;
import com.example.dubbing_backend.util.WorkItemState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Work queue kept in the {@code work_item} table. Survives restarts; a claim is a conditional
 * PENDING to CLAIMED update so two pollers never receive the same item.
 */
@Service
public class DatabaseWorkQueue implements WorkQueue {
    private static final Logger LOGGER = LoggerFactory.getLogger(DatabaseWorkQueue.class);

    private final WorkItemRepository repo;
    private final DubbingProperties properties;
    private final Clock clock;

    public DatabaseWorkQueue(WorkItemRepository repo, DubbingProperties properties, Clock clock) {
        this.repo = repo;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    @Transactional
    public WorkItem enqueue(UUID jobId, int maxAttempts, Duration backoffBase) {
        WorkItem item = new WorkItem(jobId, Math.max(1, maxAttempts), backoffBase.toMillis(), clock.instant());
        WorkItem saved = repo.save(item);
        LOGGER.debug("QUEUE ADD itemId={} jobId={} maxAttempts={}", saved.getId(), jobId, saved.getMaxAttempts());
        return saved;
    }

    @Override
    @Transactional
    public List<WorkItem> claim(int max, String workerId) {
        if (max <= 0) {
            return List.of();
        }
        Instant now = clock.instant();
        List<UUID> ids = repo.findReadyIds(now, PageRequest.of(0, max));
        if (ids.isEmpty()) {
            return List.of();
        }
        List<UUID> claimed = new ArrayList<>(ids.size());
        for (UUID id : ids) {
            if (repo.claim(id, workerId, now) == 1) {
                claimed.add(id);
            }
        }
        if (claimed.isEmpty()) {
            return List.of();
        }
        Map<UUID, Integer> order = new HashMap<>();
        for (int i = 0; i < claimed.size(); i++) {
            order.put(claimed.get(i), i);
        }
        List<WorkItem> items = new ArrayList<>(repo.findAllById(claimed));
        items.sort(Comparator.comparingInt(w -> order.getOrDefault(w.getId(), Integer.MAX_VALUE)));
        return items;
    }

    @Override
    @Transactional
    public void complete(WorkItem item) {
        Instant now = clock.instant();
        repo.release(item.getId(), WorkItemState.DONE, now, null, now);
    }

    @Override
    @Transactional
    public Duration retryLater(WorkItem item, String error) {
        if (!item.hasDeliveriesLeft()) {
            bury(item, error);
            return null;
        }
        Duration delay = backoff(item.getBackoffBaseMs(), item.getAttempts(), properties.getBackoffMaxMs());
        Instant now = clock.instant();
        repo.release(item.getId(), WorkItemState.PENDING, now.plus(delay), error, now);
        LOGGER.info("QUEUE RETRY itemId={} jobId={} attempt={}/{} delayMs={}",
                item.getId(), item.getJobId(), item.getAttempts(), item.getMaxAttempts(), delay.toMillis());
        return delay;
    }

    @Override
    @Transactional
    public void bury(WorkItem item, String error) {
        Instant now = clock.instant();
        repo.release(item.getId(), WorkItemState.DEAD, now, error, now);
    }

    @Override
    @Transactional
    public int removePending(UUID jobId) {
        return repo.removePendingByJob(jobId, clock.instant());
    }

    @Override
    @Transactional
    public int recoverStale(Duration olderThan) {
        Instant now = clock.instant();
        int recovered = repo.requeueStaleClaims(now.minus(olderThan), now);
        if (recovered > 0) {
            LOGGER.warn("QUEUE RECOVER stale claims returned to pending count={}", recovered);
        }
        return recovered;
    }

    /**
     * {@code base * 2^(attempt-1)}, capped at {@code maxMs}.
     */
    static Duration backoff(long baseMs, int attempt, long maxMs) {
        int exponent = Math.max(0, Math.min(attempt - 1, 20));
        long delay;
        try {
            delay = Math.multiplyExact(baseMs, 1L << exponent);
        } catch (ArithmeticException e) {
            delay = maxMs;
        }
        if (delay < 0 || delay > maxMs) {
            delay = maxMs;
        }
        return Duration.ofMillis(Math.max(0, delay));
    }
}
