package com.example.dubbing_backend.service.Interfaces;

import com.example.dubbing_backend.model.WorkItem;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * At-least-once delivery of job ids to the worker pool.
 */
public interface WorkQueue {

    WorkItem enqueue(UUID jobId, int maxAttempts, Duration backoffBase);

    /** Claims up to {@code max} due items for {@code workerId}; an item is handed to one claimer only. */
    List<WorkItem> claim(int max, String workerId);

    void complete(WorkItem item);

    /**
     * Makes the item deliverable again after an exponential backoff.
     *
     * @return the delay applied, or {@code null} when the item ran out of deliveries and was buried.
     */
    Duration retryLater(WorkItem item, String error);

    void bury(WorkItem item, String error);

    /** Best effort: pending deliveries of the job are dropped, a claimed one is left alone. */
    int removePending(UUID jobId);

    int recoverStale(Duration olderThan);
}
