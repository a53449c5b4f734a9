package com.example.dubbing_backend.repository;

import com.example.dubbing_backend.model.DubbingJob;
import com.example.dubbing_backend.util.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

/**
 * Job record store. Every state write is a conditional update so a job that already reached
 * a terminal status is never moved again by a late worker write.
 */
public interface DubbingJobRepository extends JpaRepository<DubbingJob, UUID> {

    Optional<DubbingJob> findTopBySourceVideoIdOrderByQueuedAtDesc(UUID sourceVideoId);

    Page<DubbingJob> findByStatus(JobStatus status, Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select j from DubbingJob j where j.id = :id")
    Optional<DubbingJob> lockById(@Param("id") UUID id);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update DubbingJob j
           set j.status = :status,
               j.currentStep = :step,
               j.progress = case when j.progress < :progress then :progress else j.progress end,
               j.startedAt = case when :started = true then :now else j.startedAt end,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status in :active
        """)
    int advance(@Param("id") UUID id,
                @Param("status") JobStatus status,
                @Param("step") String step,
                @Param("progress") int progress,
                @Param("started") boolean started,
                @Param("now") Instant now,
                @Param("active") Collection<JobStatus> active);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update DubbingJob j
           set j.retryCount = case when j.retryCount < j.maxRetries then j.retryCount + 1 else j.retryCount end,
               j.errorMessage = :message,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status in :active
        """)
    int recordFailedAttempt(@Param("id") UUID id,
                            @Param("message") String message,
                            @Param("now") Instant now,
                            @Param("active") Collection<JobStatus> active);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update DubbingJob j
           set j.status = com.example.dubbing_backend.util.JobStatus.FAILED,
               j.failedAt = :now,
               j.errorMessage = :message,
               j.errorDetail = :detail,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status in :active
        """)
    int markFailed(@Param("id") UUID id,
                   @Param("message") String message,
                   @Param("detail") String detail,
                   @Param("now") Instant now,
                   @Param("active") Collection<JobStatus> active);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update DubbingJob j
           set j.status = com.example.dubbing_backend.util.JobStatus.QUEUED,
               j.progress = 0,
               j.currentStep = null,
               j.startedAt = null,
               j.failedAt = null,
               j.errorMessage = null,
               j.errorDetail = null,
               j.retryCount = j.retryCount + 1,
               j.queuedAt = :now,
               j.updatedAt = :now,
               j.version = j.version + 1
         where j.id = :id
           and j.status = com.example.dubbing_backend.util.JobStatus.FAILED
        """)
    int rearmFailed(@Param("id") UUID id, @Param("now") Instant now);
}
