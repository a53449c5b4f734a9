package com.example.dubbing_backend.repository;

import com.example.dubbing_backend.model.WorkItem;
import com.example.dubbing_backend.util.WorkItemState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface WorkItemRepository extends JpaRepository<WorkItem, UUID> {

    @Query("""
        select w.id from WorkItem w
         where w.state = com.example.dubbing_backend.util.WorkItemState.PENDING
           and w.availableAt <= :now
         order by w.availableAt, w.createdAt
        """)
    List<UUID> findReadyIds(@Param("now") Instant now, Pageable pageable);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update WorkItem w
           set w.state = com.example.dubbing_backend.util.WorkItemState.CLAIMED,
               w.attempts = w.attempts + 1,
               w.claimedAt = :now,
               w.claimedBy = :worker,
               w.updatedAt = :now
         where w.id = :id
           and w.state = com.example.dubbing_backend.util.WorkItemState.PENDING
        """)
    int claim(@Param("id") UUID id, @Param("worker") String worker, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update WorkItem w
           set w.state = :state,
               w.availableAt = :availableAt,
               w.lastError = :error,
               w.claimedBy = null,
               w.updatedAt = :now
         where w.id = :id
           and w.state = com.example.dubbing_backend.util.WorkItemState.CLAIMED
        """)
    int release(@Param("id") UUID id,
                @Param("state") WorkItemState state,
                @Param("availableAt") Instant availableAt,
                @Param("error") String error,
                @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update WorkItem w
           set w.state = com.example.dubbing_backend.util.WorkItemState.REMOVED,
               w.updatedAt = :now
         where w.jobId = :jobId
           and w.state = com.example.dubbing_backend.util.WorkItemState.PENDING
        """)
    int removePendingByJob(@Param("jobId") UUID jobId, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update WorkItem w
           set w.state = com.example.dubbing_backend.util.WorkItemState.PENDING,
               w.attempts = case when w.attempts > 0 then w.attempts - 1 else 0 end,
               w.claimedBy = null,
               w.availableAt = :now,
               w.updatedAt = :now
         where w.state = com.example.dubbing_backend.util.WorkItemState.CLAIMED
           and w.claimedAt < :cutoff
        """)
    int requeueStaleClaims(@Param("cutoff") Instant cutoff, @Param("now") Instant now);
}
