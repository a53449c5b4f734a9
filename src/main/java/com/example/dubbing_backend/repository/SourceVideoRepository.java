package com.example.dubbing_backend.repository;

import com.example.dubbing_backend.model.SourceVideo;
import com.example.dubbing_backend.util.VideoStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.UUID;

public interface SourceVideoRepository extends JpaRepository<SourceVideo, UUID> {

    /**
     * Atomically moves the source to {@code QUEUED} unless a job is already active for it.
     *
     * @return 1 when this caller won the admission, 0 otherwise.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update SourceVideo s
           set s.videoStatus = com.example.dubbing_backend.util.VideoStatus.QUEUED,
               s.updatedAt = :now
         where s.id = :id
           and s.videoStatus not in :active
        """)
    int claimForQueue(@Param("id") UUID id,
                      @Param("now") Instant now,
                      @Param("active") Collection<VideoStatus> active);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        update SourceVideo s
           set s.videoStatus = :status,
               s.updatedAt = :now
         where s.id = :id
        """)
    int updateStatus(@Param("id") UUID id, @Param("status") VideoStatus status, @Param("now") Instant now);
}
