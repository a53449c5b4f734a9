package com.example.dubbing_backend.service;

import com.example.dubbing_backend.dto.AudioMeta;
import com.example.dubbing_backend.dto.DubbingOptions;
import com.example.dubbing_backend.dto.VideoMeta;
import com.example.dubbing_backend.model.DubbingJob;
import com.example.dubbing_backend.model.SourceVideo;
import com.example.dubbing_backend.repository.DubbingJobRepository;
import com.example.dubbing_backend.repository.SourceVideoRepository;
import com.example.dubbing_backend.util.JobStatus;
import com.example.dubbing_backend.util.VideoStatus;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Job record store used by the stage executor. Each write runs in its own transaction and only
 * lands while the job is still active, so a job forced to FAILED by a cancel stays frozen.
 */
@Service
public class JobService {
    private static final Logger LOGGER = LoggerFactory.getLogger(JobService.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static final String CANCELLED_MESSAGE = "Job cancelled by user";

    private final DubbingJobRepository jobRepo;
    private final SourceVideoRepository sourceRepo;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JobService(DubbingJobRepository jobRepo, SourceVideoRepository sourceRepo, ObjectMapper mapper, Clock clock) {
        this.jobRepo = jobRepo;
        this.sourceRepo = sourceRepo;
        this.mapper = mapper;
        this.clock = clock;
    }

    public record Completion(String dubbedVideoUrl,
                             @Nullable String hlsPlaylistUrl,
                             @Nullable String subtitlesUrl,
                             @Nullable String thumbnailUrl,
                             VideoMeta videoMeta,
                             AudioMeta audioMeta,
                             long processingTimeSec) {}

    @Transactional
    public DubbingJob create(UUID sourceId, String originalVideoUrl, DubbingOptions options, int maxRetries) {
        DubbingJob job = new DubbingJob(sourceId, originalVideoUrl, options, clock.instant());
        job.setMaxRetries(maxRetries);
        return jobRepo.save(job);
    }

    @Transactional(readOnly = true)
    public Optional<DubbingJob> find(UUID jobId) {
        return jobRepo.findById(jobId);
    }

    /**
     * Persists the stage the job is entering. Entering DOWNLOADING also stamps startedAt and mirrors
     * PROCESSING onto the source.
     *
     * @return {@code false} when the job is no longer active and must not be touched.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean advance(UUID jobId, JobStatus stage) {
        if (!stage.isStarted()) {
            throw new IllegalArgumentException("Not a pipeline stage: " + stage);
        }
        Instant now = clock.instant();
        boolean first = stage == JobStatus.DOWNLOADING;
        int updated = jobRepo.advance(jobId, stage, stage.name(), stage.checkpoint(), first, now, JobStatus.ACTIVE);
        if (updated == 0) {
            return false;
        }
        if (first) {
            jobRepo.findById(jobId).ifPresent(job -> sourceRepo.updateStatus(job.getSourceVideoId(), VideoStatus.PROCESSING, now));
        }
        return true;
    }

    /**
     * Counts a failed attempt: bumps retryCount while it is below maxRetries and keeps the latest error.
     *
     * @return the updated job, or empty when it is no longer active.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<DubbingJob> recordFailedAttempt(UUID jobId, String message) {
        int updated = jobRepo.recordFailedAttempt(jobId, truncate(message, 2000), clock.instant(), JobStatus.ACTIVE);
        if (updated == 0) {
            return Optional.empty();
        }
        return jobRepo.findById(jobId);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(UUID jobId, String message, @Nullable String detail) {
        Instant now = clock.instant();
        int updated = jobRepo.markFailed(jobId, truncate(message, 2000), truncate(detail, 4000), now, JobStatus.ACTIVE);
        if (updated == 0) {
            return false;
        }
        jobRepo.findById(jobId).ifPresent(job -> sourceRepo.updateStatus(job.getSourceVideoId(), VideoStatus.FAILED, now));
        return true;
    }

    /**
     * Forces an active job to FAILED on behalf of the user. The source mirror is left to the caller.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean forceCancelled(UUID jobId) {
        return jobRepo.markFailed(jobId, CANCELLED_MESSAGE, null, clock.instant(), JobStatus.ACTIVE) > 0;
    }

    /**
     * Writes the results onto the job and its source under a row lock.
     *
     * @return {@code false} when the job stopped being active before the write.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean complete(UUID jobId, Completion result) {
        DubbingJob job = jobRepo.lockById(jobId).orElse(null);
        if (job == null || job.getStatus().isTerminal()) {
            return false;
        }
        Instant now = clock.instant();
        Map<String, Object> videoMeta = mapper.convertValue(result.videoMeta(), MAP_TYPE);
        job.setStatus(JobStatus.COMPLETED);
        job.setProgress(JobStatus.COMPLETED.checkpoint());
        job.setCurrentStep(JobStatus.COMPLETED.name());
        job.setCompletedAt(now);
        job.setDubbedVideoUrl(result.dubbedVideoUrl());
        job.setHlsPlaylistUrl(result.hlsPlaylistUrl());
        job.setSubtitlesUrl(result.subtitlesUrl());
        job.setThumbnailUrl(result.thumbnailUrl());
        job.setVideoMeta(videoMeta);
        job.setAudioMeta(mapper.convertValue(result.audioMeta(), MAP_TYPE));
        job.setProcessingTimeSec(result.processingTimeSec());
        jobRepo.save(job);

        SourceVideo source = sourceRepo.findById(job.getSourceVideoId()).orElse(null);
        if (source == null) {
            LOGGER.warn("Source vanished before completion jobId={} sourceId={}", jobId, job.getSourceVideoId());
            return true;
        }
        source.setVideoStatus(VideoStatus.COMPLETED);
        source.setDubbedVideoUrl(result.dubbedVideoUrl());
        source.setHlsPlaylistUrl(result.hlsPlaylistUrl());
        source.setSubtitlesUrl(result.subtitlesUrl());
        source.setThumbnailUrl(result.thumbnailUrl());
        source.setVideoMeta(videoMeta);
        source.setVideoProcessedAt(now);
        sourceRepo.save(source);
        return true;
    }

    /**
     * Whether {@code jobId} is still the most recently queued job of its source. A job replaced by
     * a regeneration or a newer retry no longer owns the source's object keys.
     */
    @Transactional(readOnly = true)
    public boolean isLatestForSource(UUID sourceId, UUID jobId) {
        return jobRepo.findTopBySourceVideoIdOrderByQueuedAtDesc(sourceId)
                .map(latest -> latest.getId().equals(jobId))
                .orElse(true);
    }

    /**
     * Re-arms a FAILED job for one more attempt.
     *
     * @return {@code false} when the job is not FAILED.
     */
    @Transactional
    public boolean rearmFailed(UUID jobId) {
        return jobRepo.rearmFailed(jobId, clock.instant()) > 0;
    }

    static String truncate(@Nullable String value, int max) {
        if (value == null) {
            return null;
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
