package com.example.dubbing_backend.service;

import com.example.dubbing_backend.config.DubbingProperties;
import com.example.dubbing_backend.dto.DubbingOptions;
import com.example.dubbing_backend.dto.JobListResponse;
import com.example.dubbing_backend.dto.ProcessVideoResponse;
import com.example.dubbing_backend.dto.VideoStatusResponse;
import com.example.dubbing_backend.model.DubbingJob;
import com.example.dubbing_backend.model.SourceVideo;
import com.example.dubbing_backend.repository.DubbingJobRepository;
import com.example.dubbing_backend.repository.OffsetPageRequest;
import com.example.dubbing_backend.repository.SourceVideoRepository;
import com.example.dubbing_backend.service.Interfaces.ObjectStore;
import com.example.dubbing_backend.service.Interfaces.WorkQueue;
import com.example.dubbing_backend.util.AssetKind;
import com.example.dubbing_backend.util.JobStatus;
import com.example.dubbing_backend.util.VideoStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Control surface of the dubbing pipeline: admission, status queries, cancellation, manual retry
 * and regeneration.
 */
@Service
public class DubbingService {
    private static final Logger LOGGER = LoggerFactory.getLogger(DubbingService.class);
    public static final int MAX_PAGE_SIZE = 200;

    private final SourceVideoRepository sourceRepo;
    private final DubbingJobRepository jobRepo;
    private final JobService jobService;
    private final WorkQueue workQueue;
    private final ObjectStore objectStore;
    private final DubbingProperties properties;
    private final Clock clock;

    public DubbingService(SourceVideoRepository sourceRepo,
                          DubbingJobRepository jobRepo,
                          JobService jobService,
                          WorkQueue workQueue,
                          ObjectStore objectStore,
                          DubbingProperties properties,
                          Clock clock) {
        this.sourceRepo = sourceRepo;
        this.jobRepo = jobRepo;
        this.jobService = jobService;
        this.workQueue = workQueue;
        this.objectStore = objectStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Admits a new job for the source. The QUEUED mark on the source is a conditional update, so of
     * two concurrent submissions exactly one gets a job.
     */
    @Transactional
    public ProcessVideoResponse submit(UUID sourceId, DubbingOptions options) {
        SourceVideo source = sourceRepo.findById(sourceId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "SOURCE_NOT_FOUND"));
        String url = source.getOriginalVideoUrl();
        if (url == null || url.isBlank()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "SOURCE_VIDEO_MISSING");
        }
        DubbingOptions normalized = (options == null ? DubbingOptions.defaults() : options)
                .normalized(properties.getDefaultSourceLang());

        if (sourceRepo.claimForQueue(sourceId, clock.instant(), VideoStatus.ACTIVE) == 0) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "VIDEO_ALREADY_PROCESSING");
        }
        DubbingJob job = jobService.create(sourceId, url, normalized, properties.getMaxRetries());
        workQueue.enqueue(job.getId(), properties.getMaxRetries(), Duration.ofMillis(properties.getBackoffBaseMs()));
        LOGGER.info("JOB QUEUED jobId={} sourceId={} quality={} voice={} keepBGM={} hls={} subtitles={}",
                job.getId(), sourceId, normalized.quality().label(), normalized.ttsVoice().id(),
                normalized.keepBackgroundAudio(), normalized.hlsRequested(), normalized.subtitlesRequested());
        return new ProcessVideoResponse(job.getId(), JobStatus.QUEUED.name(),
                properties.getEstimatedProcessingSeconds(), "Video queued for dubbing");
    }

    @Transactional(readOnly = true)
    public VideoStatusResponse getStatus(UUID sourceId) {
        if (!sourceRepo.existsById(sourceId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "SOURCE_NOT_FOUND");
        }
        return jobRepo.findTopBySourceVideoIdOrderByQueuedAtDesc(sourceId)
                .map(this::toResponse)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "NO_JOB_FOR_SOURCE"));
    }

    @Transactional(readOnly = true)
    public JobListResponse listJobs(String status, int limit, int offset) {
        if (limit < 1 || limit > MAX_PAGE_SIZE || offset < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "BAD_PAGINATION");
        }
        var page = new OffsetPageRequest(offset, limit, Sort.by(Sort.Direction.DESC, "queuedAt"));
        Page<DubbingJob> jobs = status == null || status.isBlank()
                ? jobRepo.findAll(page)
                : jobRepo.findByStatus(parseStatus(status), page);
        return new JobListResponse(jobs.getTotalElements(),
                jobs.getContent().stream().map(this::toResponse).collect(Collectors.toList()));
    }

    @Transactional(readOnly = true)
    public VideoStatusResponse getJob(UUID jobId) {
        return jobRepo.findById(jobId)
                .map(this::toResponse)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
    }

    /**
     * Stops the latest job if it is still active, deletes the published artifacts and resets the
     * source to CANCELLED. A worker already running the job notices at its next stage boundary.
     */
    @Transactional
    public void cancel(UUID sourceId) {
        if (!sourceRepo.existsById(sourceId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "SOURCE_NOT_FOUND");
        }
        jobRepo.findTopBySourceVideoIdOrderByQueuedAtDesc(sourceId)
                .filter(job -> job.getStatus().isActive())
                .ifPresent(job -> {
                    if (jobService.forceCancelled(job.getId())) {
                        int removed = workQueue.removePending(job.getId());
                        LOGGER.info("JOB CANCELLED jobId={} sourceId={} pendingRemoved={}", job.getId(), sourceId, removed);
                    }
                });

        SourceVideo source = sourceRepo.findById(sourceId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "SOURCE_NOT_FOUND"));
        deleteArtifacts(source);
        source.clearResults();
        source.setVideoStatus(VideoStatus.CANCELLED);
        sourceRepo.save(source);
    }

    /**
     * Re-arms a FAILED job for one more attempt that the queue will not retry on its own.
     */
    @Transactional
    public ProcessVideoResponse retry(UUID jobId) {
        DubbingJob job = jobRepo.findById(jobId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "JOB_NOT_FOUND"));
        if (job.getStatus() != JobStatus.FAILED) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_NOT_FAILED");
        }
        if (sourceRepo.claimForQueue(job.getSourceVideoId(), clock.instant(), VideoStatus.ACTIVE) == 0) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "VIDEO_ALREADY_PROCESSING");
        }
        if (!jobService.rearmFailed(jobId)) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "JOB_NOT_FAILED");
        }
        workQueue.enqueue(jobId, 1, Duration.ofMillis(properties.getBackoffBaseMs()));
        LOGGER.info("JOB RETRY jobId={} sourceId={} previousRetryCount={}", jobId, job.getSourceVideoId(), job.getRetryCount());
        return new ProcessVideoResponse(jobId, JobStatus.QUEUED.name(),
                properties.getEstimatedProcessingSeconds(), "Job re-queued for retry");
    }

    @Transactional
    public ProcessVideoResponse regenerate(UUID sourceId, DubbingOptions options) {
        try {
            cancel(sourceId);
        } catch (ResponseStatusException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                throw e;
            }
            LOGGER.warn("Regenerate: cancel step failed, continuing sourceId={} reason={}", sourceId, e.getReason());
        } catch (RuntimeException e) {
            LOGGER.warn("Regenerate: cancel step failed, continuing sourceId={} error={}", sourceId, e.toString());
        }
        return submit(sourceId, options);
    }

    private void deleteArtifacts(SourceVideo source) {
        UUID sourceId = source.getId();
        Map<AssetKind, String> targets = new LinkedHashMap<>();
        targets.put(AssetKind.DUBBED_VIDEO, keyFor(source.getDubbedVideoUrl(), AssetKind.DUBBED_VIDEO, sourceId));
        targets.put(AssetKind.THUMBNAIL, keyFor(source.getThumbnailUrl(), AssetKind.THUMBNAIL, sourceId));
        targets.put(AssetKind.SUBTITLES, keyFor(source.getSubtitlesUrl(), AssetKind.SUBTITLES, sourceId));
        targets.put(AssetKind.HLS_PLAYLIST, keyFor(source.getHlsPlaylistUrl(), AssetKind.HLS_PLAYLIST, sourceId));
        targets.forEach((kind, key) -> {
            try {
                objectStore.delete(key);
            } catch (RuntimeException e) {
                LOGGER.warn("Artifact delete failed sourceId={} kind={} key={} error={}", sourceId, kind, key, e.toString());
            }
        });
        String prefix = AssetKind.hlsPrefix(sourceId);
        try {
            objectStore.deletePrefix(prefix);
        } catch (RuntimeException e) {
            LOGGER.warn("Artifact delete failed sourceId={} kind={} prefix={} error={}", sourceId, AssetKind.HLS_SEGMENT, prefix, e.toString());
        }
    }

    private String keyFor(String url, AssetKind kind, UUID sourceId) {
        if (url == null || url.isBlank()) {
            return kind.key(sourceId);
        }
        return objectStore.keyFromUrl(url).orElseGet(() -> kind.key(sourceId));
    }

    private static JobStatus parseStatus(String raw) {
        try {
            return JobStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "UNKNOWN_STATUS");
        }
    }

    VideoStatusResponse toResponse(DubbingJob job) {
        return new VideoStatusResponse(
                job.getId(),
                job.getSourceVideoId(),
                job.getStatus().name(),
                job.getProgress(),
                job.getCurrentStep() != null ? job.getCurrentStep() : job.getStatus().name(),
                job.getQueuedAt(),
                job.getStartedAt(),
                job.getCompletedAt(),
                job.getFailedAt(),
                estimatedCompletion(job),
                job.getDubbedVideoUrl(),
                job.getHlsPlaylistUrl(),
                job.getSubtitlesUrl(),
                job.getThumbnailUrl(),
                job.getErrorMessage(),
                job.getRetryCount(),
                job.getMaxRetries()
        );
    }

    /** Elapsed time against a flat total estimate; not stage weighted. */
    private Instant estimatedCompletion(DubbingJob job) {
        if (!job.getStatus().isStarted() || job.getStartedAt() == null) {
            return null;
        }
        Instant now = clock.instant();
        long elapsed = Math.max(0, Duration.between(job.getStartedAt(), now).getSeconds());
        long remaining = Math.max(0, properties.getEstimatedProcessingSeconds() - elapsed);
        return now.plusSeconds(remaining);
    }
}
