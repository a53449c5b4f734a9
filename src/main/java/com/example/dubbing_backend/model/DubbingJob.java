package com.example.dubbing_backend.model;

import com.example.dubbing_backend.dto.DubbingOptions;
import com.example.dubbing_backend.util.JobStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One localization attempt for one source video. A source keeps its job history;
 * at most one of them is non-terminal at a time.
 */
@Entity
@Table(
        name = "dubbing_job",
        indexes = {
                @Index(name = "idx_dubbing_job_source_queued", columnList = "source_video_id, queued_at"),
                @Index(name = "idx_dubbing_job_status_queued", columnList = "status, queued_at")
        }
)
public class DubbingJob {
    public static final int DEFAULT_MAX_RETRIES = 3;

    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "source_video_id", nullable = false, updatable = false)
    private UUID sourceVideoId;

    @Column(name = "original_video_url", nullable = false, length = 2048, updatable = false)
    private String originalVideoUrl;

    @Column(name = "source_lang", nullable = false, length = 16, updatable = false)
    private String sourceLang;

    @Column(name = "target_lang", nullable = false, length = 16, updatable = false)
    private String targetLang;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "options", updatable = false)
    private DubbingOptions options;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private JobStatus status = JobStatus.QUEUED;

    @Column(name = "progress", nullable = false)
    private int progress = 0;

    @Column(name = "current_step", length = 64)
    private String currentStep;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "max_retries", nullable = false)
    private int maxRetries = DEFAULT_MAX_RETRIES;

    @Column(name = "queued_at", nullable = false)
    private Instant queuedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "dubbed_video_url", length = 2048)
    private String dubbedVideoUrl;

    @Column(name = "hls_playlist_url", length = 2048)
    private String hlsPlaylistUrl;

    @Column(name = "subtitles_url", length = 2048)
    private String subtitlesUrl;

    @Column(name = "thumbnail_url", length = 2048)
    private String thumbnailUrl;

    @Column(name = "processing_time_sec")
    private Long processingTimeSec;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "video_meta")
    private Map<String, Object> videoMeta;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "audio_meta")
    private Map<String, Object> audioMeta;

    @Column(name = "error_message", length = 2000)
    private String errorMessage;

    @Column(name = "error_detail", length = 4000)
    private String errorDetail;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    protected DubbingJob() {}

    public DubbingJob(UUID sourceVideoId, String originalVideoUrl, DubbingOptions options, Instant queuedAt) {
        this.sourceVideoId = sourceVideoId;
        this.originalVideoUrl = originalVideoUrl;
        this.options = options;
        this.sourceLang = options.sourceLang();
        this.targetLang = options.targetLang();
        this.queuedAt = queuedAt;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public UUID getSourceVideoId() {
        return sourceVideoId;
    }

    public String getOriginalVideoUrl() {
        return originalVideoUrl;
    }

    public String getSourceLang() {
        return sourceLang;
    }

    public String getTargetLang() {
        return targetLang;
    }

    public DubbingOptions getOptions() {
        return options;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public int getProgress() {
        return progress;
    }

    public void setProgress(int progress) {
        this.progress = progress;
    }

    public String getCurrentStep() {
        return currentStep;
    }

    public void setCurrentStep(String currentStep) {
        this.currentStep = currentStep;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Instant getQueuedAt() {
        return queuedAt;
    }

    public void setQueuedAt(Instant queuedAt) {
        this.queuedAt = queuedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(Instant failedAt) {
        this.failedAt = failedAt;
    }

    public String getDubbedVideoUrl() {
        return dubbedVideoUrl;
    }

    public void setDubbedVideoUrl(String dubbedVideoUrl) {
        this.dubbedVideoUrl = dubbedVideoUrl;
    }

    public String getHlsPlaylistUrl() {
        return hlsPlaylistUrl;
    }

    public void setHlsPlaylistUrl(String hlsPlaylistUrl) {
        this.hlsPlaylistUrl = hlsPlaylistUrl;
    }

    public String getSubtitlesUrl() {
        return subtitlesUrl;
    }

    public void setSubtitlesUrl(String subtitlesUrl) {
        this.subtitlesUrl = subtitlesUrl;
    }

    public String getThumbnailUrl() {
        return thumbnailUrl;
    }

    public void setThumbnailUrl(String thumbnailUrl) {
        this.thumbnailUrl = thumbnailUrl;
    }

    public Long getProcessingTimeSec() {
        return processingTimeSec;
    }

    public void setProcessingTimeSec(Long processingTimeSec) {
        this.processingTimeSec = processingTimeSec;
    }

    public Map<String, Object> getVideoMeta() {
        return videoMeta;
    }

    public void setVideoMeta(Map<String, Object> videoMeta) {
        this.videoMeta = videoMeta;
    }

    public Map<String, Object> getAudioMeta() {
        return audioMeta;
    }

    public void setAudioMeta(Map<String, Object> audioMeta) {
        this.audioMeta = audioMeta;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    public void setErrorDetail(String errorDetail) {
        this.errorDetail = errorDetail;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public long getVersion() {
        return version;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (queuedAt == null) queuedAt = Instant.now();
        if (status == null) status = JobStatus.QUEUED;
    }
}
