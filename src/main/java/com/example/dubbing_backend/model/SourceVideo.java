package com.example.dubbing_backend.model;

import com.example.dubbing_backend.util.VideoStatus;
import jakarta.persistence.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Catalog item owning the original video. Mirrors the outcome of its latest dubbing job.
 */
@Entity
@Table(name = "source_video")
public class SourceVideo {
    @Id
    @GeneratedValue
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "title", length = 512)
    private String title;

    @Column(name = "original_video_url", length = 2048)
    private String originalVideoUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "video_status", nullable = false, length = 32)
    private VideoStatus videoStatus = VideoStatus.NONE;

    @Column(name = "dubbed_video_url", length = 2048)
    private String dubbedVideoUrl;

    @Column(name = "hls_playlist_url", length = 2048)
    private String hlsPlaylistUrl;

    @Column(name = "subtitles_url", length = 2048)
    private String subtitlesUrl;

    @Column(name = "thumbnail_url", length = 2048)
    private String thumbnailUrl;

    @Column(name = "video_processed_at")
    private Instant videoProcessedAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "video_meta")
    private Map<String, Object> videoMeta;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public SourceVideo() {}

    public SourceVideo(String title, String originalVideoUrl) {
        this.title = title;
        this.originalVideoUrl = originalVideoUrl;
    }

    /** Clears every mirrored result field. */
    public void clearResults() {
        this.dubbedVideoUrl = null;
        this.hlsPlaylistUrl = null;
        this.subtitlesUrl = null;
        this.thumbnailUrl = null;
        this.videoMeta = null;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getOriginalVideoUrl() {
        return originalVideoUrl;
    }

    public void setOriginalVideoUrl(String originalVideoUrl) {
        this.originalVideoUrl = originalVideoUrl;
    }

    public VideoStatus getVideoStatus() {
        return videoStatus;
    }

    public void setVideoStatus(VideoStatus videoStatus) {
        this.videoStatus = videoStatus;
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

    public Instant getVideoProcessedAt() {
        return videoProcessedAt;
    }

    public void setVideoProcessedAt(Instant videoProcessedAt) {
        this.videoProcessedAt = videoProcessedAt;
    }

    public Map<String, Object> getVideoMeta() {
        return videoMeta;
    }

    public void setVideoMeta(Map<String, Object> videoMeta) {
        this.videoMeta = videoMeta;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @PrePersist
    void prePersist() {
        if (updatedAt == null) updatedAt = Instant.now();
        if (videoStatus == null) videoStatus = VideoStatus.NONE;
    }
}
