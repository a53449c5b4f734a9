package com.example.dubbing_backend.dto;

import java.time.Instant;
import java.util.UUID;

public record VideoStatusResponse(
        UUID jobId,
        UUID sourceId,
        String status,
        int progress,
        String currentStep,
        Instant queuedAt,
        Instant startedAt,
        Instant completedAt,
        Instant failedAt,
        Instant estimatedCompletion,
        String dubbedVideoUrl,
        String hlsPlaylistUrl,
        String subtitlesUrl,
        String thumbnailUrl,
        String errorMessage,
        int retryCount,
        int maxRetries
) {
}
