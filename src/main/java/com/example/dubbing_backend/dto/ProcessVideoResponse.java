package com.example.dubbing_backend.dto;

import java.util.UUID;

/**
 * Returned by submit, regenerate and retry.
 *
 * @param estimatedTime rough processing estimate in seconds.
 */
public record ProcessVideoResponse(UUID jobId, String status, long estimatedTime, String message) {
}
