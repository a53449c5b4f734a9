package com.example.dubbing_backend.dto;

/**
 * Metadata of the encoded output video.
 */
public record VideoMeta(double durationSec, String resolution, long sizeBytes, String format) {
}
