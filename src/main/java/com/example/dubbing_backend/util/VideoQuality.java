package com.example.dubbing_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Output quality tiers with their encoder presets.
 */
public enum VideoQuality {
    LOW("480p", "854x480", "1000k"),
    MEDIUM("720p", "1280x720", "2500k"),
    HIGH("1080p", "1920x1080", "5000k");

    public static final VideoQuality DEFAULT = MEDIUM;

    private final String label;
    private final String resolution;
    private final String videoBitrate;

    VideoQuality(String label, String resolution, String videoBitrate) {
        this.label = label;
        this.resolution = resolution;
        this.videoBitrate = videoBitrate;
    }

    public String label() {
        return label;
    }

    public String resolution() {
        return resolution;
    }

    public String videoBitrate() {
        return videoBitrate;
    }

    /**
     * Accepts either the label ({@code 720p}) or the constant name ({@code MEDIUM}).
     *
     * @param value incoming value from the request payload.
     * @return matching quality, {@code null} for blank input.
     */
    @JsonCreator
    public static VideoQuality fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim();
        for (VideoQuality quality : values()) {
            if (quality.label.equalsIgnoreCase(normalized) || quality.name().equalsIgnoreCase(normalized)) {
                return quality;
            }
        }
        throw new IllegalArgumentException("Unsupported video quality: " + value);
    }

    @JsonValue
    public String toJson() {
        return label;
    }
}
