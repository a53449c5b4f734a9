package com.example.dubbing_backend.dto;

import com.example.dubbing_backend.util.TtsVoice;
import com.example.dubbing_backend.util.VideoQuality;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Pattern;

import java.io.Serializable;

/**
 * Per-job processing options. Fixed once the job record exists; {@code null} fields mean "use the default".
 */
public record DubbingOptions(
        @JsonProperty("keepBGM") Boolean keepBgm,
        TtsVoice ttsVoice,
        VideoQuality quality,
        Boolean generateSubtitles,
        @JsonProperty("generateHLS") Boolean generateHls,
        @Pattern(regexp = "^[a-zA-Z]{2,3}(-[a-zA-Z]{2,4})?$", message = "INVALID_LANGUAGE") String targetLang,
        @Pattern(regexp = "^[a-zA-Z]{2,3}(-[a-zA-Z]{2,4})?$", message = "INVALID_LANGUAGE") String sourceLang
) implements Serializable {

    public static final String DEFAULT_TARGET_LANG = "vi";

    public static DubbingOptions defaults() {
        return new DubbingOptions(null, null, null, null, null, null, null);
    }

    /**
     * Fills every unset field so the stored options are self-describing.
     *
     * @param defaultSourceLang source language used when the caller did not send one.
     * @return options without {@code null} fields.
     */
    public DubbingOptions normalized(String defaultSourceLang) {
        return new DubbingOptions(
                Boolean.TRUE.equals(keepBgm),
                ttsVoice != null ? ttsVoice : TtsVoice.DEFAULT,
                quality != null ? quality : VideoQuality.DEFAULT,
                Boolean.TRUE.equals(generateSubtitles),
                Boolean.TRUE.equals(generateHls),
                blankToDefault(targetLang, DEFAULT_TARGET_LANG),
                blankToDefault(sourceLang, defaultSourceLang)
        );
    }

    public boolean keepBackgroundAudio() {
        return Boolean.TRUE.equals(keepBgm);
    }

    public boolean subtitlesRequested() {
        return Boolean.TRUE.equals(generateSubtitles);
    }

    public boolean hlsRequested() {
        return Boolean.TRUE.equals(generateHls);
    }

    private static String blankToDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim().toLowerCase(java.util.Locale.ROOT);
    }
}
