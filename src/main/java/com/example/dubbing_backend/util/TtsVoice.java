package com.example.dubbing_backend.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Voices offered to callers, mapped onto the synthesizer's model names.
 */
public enum TtsVoice {
    VI_FEMALE_1("vi-female-1", "vi_VN-vais1000-medium"),
    VI_FEMALE_2("vi-female-2", "vi_VN-vais1000-low"),
    VI_MALE_1("vi-male-1", "vi_VN-vivos-medium"),
    VI_MALE_2("vi-male-2", "vi_VN-vivos-low");

    public static final TtsVoice DEFAULT = VI_FEMALE_1;

    private final String id;
    private final String model;

    TtsVoice(String id, String model) {
        this.id = id;
        this.model = model;
    }

    public String id() {
        return id;
    }

    public String model() {
        return model;
    }

    @JsonCreator
    public static TtsVoice fromJson(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim();
        for (TtsVoice voice : values()) {
            if (voice.id.equalsIgnoreCase(normalized) || voice.name().equalsIgnoreCase(normalized)) {
                return voice;
            }
        }
        throw new IllegalArgumentException("Unsupported TTS voice: " + value);
    }

    @JsonValue
    public String toJson() {
        return id;
    }
}
