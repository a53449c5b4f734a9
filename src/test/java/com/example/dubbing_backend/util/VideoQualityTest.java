package com.example.dubbing_backend.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VideoQualityTest {

    @Test
    void acceptsLabelOrConstantName() {
        assertThat(VideoQuality.fromJson("1080p")).isEqualTo(VideoQuality.HIGH);
        assertThat(VideoQuality.fromJson(" medium ")).isEqualTo(VideoQuality.MEDIUM);
        assertThat(VideoQuality.fromJson("")).isNull();
        assertThat(VideoQuality.HIGH.resolution()).isEqualTo("1920x1080");
    }

    @Test
    void rejectsUnknownQuality() {
        assertThatThrownBy(() -> VideoQuality.fromJson("4k"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("4k");
    }

    @Test
    void voicesMapOntoSynthesizerModels() {
        assertThat(TtsVoice.fromJson("vi-male-1")).isEqualTo(TtsVoice.VI_MALE_1);
        assertThat(TtsVoice.fromJson("VI_FEMALE_2").model()).isEqualTo("vi_VN-vais1000-low");
        assertThat(TtsVoice.DEFAULT.toJson()).isEqualTo("vi-female-1");
        assertThatThrownBy(() -> TtsVoice.fromJson("en-male")).isInstanceOf(IllegalArgumentException.class);
    }
}
