package com.example.dubbing_backend.util;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssetKindTest {

    private static final UUID SOURCE = UUID.fromString("7f0c2a9e-2f43-4d61-9a1f-4c7a3b7d9e10");

    @Test
    void keysAreDeterministicPerSource() {
        assertThat(AssetKind.DUBBED_VIDEO.key(SOURCE)).isEqualTo("videos/dubbed/" + SOURCE + ".mp4");
        assertThat(AssetKind.THUMBNAIL.key(SOURCE)).isEqualTo("videos/thumbnails/" + SOURCE + ".jpg");
        assertThat(AssetKind.SUBTITLES.key(SOURCE)).isEqualTo("videos/subtitles/" + SOURCE + ".vtt");
        assertThat(AssetKind.HLS_PLAYLIST.key(SOURCE)).isEqualTo("videos/hls/" + SOURCE + "/playlist.m3u8");
    }

    @Test
    void hlsSegmentsLiveUnderThePlaylistPrefix() {
        String prefix = AssetKind.hlsPrefix(SOURCE);

        assertThat(AssetKind.hlsSegmentKey(SOURCE, "segment_000.ts")).startsWith(prefix).endsWith("/segment_000.ts");
        assertThat(AssetKind.HLS_PLAYLIST.key(SOURCE)).startsWith(prefix);
        assertThatThrownBy(() -> AssetKind.HLS_SEGMENT.key(SOURCE)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void playlistIsNeverCached() {
        assertThat(AssetKind.HLS_PLAYLIST.headers()).containsEntry("Cache-Control", "no-cache");
        assertThat(AssetKind.DUBBED_VIDEO.contentType()).isEqualTo("video/mp4");
        assertThat(AssetKind.HLS_SEGMENT.contentType()).isEqualTo("video/mp2t");
    }
}
