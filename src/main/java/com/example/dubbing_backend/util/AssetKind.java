package com.example.dubbing_backend.util;

import java.util.Map;
import java.util.UUID;

/**
 * Result artifacts uploaded to the object store. Keys are deterministic per source video
 * so a regeneration overwrites the previous upload.
 */
public enum AssetKind {
    DUBBED_VIDEO("videos/dubbed/%s.mp4", "video/mp4", "public, max-age=31536000"),
    THUMBNAIL("videos/thumbnails/%s.jpg", "image/jpeg", "public, max-age=86400"),
    SUBTITLES("videos/subtitles/%s.vtt", "text/vtt", "public, max-age=86400"),
    HLS_PLAYLIST("videos/hls/%s/playlist.m3u8", "application/vnd.apple.mpegurl", "no-cache"),
    HLS_SEGMENT("videos/hls/%s/%s", "video/mp2t", "public, max-age=31536000");

    private static final String HLS_PREFIX = "videos/hls/%s/";

    private final String keyPattern;
    private final String contentType;
    private final String cacheControl;

    AssetKind(String keyPattern, String contentType, String cacheControl) {
        this.keyPattern = keyPattern;
        this.contentType = contentType;
        this.cacheControl = cacheControl;
    }

    public String key(UUID sourceId) {
        if (this == HLS_SEGMENT) {
            throw new IllegalArgumentException("HLS segments need a file name");
        }
        return String.format(keyPattern, sourceId);
    }

    public static String hlsSegmentKey(UUID sourceId, String fileName) {
        return String.format(HLS_SEGMENT.keyPattern, sourceId, fileName);
    }

    public static String hlsPrefix(UUID sourceId) {
        return String.format(HLS_PREFIX, sourceId);
    }

    public String contentType() {
        return contentType;
    }

    public Map<String, String> headers() {
        return Map.of("Cache-Control", cacheControl);
    }
}
