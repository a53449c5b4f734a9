package com.example.dubbing_backend.service;

import com.example.dubbing_backend.exception.StorageException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalObjectStoreTest {

    private static final String BASE_URL = "http://localhost:8080/files";

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();
    private LocalObjectStore store;
    private Path upload;

    @BeforeEach
    void setUp() throws Exception {
        store = new LocalObjectStore(tmp.resolve("objects"), BASE_URL, mapper);
        upload = Files.writeString(tmp.resolve("upload.bin"), "payload");
    }

    @Test
    void putCopiesFileAndRecordsHeaders() throws Exception {
        String url = store.put("videos/dubbed/abc.mp4", upload, "video/mp4", Map.of("Cache-Control", "public, max-age=31536000"));

        assertThat(url).isEqualTo("http://localhost:8080/files/videos/dubbed/abc.mp4");
        Path stored = store.resolve("videos/dubbed/abc.mp4");
        assertThat(stored).hasContent("payload");
        assertThat(store.exists("videos/dubbed/abc.mp4")).isTrue();

        JsonNode meta = mapper.readTree(stored.resolveSibling("abc.mp4" + LocalObjectStore.META_SUFFIX).toFile());
        assertThat(meta.path("contentType").asText()).isEqualTo("video/mp4");
        assertThat(meta.path("headers").path("Cache-Control").asText()).isEqualTo("public, max-age=31536000");
        assertThat(meta.path("size").asLong()).isEqualTo(7);
    }

    @Test
    void putOverwritesExistingObject() throws Exception {
        store.put("videos/thumbnails/abc.jpg", upload, "image/jpeg", Map.of());
        Path newer = Files.writeString(tmp.resolve("newer.bin"), "second");

        store.put("videos/thumbnails/abc.jpg", newer, "image/jpeg", Map.of());

        assertThat(store.resolve("videos/thumbnails/abc.jpg")).hasContent("second");
    }

    @Test
    void deleteIsIdempotent() {
        store.put("videos/subtitles/abc.vtt", upload, "text/vtt", null);

        store.delete("videos/subtitles/abc.vtt");
        store.delete("videos/subtitles/abc.vtt");

        assertThat(store.exists("videos/subtitles/abc.vtt")).isFalse();
        assertThat(store.resolve("videos/subtitles/abc.vtt" + LocalObjectStore.META_SUFFIX)).doesNotExist();
    }

    @Test
    void deletePrefixRemovesEveryObjectBelowIt() {
        store.put("videos/hls/abc/segment_000.ts", upload, "video/mp2t", Map.of());
        store.put("videos/hls/abc/segment_001.ts", upload, "video/mp2t", Map.of());
        store.put("videos/hls/abc/playlist.m3u8", upload, "application/vnd.apple.mpegurl", Map.of());
        store.put("videos/hls/other/segment_000.ts", upload, "video/mp2t", Map.of());

        assertThat(store.deletePrefix("videos/hls/abc/")).isEqualTo(3);

        assertThat(store.resolve("videos/hls/abc")).doesNotExist();
        assertThat(store.exists("videos/hls/other/segment_000.ts")).isTrue();
        assertThat(store.deletePrefix("videos/hls/abc/")).isZero();
    }

    @Test
    void keyFromUrlOnlyAcceptsOwnUrls() {
        assertThat(store.keyFromUrl("http://localhost:8080/files/videos/dubbed/abc.mp4?v=2")).contains("videos/dubbed/abc.mp4");
        assertThat(store.keyFromUrl("https://elsewhere.example.com/videos/dubbed/abc.mp4")).isEmpty();
        assertThat(store.keyFromUrl(null)).isEmpty();
        assertThat(store.keyFromUrl("http://localhost:8080/files/")).isEmpty();
    }

    @Test
    void keysCannotEscapeTheBaseDirectory() {
        assertThatThrownBy(() -> store.put("../escape.mp4", upload, "video/mp4", Map.of()))
                .isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> store.delete("videos/../../escape.mp4"))
                .isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> store.deletePrefix("/"))
                .isInstanceOf(StorageException.class);
        assertThatThrownBy(() -> store.exists(" "))
                .isInstanceOf(StorageException.class);
    }
}
