package com.example.dubbing_backend.engine;

import com.example.dubbing_backend.config.EngineProperties;
import com.example.dubbing_backend.engine.Interfaces.Downloader;
import com.example.dubbing_backend.exception.ToolTimeoutException;
import com.example.dubbing_backend.exception.UnsupportedInputException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Fetches the source video. Direct media links are streamed over HTTP, everything else
 * (video pages on marketplaces, YouTube, ...) goes through yt-dlp. The result is probed with ffprobe.
 */
public class UrlVideoDownloader implements Downloader {
    private static final Logger LOGGER = LoggerFactory.getLogger(UrlVideoDownloader.class);
    private static final Set<String> DIRECT_EXTENSIONS = Set.of(".mp4", ".mov", ".m4v", ".webm", ".mkv");

    private final ProcessRunner runner;
    private final EngineProperties props;
    private final ObjectMapper objectMapper;

    public UrlVideoDownloader(ProcessRunner runner, EngineProperties props, ObjectMapper objectMapper) {
        this.runner = runner;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public Result download(String url, Path workDir) throws Exception {
        URI uri = parse(url);
        Files.createDirectories(workDir);
        Path target = workDir.resolve("source.mp4");
        if (isDirectMedia(uri)) {
            downloadWithHttp(uri, target);
        } else {
            downloadWithYtDlp(url, target);
        }
        if (!Files.isRegularFile(target) || Files.size(target) == 0) {
            throw new IllegalStateException("Download reported success but target is missing or empty: " + target);
        }
        long size = Files.size(target);
        Probe probe = probe(target);
        LOGGER.info("DOWNLOAD OK url={} size={} duration={} resolution={}", url, size, probe.durationSec(), probe.resolution());
        return new Result(target, probe.durationSec(), probe.resolution(), size, probe.format());
    }

    static URI parse(String url) {
        if (url == null || url.isBlank()) {
            throw new UnsupportedInputException("Source video URL is empty");
        }
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
                throw new UnsupportedInputException("Unsupported source video URL: " + url);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new UnsupportedInputException("Malformed source video URL: " + url, e);
        }
    }

    static boolean isDirectMedia(URI uri) {
        String path = uri.getPath() == null ? "" : uri.getPath().toLowerCase(Locale.ROOT);
        return DIRECT_EXTENSIONS.stream().anyMatch(path::endsWith);
    }

    private void downloadWithYtDlp(String url, Path target) throws Exception {
        List<String> cmd = new ArrayList<>(List.of(
                props.getYtdlpBin(),
                "--no-progress", "--newline", "--no-warnings",
                "-f", "best[ext=mp4]/bv*[ext=mp4]+ba[ext=m4a]/b",
                "--merge-output-format", "mp4",
                "--no-playlist",
                "-o", target.toString(),
                url
        ));
        ProcessRunner.ProcessResult result = runner.run(cmd, props.getTimeouts().getDownload());
        if (result.timedOut()) {
            cleanupPartial(target);
            throw new ToolTimeoutException("yt-dlp", props.getTimeouts().getDownload());
        }
        if (result.code() != 0) {
            cleanupPartial(target);
            String out = result.output() == null ? "" : result.output().toLowerCase(Locale.ROOT);
            if (out.contains("unsupported url") || out.contains("no video formats found")) {
                throw new UnsupportedInputException("yt-dlp cannot handle " + url);
            }
            throw new IllegalStateException("yt-dlp exit=" + result.code() + " log=" + ProcessRunner.truncate(result.output()));
        }
    }

    private void downloadWithHttp(URI uri, Path target) throws IOException {
        int timeoutMs = (int) props.getHttp().getTimeout().toMillis();
        URI current = uri;
        int redirects = 0;
        while (redirects <= props.getHttp().getMaxRedirects()) {
            HttpURLConnection conn = (HttpURLConnection) current.toURL().openConnection();
            conn.setInstanceFollowRedirects(false);
            conn.setConnectTimeout(timeoutMs);
            conn.setReadTimeout(timeoutMs);
            conn.setRequestProperty("User-Agent", props.getHttp().getUserAgent());
            conn.setRequestProperty("Accept", "*/*");
            try {
                int status = conn.getResponseCode();
                if (isRedirect(status)) {
                    String loc = conn.getHeaderField("Location");
                    if (loc == null || loc.isBlank()) {
                        throw new IllegalStateException("Redirect without Location header from: " + current);
                    }
                    current = current.resolve(loc);
                    redirects++;
                    continue;
                }
                if (status >= 200 && status < 300) {
                    Path tmp = target.resolveSibling(target.getFileName() + ".part");
                    try (InputStream is = conn.getInputStream()) {
                        Files.copy(is, tmp, StandardCopyOption.REPLACE_EXISTING);
                    }
                    Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                    return;
                }
                if (status >= 400 && status < 500 && status != 408 && status != 429) {
                    throw new UnsupportedInputException("HTTP download rejected " + status + " for " + current);
                }
                throw new IllegalStateException("HTTP download failed " + status + " for " + current);
            } finally {
                conn.disconnect();
            }
        }
        throw new IllegalStateException("Too many redirects (" + props.getHttp().getMaxRedirects() + ") for " + uri);
    }

    private Probe probe(Path file) {
        List<String> cmd = List.of(
                props.getFfprobeBin(), "-v", "error",
                "-select_streams", "v:0",
                "-show_entries", "stream=width,height:format=duration,format_name",
                "-of", "json",
                file.toString()
        );
        try {
            ProcessRunner.ProcessResult result = runner.run(cmd, props.getTimeouts().getProbe());
            if (!result.ok()) {
                LOGGER.warn("ffprobe failed file={} code={} timedOut={}", file, result.code(), result.timedOut());
                return Probe.UNKNOWN;
            }
            return parseProbe(objectMapper.readTree(result.output()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Probe.UNKNOWN;
        } catch (Exception e) {
            LOGGER.warn("ffprobe output unreadable file={} error={}", file, e.toString());
            return Probe.UNKNOWN;
        }
    }

    static Probe parseProbe(JsonNode root) {
        double duration = root.path("format").path("duration").asDouble(0);
        String format = root.path("format").path("format_name").asText("mp4");
        if (format.contains(",")) {
            format = format.contains("mp4") ? "mp4" : format.substring(0, format.indexOf(','));
        }
        JsonNode stream = root.path("streams").path(0);
        String resolution = stream.has("width") && stream.has("height")
                ? stream.get("width").asInt() + "x" + stream.get("height").asInt()
                : "unknown";
        return new Probe(duration, resolution, format);
    }

    private void cleanupPartial(Path target) {
        Path partial = target.resolveSibling(target.getFileName() + ".part");
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            LOGGER.warn("Failed to delete partial download partial={}", partial, e);
        }
    }

    private static boolean isRedirect(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    record Probe(double durationSec, String resolution, String format) {
        static final Probe UNKNOWN = new Probe(0, "unknown", "mp4");
    }
}
