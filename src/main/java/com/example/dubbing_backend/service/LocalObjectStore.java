package com.example.dubbing_backend.service;

import com.example.dubbing_backend.exception.StorageException;
import com.example.dubbing_backend.service.Interfaces.ObjectStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Filesystem-backed object store. Objects live under {@code baseDir/<key>}; content type and
 * headers are kept in a {@code <key>.meta.json} sidecar so a CDN or file server can replay them.
 */
public class LocalObjectStore implements ObjectStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(LocalObjectStore.class);
    static final String META_SUFFIX = ".meta.json";

    private final Path baseDir;
    private final String publicBaseUrl;
    private final ObjectMapper objectMapper;

    public LocalObjectStore(Path baseDir, String publicBaseUrl, ObjectMapper objectMapper) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.endsWith("/") ? publicBaseUrl : publicBaseUrl + "/";
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(this.baseDir);
            LOGGER.info("LocalObjectStore ready. base={}, publicBaseUrl={}", this.baseDir, this.publicBaseUrl);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory " + this.baseDir, e);
        }
    }

    @Override
    public String put(String key, Path file, String contentType, Map<String, String> headers) {
        Path target = safeResolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.copy(file, target, REPLACE_EXISTING);
            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("contentType", contentType);
            meta.put("headers", headers == null ? Map.of() : headers);
            meta.put("size", Files.size(target));
            objectMapper.writeValue(metaPath(target).toFile(), meta);
        } catch (IOException e) {
            throw new StorageException("Upload failed: " + file + " -> " + key, e);
        }
        LOGGER.debug("STORE PUT key={} contentType={}", key, contentType);
        return publicBaseUrl + normalizeKey(key);
    }

    @Override
    public void delete(String key) {
        Path target = safeResolve(key);
        try {
            Files.deleteIfExists(target);
            Files.deleteIfExists(metaPath(target));
        } catch (IOException e) {
            throw new StorageException("Delete failed: " + key, e);
        }
    }

    @Override
    public int deletePrefix(String prefix) {
        Path root = safeResolve(prefix);
        if (!Files.exists(root)) {
            return 0;
        }
        List<Path> paths;
        try (Stream<Path> walk = Files.walk(root)) {
            paths = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
        } catch (IOException e) {
            throw new StorageException("Listing failed: " + prefix, e);
        }
        int removed = 0;
        for (Path p : paths) {
            try {
                boolean object = Files.isRegularFile(p) && !p.getFileName().toString().endsWith(META_SUFFIX);
                Files.deleteIfExists(p);
                if (object) removed++;
            } catch (IOException e) {
                throw new StorageException("Delete failed: " + p, e);
            }
        }
        return removed;
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(safeResolve(key));
    }

    @Override
    public Optional<String> keyFromUrl(String url) {
        if (url == null || url.isBlank() || !url.startsWith(publicBaseUrl)) {
            return Optional.empty();
        }
        String key = url.substring(publicBaseUrl.length());
        int query = key.indexOf('?');
        if (query >= 0) key = key.substring(0, query);
        return key.isBlank() ? Optional.empty() : Optional.of(key);
    }

    Path resolve(String key) {
        return safeResolve(key);
    }

    private Path safeResolve(String key) {
        if (key == null || key.isBlank()) {
            throw new StorageException("objectKey is blank");
        }
        Path p = baseDir.resolve(normalizeKey(key)).normalize();
        if (!p.startsWith(baseDir) || p.equals(baseDir)) {
            throw new StorageException("Invalid objectKey (path traversal?): " + key);
        }
        return p;
    }

    private static String normalizeKey(String key) {
        return key.replace('\\', '/').replaceAll("^/+", "");
    }

    private static Path metaPath(Path target) {
        return target.resolveSibling(target.getFileName() + META_SUFFIX);
    }
}
