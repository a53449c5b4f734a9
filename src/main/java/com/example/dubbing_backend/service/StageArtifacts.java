package com.example.dubbing_backend.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Temporary files of one pipeline attempt. Everything registered is removed by {@link #close()},
 * newest first; a failed removal is logged and never propagates.
 */
public class StageArtifacts implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(StageArtifacts.class);

    private final UUID jobId;
    private final Path workDir;
    private final Deque<Path> paths = new ArrayDeque<>();

    public StageArtifacts(UUID jobId, Path workDir) {
        this.jobId = jobId;
        this.workDir = workDir;
    }

    public static StageArtifacts open(UUID jobId, Path workRoot) throws IOException {
        Path dir = workRoot.resolve(jobId + "-" + UUID.randomUUID());
        Files.createDirectories(dir);
        StageArtifacts artifacts = new StageArtifacts(jobId, dir);
        artifacts.track(dir);
        return artifacts;
    }

    public Path workDir() {
        return workDir;
    }

    /** Registers a file or directory for removal; {@code null} is ignored. Returns its argument. */
    public Path track(Path path) {
        if (path != null && !paths.contains(path)) {
            paths.push(path);
        }
        return path;
    }

    public List<Path> tracked() {
        return List.copyOf(paths);
    }

    @Override
    public void close() {
        while (!paths.isEmpty()) {
            safeDelete(paths.pop());
        }
    }

    private void safeDelete(Path path) {
        try {
            if (Files.isDirectory(path)) {
                List<Path> tree;
                try (Stream<Path> walk = Files.walk(path)) {
                    tree = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
                }
                for (Path p : tree) {
                    Files.deleteIfExists(p);
                }
            } else {
                Files.deleteIfExists(path);
            }
        } catch (IOException | RuntimeException e) {
            LOGGER.warn("Temp cleanup failed jobId={} path={} error={}", jobId, path, e.toString());
        }
    }
}
