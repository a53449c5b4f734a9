package com.example.dubbing_backend.engine.Interfaces;

import java.nio.file.Path;

public interface Downloader {
    record Result(Path file, double durationSec, String resolution, long sizeBytes, String format) {}

    Result download(String url, Path workDir) throws Exception;
}
