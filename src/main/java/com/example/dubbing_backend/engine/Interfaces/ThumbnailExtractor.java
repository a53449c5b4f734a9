package com.example.dubbing_backend.engine.Interfaces;

import java.nio.file.Path;

public interface ThumbnailExtractor {
    Path extractThumbnail(Path video, double atSeconds) throws Exception;
}
