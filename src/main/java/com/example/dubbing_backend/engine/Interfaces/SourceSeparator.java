package com.example.dubbing_backend.engine.Interfaces;

import java.nio.file.Path;

public interface SourceSeparator {
    /**
     * @param voice isolated speech track.
     * @param music background track, {@code null} when the separator could not produce one.
     */
    record Result(Path voice, Path music) {}

    Result separate(Path audioFile) throws Exception;
}
