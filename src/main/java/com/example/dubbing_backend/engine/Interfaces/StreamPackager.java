package com.example.dubbing_backend.engine.Interfaces;

import java.nio.file.Path;
import java.util.List;

public interface StreamPackager {
    /**
     * @param directory working directory holding the playlist and the segments.
     */
    record Result(Path directory, Path playlist, List<Path> segments) {}

    Result packageHls(Path video) throws Exception;
}
