package com.example.dubbing_backend.engine.Interfaces;

import java.nio.file.Path;

public interface AudioExtractor {
    /** Writes a mono speech-friendly audio track of {@code videoFile} next to it. */
    Path extract(Path videoFile) throws Exception;
}
