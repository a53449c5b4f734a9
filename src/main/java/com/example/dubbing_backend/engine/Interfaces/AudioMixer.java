package com.example.dubbing_backend.engine.Interfaces;

import java.nio.file.Path;

public interface AudioMixer {
    /**
     * Mixes the synthesized voice over the background track.
     *
     * @param music background track or {@code null}, in which case the voice is used alone.
     * @param duckingDb gain applied to {@code music}, ignored without it.
     */
    Path mix(Path voice, Path music, double duckingDb) throws Exception;
}
