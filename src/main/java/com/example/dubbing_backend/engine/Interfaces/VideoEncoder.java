package com.example.dubbing_backend.engine.Interfaces;

import com.example.dubbing_backend.util.VideoQuality;

import java.nio.file.Path;

public interface VideoEncoder {
    /** Replaces the audio track of {@code video} with {@code audio}, re-encoding at {@code quality}. */
    Path encode(Path video, Path audio, VideoQuality quality) throws Exception;
}
