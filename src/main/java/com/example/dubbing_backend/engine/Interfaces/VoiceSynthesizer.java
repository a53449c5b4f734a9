package com.example.dubbing_backend.engine.Interfaces;

import com.example.dubbing_backend.util.TtsVoice;

import java.nio.file.Path;
import java.util.List;

public interface VoiceSynthesizer {
    /**
     * @param segments timed source transcript the text was translated from; may be empty.
     */
    record Request(String text, TtsVoice voice, List<Transcriber.Segment> segments, double speed, double pitch, Path outputDir) {}

    Path synthesize(Request request) throws Exception;
}
