package com.example.dubbing_backend.engine.Interfaces;

import java.nio.file.Path;
import java.util.List;

public interface Transcriber {
    record Segment(int id, double start, double end, String text) {}
    record Result(String text, String language, double durationSec, List<Segment> segments) {}

    Result transcribe(Path audioFile, String language) throws Exception;
}
