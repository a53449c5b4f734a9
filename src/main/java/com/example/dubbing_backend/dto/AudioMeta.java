package com.example.dubbing_backend.dto;

import com.example.dubbing_backend.engine.Interfaces.Transcriber;

import java.util.List;

/**
 * Text and voice settings that produced the dubbed track.
 */
public record AudioMeta(String transcription,
                        String translation,
                        TtsConfig ttsConfig,
                        List<Transcriber.Segment> timings) {

    public record TtsConfig(String voice, double speed, double pitch) {}
}
