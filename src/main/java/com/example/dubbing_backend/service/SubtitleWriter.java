package com.example.dubbing_backend.service;

import com.example.dubbing_backend.engine.Interfaces.Transcriber;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders the translated text as WebVTT on the source timing. The translation is one block of text,
 * so its words are spread over the transcription segments in proportion to each segment's duration.
 */
@Component
public class SubtitleWriter {
    private static final int MAX_LINE_CHARS = 42;

    record Cue(long startMs, long endMs, String text) {}

    public Path write(List<Transcriber.Segment> segments, String translatedText, double durationSec, Path target) throws IOException {
        Files.createDirectories(target.toAbsolutePath().getParent());
        Files.writeString(target, render(segments, translatedText, durationSec), StandardCharsets.UTF_8);
        return target;
    }

    public String render(List<Transcriber.Segment> segments, String translatedText, double durationSec) {
        StringBuilder vtt = new StringBuilder("WEBVTT\n\n");
        for (Cue cue : cues(segments, translatedText, durationSec)) {
            vtt.append(formatVttTime(cue.startMs()))
               .append(" --> ")
               .append(formatVttTime(cue.endMs()))
               .append('\n')
               .append(wrap(cue.text()))
               .append("\n\n");
        }
        return vtt.toString();
    }

    static List<Cue> cues(List<Transcriber.Segment> segments, String translatedText, double durationSec) {
        String normalized = translatedText == null ? "" : translatedText.replaceAll("\\s+", " ").trim();
        if (normalized.isEmpty()) {
            return List.of();
        }
        String[] words = normalized.split(" ");
        List<Transcriber.Segment> timed = new ArrayList<>();
        if (segments != null) {
            for (Transcriber.Segment s : segments) {
                if (s.end() > s.start()) timed.add(s);
            }
        }
        if (timed.isEmpty()) {
            long end = Math.max(1000L, Math.round(durationSec * 1000));
            return List.of(new Cue(0, end, normalized));
        }

        double total = 0;
        for (Transcriber.Segment s : timed) total += s.end() - s.start();

        List<Cue> cues = new ArrayList<>();
        double elapsed = 0;
        int from = 0;
        for (int i = 0; i < timed.size(); i++) {
            Transcriber.Segment s = timed.get(i);
            elapsed += s.end() - s.start();
            int to = i == timed.size() - 1 ? words.length : (int) Math.round(words.length * (elapsed / total));
            to = Math.max(from, Math.min(words.length, to));
            if (to > from) {
                cues.add(new Cue(Math.round(s.start() * 1000), Math.round(s.end() * 1000), String.join(" ", List.of(words).subList(from, to))));
            }
            from = to;
        }
        return cues;
    }

    private static String wrap(String text) {
        if (text.length() <= MAX_LINE_CHARS) {
            return text;
        }
        int mid = text.length() / 2;
        int left = text.lastIndexOf(' ', mid);
        int right = text.indexOf(' ', mid);
        int split = left < 0 ? right : (right < 0 ? left : (mid - left <= right - mid ? left : right));
        if (split <= 0) {
            return text;
        }
        return text.substring(0, split) + "\n" + text.substring(split + 1);
    }

    static String formatVttTime(long offsetMs) {
        long safeMs = Math.max(0, offsetMs);
        long hours = safeMs / 3_600_000;
        long minutes = (safeMs % 3_600_000) / 60_000;
        long seconds = (safeMs % 60_000) / 1000;
        long millis = safeMs % 1000;
        return String.format(Locale.ROOT, "%02d:%02d:%02d.%03d", hours, minutes, seconds, millis);
    }
}
