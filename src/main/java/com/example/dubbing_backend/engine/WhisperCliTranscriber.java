package com.example.dubbing_backend.engine;

import com.example.dubbing_backend.config.EngineProperties;
import com.example.dubbing_backend.engine.Interfaces.Transcriber;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs the openai-whisper CLI and reads its JSON output.
 */
public class WhisperCliTranscriber implements Transcriber {
    private static final Logger LOGGER = LoggerFactory.getLogger(WhisperCliTranscriber.class);

    private final ProcessRunner runner;
    private final EngineProperties props;
    private final ObjectMapper objectMapper;

    public WhisperCliTranscriber(ProcessRunner runner, EngineProperties props, ObjectMapper objectMapper) {
        this.runner = runner;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public Result transcribe(Path audioFile, String language) throws Exception {
        Path outDir = audioFile.resolveSibling("whisper-" + UUID.randomUUID());
        Files.createDirectories(outDir);
        List<String> cmd = List.of(
                props.getWhisperBin(),
                audioFile.toAbsolutePath().toString(),
                "--model", props.getWhisperModel(),
                "--language", language,
                "--output_format", "json",
                "--output_dir", outDir.toAbsolutePath().toString()
        );
        long t0 = System.nanoTime();
        runner.runChecked("whisper", cmd, props.getTimeouts().getTranscription());
        Path json = outDir.resolve(baseName(audioFile) + ".json");
        if (!Files.isRegularFile(json)) {
            throw new IllegalStateException("whisper produced no JSON output: " + json);
        }
        Result result = parse(objectMapper.readTree(json.toFile()), language);
        LOGGER.info("WHISPER OK file={} segments={} chars={} in={}ms", audioFile.getFileName(),
                result.segments().size(), result.text().length(), (System.nanoTime() - t0) / 1_000_000);
        return result;
    }

    static Result parse(JsonNode root, String fallbackLanguage) {
        List<Segment> segments = new ArrayList<>();
        int idx = 0;
        for (JsonNode seg : root.path("segments")) {
            segments.add(new Segment(
                    seg.path("id").asInt(idx),
                    seg.path("start").asDouble(0),
                    seg.path("end").asDouble(0),
                    seg.path("text").asText("").trim()));
            idx++;
        }
        double duration = root.path("duration").asDouble(0);
        if (duration <= 0 && !segments.isEmpty()) {
            duration = segments.get(segments.size() - 1).end();
        }
        String text = root.path("text").asText("").trim();
        String language = root.path("language").asText(fallbackLanguage);
        return new Result(text, language, duration, List.copyOf(segments));
    }

    private static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
