package com.example.dubbing_backend.engine;

import com.example.dubbing_backend.config.EngineProperties;
import com.example.dubbing_backend.engine.Interfaces.VoiceSynthesizer;
import com.example.dubbing_backend.exception.UnsupportedInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Piper TTS. The voice id selects an {@code .onnx} model under {@code engine.piper-models-dir};
 * speed maps to piper's {@code --length_scale}.
 */
public class PiperVoiceSynthesizer implements VoiceSynthesizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PiperVoiceSynthesizer.class);

    private final ProcessRunner runner;
    private final EngineProperties props;

    public PiperVoiceSynthesizer(ProcessRunner runner, EngineProperties props) {
        this.runner = runner;
        this.props = props;
    }

    @Override
    public Path synthesize(Request request) throws Exception {
        if (request.text() == null || request.text().isBlank()) {
            throw new UnsupportedInputException("Nothing to synthesize: translated text is empty");
        }
        Files.createDirectories(request.outputDir());
        String id = UUID.randomUUID().toString();
        Path textFile = request.outputDir().resolve("tts-" + id + ".txt");
        Path out = request.outputDir().resolve("tts-" + id + ".wav");
        Files.writeString(textFile, request.text(), StandardCharsets.UTF_8);

        Path model = Path.of(props.getPiperModelsDir()).resolve(request.voice().model() + ".onnx");
        double speed = request.speed() > 0 ? request.speed() : 1.0;
        List<String> cmd = List.of(
                props.getPiperBin(),
                "--model", model.toAbsolutePath().toString(),
                "--length_scale", String.format(Locale.ROOT, "%.3f", 1.0 / speed),
                "--output_file", out.toAbsolutePath().toString()
        );
        try {
            runner.runChecked("piper", cmd, props.getTimeouts().getSynthesis(), textFile);
        } finally {
            Files.deleteIfExists(textFile);
        }
        FfmpegAudioEngine.requireOutput(out, "piper");
        LOGGER.info("TTS OK voice={} chars={} segments={} out={}", request.voice().id(), request.text().length(),
                request.segments() == null ? 0 : request.segments().size(), out.getFileName());
        return out;
    }
}
