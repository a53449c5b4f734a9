package com.example.dubbing_backend.engine;

import com.example.dubbing_backend.config.EngineProperties;
import com.example.dubbing_backend.engine.Interfaces.AudioExtractor;
import com.example.dubbing_backend.engine.Interfaces.AudioMixer;
import com.example.dubbing_backend.engine.Interfaces.SourceSeparator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * ffmpeg-backed audio stages. Separation delegates to an external command when one is configured
 * and otherwise passes the whole track through as "voice" with no background.
 */
public class FfmpegAudioEngine implements AudioExtractor, SourceSeparator, AudioMixer {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioEngine.class);

    private final ProcessRunner runner;
    private final EngineProperties props;

    public FfmpegAudioEngine(ProcessRunner runner, EngineProperties props) {
        this.runner = runner;
        this.props = props;
    }

    @Override
    public Path extract(Path videoFile) throws Exception {
        Path out = sibling(videoFile, "audio", ".wav");
        List<String> cmd = List.of(
                props.getFfmpegBin(), "-y",
                "-i", videoFile.toAbsolutePath().toString(),
                "-vn",
                "-acodec", "pcm_s16le",
                "-ar", "16000",
                "-ac", "1",
                out.toAbsolutePath().toString()
        );
        runner.runChecked("ffmpeg extract", cmd, props.getTimeouts().getAudio());
        requireOutput(out, "ffmpeg extract");
        return out;
    }

    @Override
    public SourceSeparator.Result separate(Path audioFile) throws Exception {
        List<String> template = props.getSeparatorCommand();
        if (template == null || template.isEmpty()) {
            LOGGER.debug("No separator configured, passing audio through file={}", audioFile);
            return new SourceSeparator.Result(audioFile, null);
        }
        Path outDir = audioFile.resolveSibling("separated-" + UUID.randomUUID());
        Files.createDirectories(outDir);
        List<String> cmd = new ArrayList<>(template.size());
        for (String part : template) {
            cmd.add(part.replace("{input}", audioFile.toAbsolutePath().toString())
                    .replace("{outputDir}", outDir.toAbsolutePath().toString()));
        }
        runner.runChecked("separator", cmd, props.getTimeouts().getSeparation());
        Path voice = outDir.resolve("vocals.wav");
        requireOutput(voice, "separator");
        Path music = outDir.resolve("no_vocals.wav");
        return new SourceSeparator.Result(voice, Files.isRegularFile(music) ? music : null);
    }

    @Override
    public Path mix(Path voice, Path music, double duckingDb) throws Exception {
        Path out = sibling(voice, "mixed", ".wav");
        List<String> cmd;
        if (music == null) {
            cmd = List.of(
                    props.getFfmpegBin(), "-y",
                    "-i", voice.toAbsolutePath().toString(),
                    "-c", "copy",
                    out.toAbsolutePath().toString()
            );
        } else {
            String filter = String.format(Locale.ROOT,
                    "[1:a]volume=%.1fdB[music];[0:a][music]amix=inputs=2:duration=first:dropout_transition=2",
                    duckingDb);
            cmd = List.of(
                    props.getFfmpegBin(), "-y",
                    "-i", voice.toAbsolutePath().toString(),
                    "-i", music.toAbsolutePath().toString(),
                    "-filter_complex", filter,
                    out.toAbsolutePath().toString()
            );
        }
        runner.runChecked("ffmpeg mix", cmd, props.getTimeouts().getAudio());
        requireOutput(out, "ffmpeg mix");
        return out;
    }

    static Path sibling(Path file, String prefix, String ext) {
        return file.resolveSibling(prefix + "-" + UUID.randomUUID() + ext);
    }

    static void requireOutput(Path out, String tool) throws IOException {
        if (!Files.isRegularFile(out) || Files.size(out) == 0) {
            throw new IllegalStateException(tool + " produced no output: " + out);
        }
    }
}
