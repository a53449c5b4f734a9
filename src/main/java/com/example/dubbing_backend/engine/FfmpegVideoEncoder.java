package com.example.dubbing_backend.engine;

import com.example.dubbing_backend.config.EngineProperties;
import com.example.dubbing_backend.engine.Interfaces.StreamPackager;
import com.example.dubbing_backend.engine.Interfaces.ThumbnailExtractor;
import com.example.dubbing_backend.engine.Interfaces.VideoEncoder;
import com.example.dubbing_backend.util.VideoQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * ffmpeg video stages: H.264 re-encode with the dubbed track, HLS packaging and thumbnail grabs.
 */
public class FfmpegVideoEncoder implements VideoEncoder, StreamPackager, ThumbnailExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegVideoEncoder.class);

    private final ProcessRunner runner;
    private final EngineProperties props;

    public FfmpegVideoEncoder(ProcessRunner runner, EngineProperties props) {
        this.runner = runner;
        this.props = props;
    }

    @Override
    public Path encode(Path video, Path audio, VideoQuality quality) throws Exception {
        VideoQuality q = quality != null ? quality : VideoQuality.DEFAULT;
        Path out = FfmpegAudioEngine.sibling(video, "dubbed", ".mp4");
        String res = q.resolution().replace('x', ':');
        String vf = "scale=" + res + ":force_original_aspect_ratio=decrease,pad=" + res + ":(ow-iw)/2:(oh-ih)/2";
        List<String> cmd = List.of(
                props.getFfmpegBin(), "-y",
                "-i", video.toAbsolutePath().toString(),
                "-i", audio.toAbsolutePath().toString(),
                "-c:v", "libx264",
                "-preset", "medium",
                "-crf", "23",
                "-vf", vf,
                "-b:v", q.videoBitrate(),
                "-c:a", "aac",
                "-b:a", "192k",
                "-map", "0:v:0",
                "-map", "1:a:0",
                "-shortest",
                "-movflags", "+faststart",
                out.toAbsolutePath().toString()
        );
        long t0 = System.nanoTime();
        runner.runChecked("ffmpeg encode", cmd, props.getTimeouts().getEncoding());
        FfmpegAudioEngine.requireOutput(out, "ffmpeg encode");
        LOGGER.info("ENCODE OK quality={} out={} in={}ms", q.label(), out.getFileName(), (System.nanoTime() - t0) / 1_000_000);
        return out;
    }

    @Override
    public StreamPackager.Result packageHls(Path video) throws Exception {
        Path dir = video.resolveSibling("hls-" + UUID.randomUUID());
        Files.createDirectories(dir);
        Path playlist = dir.resolve("playlist.m3u8");
        List<String> cmd = List.of(
                props.getFfmpegBin(), "-y",
                "-i", video.toAbsolutePath().toString(),
                "-c:v", "copy",
                "-c:a", "copy",
                "-start_number", "0",
                "-hls_time", String.valueOf(props.getHlsSegmentSeconds()),
                "-hls_list_size", "0",
                "-hls_segment_filename", dir.resolve("segment_%03d.ts").toAbsolutePath().toString(),
                "-f", "hls",
                playlist.toAbsolutePath().toString()
        );
        runner.runChecked("ffmpeg hls", cmd, props.getTimeouts().getPackaging());
        FfmpegAudioEngine.requireOutput(playlist, "ffmpeg hls");
        List<Path> segments;
        try (Stream<Path> files = Files.list(dir)) {
            segments = files.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".ts"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        return new StreamPackager.Result(dir, playlist, segments);
    }

    @Override
    public Path extractThumbnail(Path video, double atSeconds) throws Exception {
        Path out = FfmpegAudioEngine.sibling(video, "thumb", ".jpg");
        List<String> cmd = List.of(
                props.getFfmpegBin(), "-y",
                "-ss", String.format(Locale.ROOT, "%.2f", Math.max(0, atSeconds)),
                "-i", video.toAbsolutePath().toString(),
                "-vframes", "1",
                "-q:v", "2",
                out.toAbsolutePath().toString()
        );
        runner.runChecked("ffmpeg thumbnail", cmd, props.getTimeouts().getAudio());
        FfmpegAudioEngine.requireOutput(out, "ffmpeg thumbnail");
        return out;
    }
}
