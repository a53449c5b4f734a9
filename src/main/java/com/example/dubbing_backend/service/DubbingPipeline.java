package com.example.dubbing_backend.service;

import com.example.dubbing_backend.config.DubbingProperties;
import com.example.dubbing_backend.config.StorageProperties;
import com.example.dubbing_backend.dto.AudioMeta;
import com.example.dubbing_backend.dto.DubbingOptions;
import com.example.dubbing_backend.dto.VideoMeta;
import com.example.dubbing_backend.engine.Interfaces.AudioExtractor;
import com.example.dubbing_backend.engine.Interfaces.AudioMixer;
import com.example.dubbing_backend.engine.Interfaces.Downloader;
import com.example.dubbing_backend.engine.Interfaces.SourceSeparator;
import com.example.dubbing_backend.engine.Interfaces.StreamPackager;
import com.example.dubbing_backend.engine.Interfaces.ThumbnailExtractor;
import com.example.dubbing_backend.engine.Interfaces.Transcriber;
import com.example.dubbing_backend.engine.Interfaces.Translator;
import com.example.dubbing_backend.engine.Interfaces.VideoEncoder;
import com.example.dubbing_backend.engine.Interfaces.VoiceSynthesizer;
import com.example.dubbing_backend.exception.JobCancelledException;
import com.example.dubbing_backend.exception.PermanentStageException;
import com.example.dubbing_backend.exception.StageException;
import com.example.dubbing_backend.exception.StageTimeoutException;
import com.example.dubbing_backend.exception.ToolTimeoutException;
import com.example.dubbing_backend.exception.TransientStageException;
import com.example.dubbing_backend.exception.UnsupportedInputException;
import com.example.dubbing_backend.model.DubbingJob;
import com.example.dubbing_backend.service.Interfaces.ObjectStore;
import com.example.dubbing_backend.util.AssetKind;
import com.example.dubbing_backend.util.JobStatus;
import com.example.dubbing_backend.util.VideoQuality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs one attempt of a job through the fixed stage sequence. Each stage is persisted before its
 * collaborator call; a stage that finds the job no longer active ends the attempt with
 * {@link JobCancelledException}. Temporary files never outlive the attempt.
 */
@Service
public class DubbingPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(DubbingPipeline.class);
    private static final String VIDEO_FORMAT = "mp4";

    private final Downloader downloader;
    private final AudioExtractor audioExtractor;
    private final SourceSeparator sourceSeparator;
    private final Transcriber transcriber;
    private final Translator translator;
    private final VoiceSynthesizer voiceSynthesizer;
    private final AudioMixer audioMixer;
    private final VideoEncoder videoEncoder;
    private final StreamPackager streamPackager;
    private final ThumbnailExtractor thumbnailExtractor;
    private final ObjectStore objectStore;
    private final JobService jobService;
    private final SubtitleWriter subtitleWriter;
    private final DubbingProperties properties;
    private final Path workRoot;
    private final Clock clock;

    public DubbingPipeline(Downloader downloader,
                           AudioExtractor audioExtractor,
                           SourceSeparator sourceSeparator,
                           Transcriber transcriber,
                           Translator translator,
                           VoiceSynthesizer voiceSynthesizer,
                           AudioMixer audioMixer,
                           VideoEncoder videoEncoder,
                           StreamPackager streamPackager,
                           ThumbnailExtractor thumbnailExtractor,
                           ObjectStore objectStore,
                           JobService jobService,
                           SubtitleWriter subtitleWriter,
                           DubbingProperties properties,
                           StorageProperties storageProperties,
                           Clock clock) {
        this.downloader = downloader;
        this.audioExtractor = audioExtractor;
        this.sourceSeparator = sourceSeparator;
        this.transcriber = transcriber;
        this.translator = translator;
        this.voiceSynthesizer = voiceSynthesizer;
        this.audioMixer = audioMixer;
        this.videoEncoder = videoEncoder;
        this.streamPackager = streamPackager;
        this.thumbnailExtractor = thumbnailExtractor;
        this.objectStore = objectStore;
        this.jobService = jobService;
        this.subtitleWriter = subtitleWriter;
        this.properties = properties;
        this.workRoot = Path.of(storageProperties.getWorkDir());
        this.clock = clock;
    }

    @FunctionalInterface
    interface StageCall<T> {
        T run() throws Exception;
    }

    /**
     * @throws StageException when a stage fails; the caller decides about retries.
     * @throws JobCancelledException when the job stopped being active during the attempt.
     */
    public JobService.Completion run(UUID jobId) {
        DubbingJob job = jobService.find(jobId).orElseThrow(() -> new JobCancelledException(jobId));
        if (job.getStatus().isTerminal()) {
            throw new JobCancelledException(jobId);
        }
        DubbingOptions options = job.getOptions() != null
                ? job.getOptions().normalized(job.getSourceLang())
                : DubbingOptions.defaults().normalized(job.getSourceLang());
        long t0 = clock.millis();

        StageArtifacts artifacts = call(JobStatus.DOWNLOADING, () -> StageArtifacts.open(jobId, workRoot));
        try {
            return execute(job, options, artifacts, t0);
        } finally {
            artifacts.close();
        }
    }

    private JobService.Completion execute(DubbingJob job, DubbingOptions options, StageArtifacts artifacts, long t0) {
        UUID jobId = job.getId();
        UUID sourceId = job.getSourceVideoId();
        Path workDir = artifacts.workDir();

        enter(jobId, JobStatus.DOWNLOADING);
        Downloader.Result download = call(JobStatus.DOWNLOADING, () -> downloader.download(job.getOriginalVideoUrl(), workDir));
        artifacts.track(download.file());

        enter(jobId, JobStatus.EXTRACTING_AUDIO);
        Path audio = artifacts.track(call(JobStatus.EXTRACTING_AUDIO, () -> audioExtractor.extract(download.file())));

        Path voiceTrack = audio;
        Path backgroundTrack = null;
        if (options.keepBackgroundAudio()) {
            enter(jobId, JobStatus.SEPARATING_AUDIO);
            SourceSeparator.Result separated = call(JobStatus.SEPARATING_AUDIO, () -> sourceSeparator.separate(audio));
            voiceTrack = artifacts.track(separated.voice());
            backgroundTrack = artifacts.track(separated.music());
        }

        enter(jobId, JobStatus.TRANSCRIBING);
        Path speech = voiceTrack;
        Transcriber.Result transcript = call(JobStatus.TRANSCRIBING, () -> transcriber.transcribe(speech, options.sourceLang()));
        if (transcript.text() == null || transcript.text().isBlank()) {
            throw new PermanentStageException(JobStatus.TRANSCRIBING, "No speech detected in source video");
        }

        enter(jobId, JobStatus.TRANSLATING);
        String translated = call(JobStatus.TRANSLATING,
                () -> translator.translate(transcript.text(), options.sourceLang(), options.targetLang()));
        if (translated == null || translated.isBlank()) {
            throw new TransientStageException(JobStatus.TRANSLATING, "Translator returned empty text", null);
        }

        enter(jobId, JobStatus.GENERATING_VOICE);
        AudioMeta.TtsConfig tts = new AudioMeta.TtsConfig(options.ttsVoice().id(), properties.getTtsSpeed(), properties.getTtsPitch());
        Path synthesized = artifacts.track(call(JobStatus.GENERATING_VOICE, () -> voiceSynthesizer.synthesize(
                new VoiceSynthesizer.Request(translated, options.ttsVoice(), transcript.segments(), tts.speed(), tts.pitch(), workDir))));

        enter(jobId, JobStatus.MIXING_AUDIO);
        Path music = backgroundTrack;
        Path mixed = artifacts.track(call(JobStatus.MIXING_AUDIO, () -> audioMixer.mix(synthesized, music, properties.getDuckingDb())));

        enter(jobId, JobStatus.ENCODING_VIDEO);
        VideoQuality quality = options.quality();
        Path encoded = artifacts.track(call(JobStatus.ENCODING_VIDEO, () -> videoEncoder.encode(download.file(), mixed, quality)));

        StreamPackager.Result hls = null;
        if (options.hlsRequested()) {
            enter(jobId, JobStatus.GENERATING_HLS);
            hls = call(JobStatus.GENERATING_HLS, () -> streamPackager.packageHls(encoded));
            artifacts.track(hls.directory());
        }

        Path thumbnail = extractThumbnail(jobId, encoded, artifacts);

        enter(jobId, JobStatus.UPLOADING);
        List<String> uploadedKeys = new ArrayList<>();
        StreamPackager.Result packaged = hls;
        Uploads uploads = call(JobStatus.UPLOADING, () -> upload(sourceId, encoded, thumbnail, packaged,
                options.subtitlesRequested() ? transcript : null, translated, download.durationSec(), workDir, uploadedKeys));

        long sizeBytes = call(JobStatus.UPLOADING, () -> Files.size(encoded));
        double duration = download.durationSec() > 0 ? download.durationSec() : transcript.durationSec();
        VideoMeta videoMeta = new VideoMeta(duration, quality.resolution(), sizeBytes, VIDEO_FORMAT);
        AudioMeta audioMeta = new AudioMeta(transcript.text(), translated, tts, transcript.segments());
        long processingTimeSec = Math.max(0, (clock.millis() - t0) / 1000);

        JobService.Completion completion = new JobService.Completion(
                uploads.videoUrl(), uploads.playlistUrl(), uploads.subtitlesUrl(), uploads.thumbnailUrl(),
                videoMeta, audioMeta, processingTimeSec);
        if (!jobService.complete(jobId, completion)) {
            if (jobService.isLatestForSource(sourceId, jobId)) {
                discardUploads(jobId, uploadedKeys);
            } else {
                LOGGER.info("Job superseded, keeping the newer job's uploads jobId={} sourceId={}", jobId, sourceId);
            }
            throw new JobCancelledException(jobId);
        }
        LOGGER.info("JOB COMPLETED jobId={} sourceId={} video={} processingTimeSec={}", jobId, sourceId, uploads.videoUrl(), processingTimeSec);
        return completion;
    }

    record Uploads(String videoUrl, String thumbnailUrl, String playlistUrl, String subtitlesUrl) {}

    private Uploads upload(UUID sourceId,
                           Path video,
                           Path thumbnail,
                           StreamPackager.Result hls,
                           Transcriber.Result transcriptForSubtitles,
                           String translated,
                           double durationSec,
                           Path workDir,
                           List<String> uploadedKeys) throws IOException {
        String videoUrl = put(AssetKind.DUBBED_VIDEO, AssetKind.DUBBED_VIDEO.key(sourceId), video, uploadedKeys);

        String thumbnailUrl = null;
        if (thumbnail != null) {
            thumbnailUrl = put(AssetKind.THUMBNAIL, AssetKind.THUMBNAIL.key(sourceId), thumbnail, uploadedKeys);
        }

        String subtitlesUrl = null;
        if (transcriptForSubtitles != null) {
            Path vtt = subtitleWriter.write(transcriptForSubtitles.segments(), translated, durationSec, workDir.resolve("subtitles.vtt"));
            subtitlesUrl = put(AssetKind.SUBTITLES, AssetKind.SUBTITLES.key(sourceId), vtt, uploadedKeys);
        }

        String playlistUrl = null;
        if (hls != null) {
            for (Path segment : hls.segments()) {
                put(AssetKind.HLS_SEGMENT, AssetKind.hlsSegmentKey(sourceId, segment.getFileName().toString()), segment, uploadedKeys);
            }
            playlistUrl = put(AssetKind.HLS_PLAYLIST, AssetKind.HLS_PLAYLIST.key(sourceId), hls.playlist(), uploadedKeys);
        }
        return new Uploads(videoUrl, thumbnailUrl, playlistUrl, subtitlesUrl);
    }

    private String put(AssetKind kind, String key, Path file, List<String> uploadedKeys) {
        String url = objectStore.put(key, file, kind.contentType(), kind.headers());
        uploadedKeys.add(key);
        return url;
    }

    private Path extractThumbnail(UUID jobId, Path video, StageArtifacts artifacts) {
        try {
            return artifacts.track(thumbnailExtractor.extractThumbnail(video, properties.getThumbnailAtSeconds()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStageException(JobStatus.ENCODING_VIDEO, "Interrupted while extracting thumbnail", e);
        } catch (Exception e) {
            LOGGER.warn("Thumbnail extraction failed, continuing without jobId={} error={}", jobId, e.toString());
            return null;
        }
    }

    private void discardUploads(UUID jobId, List<String> keys) {
        for (String key : keys) {
            try {
                objectStore.delete(key);
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to discard upload of cancelled job jobId={} key={} error={}", jobId, key, e.toString());
            }
        }
    }

    private void enter(UUID jobId, JobStatus stage) {
        if (!jobService.advance(jobId, stage)) {
            LOGGER.info("Job no longer active, stopping jobId={} before={}", jobId, stage);
            throw new JobCancelledException(jobId);
        }
        LOGGER.info("STAGE jobId={} stage={} progress={}", jobId, stage, stage.checkpoint());
    }

    static <T> T call(JobStatus stage, StageCall<T> call) {
        try {
            return call.run();
        } catch (StageException | JobCancelledException e) {
            throw e;
        } catch (UnsupportedInputException e) {
            throw new PermanentStageException(stage, e.getMessage(), e);
        } catch (ToolTimeoutException e) {
            throw new StageTimeoutException(stage, e.getLimit(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStageException(stage, stage.name() + " interrupted", e);
        } catch (Exception e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            throw new TransientStageException(stage, message, e);
        }
    }
}
