package com.example.dubbing_backend.service;

import com.example.dubbing_backend.dto.AudioMeta;
import com.example.dubbing_backend.dto.DubbingOptions;
import com.example.dubbing_backend.dto.VideoMeta;
import com.example.dubbing_backend.engine.Interfaces.Transcriber;
import com.example.dubbing_backend.model.DubbingJob;
import com.example.dubbing_backend.model.SourceVideo;
import com.example.dubbing_backend.repository.DubbingJobRepository;
import com.example.dubbing_backend.repository.SourceVideoRepository;
import com.example.dubbing_backend.util.JobStatus;
import com.example.dubbing_backend.util.VideoStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class JobServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private DubbingJobRepository jobRepository;

    @Autowired
    private SourceVideoRepository sourceRepository;

    @Autowired
    private TestEntityManager entityManager;

    private JobService jobService;
    private UUID sourceId;

    @BeforeEach
    void setUp() {
        jobService = new JobService(jobRepository, sourceRepository, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
        SourceVideo source = new SourceVideo("demo", "https://cdn.example.com/a.mp4");
        sourceId = sourceRepository.saveAndFlush(source).getId();
        sourceRepository.claimForQueue(sourceId, NOW, VideoStatus.ACTIVE);
    }

    private UUID newJob() {
        return jobService.create(sourceId, "https://cdn.example.com/a.mp4", DubbingOptions.defaults().normalized("zh"), 3).getId();
    }

    private JobService.Completion completion() {
        return new JobService.Completion(
                "http://localhost:8080/files/videos/dubbed/x.mp4",
                null,
                "http://localhost:8080/files/videos/subtitles/x.vtt",
                null,
                new VideoMeta(12.5, "1280x720", 2048, "mp4"),
                new AudioMeta("你好", "xin chào", new AudioMeta.TtsConfig("vi-female-1", 1.0, 1.0),
                        List.of(new Transcriber.Segment(0, 0.0, 1.2, "你好"))),
                42);
    }

    @Test
    void enteringDownloadStartsTheJobAndMirrorsProcessing() {
        UUID jobId = newJob();

        assertThat(jobService.advance(jobId, JobStatus.DOWNLOADING)).isTrue();

        DubbingJob job = jobRepository.findById(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.DOWNLOADING);
        assertThat(job.getProgress()).isEqualTo(10);
        assertThat(job.getStartedAt()).isEqualTo(NOW);
        assertThat(sourceRepository.findById(sourceId).orElseThrow().getVideoStatus()).isEqualTo(VideoStatus.PROCESSING);
    }

    @Test
    void advanceRejectsNonStageStatuses() {
        UUID jobId = newJob();

        assertThatThrownBy(() -> jobService.advance(jobId, JobStatus.COMPLETED)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> jobService.advance(jobId, JobStatus.QUEUED)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void completeWritesResultsOntoJobAndSource() {
        UUID jobId = newJob();
        jobService.advance(jobId, JobStatus.DOWNLOADING);
        jobService.advance(jobId, JobStatus.UPLOADING);

        assertThat(jobService.complete(jobId, completion())).isTrue();
        entityManager.flush();
        entityManager.clear();

        DubbingJob job = jobRepository.findById(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getProgress()).isEqualTo(100);
        assertThat(job.getCompletedAt()).isEqualTo(NOW);
        assertThat(job.getProcessingTimeSec()).isEqualTo(42L);
        assertThat(job.getVideoMeta()).containsEntry("resolution", "1280x720");
        assertThat(job.getAudioMeta()).containsEntry("translation", "xin chào");

        SourceVideo source = sourceRepository.findById(sourceId).orElseThrow();
        assertThat(source.getVideoStatus()).isEqualTo(VideoStatus.COMPLETED);
        assertThat(source.getDubbedVideoUrl()).endsWith("/videos/dubbed/x.mp4");
        assertThat(source.getSubtitlesUrl()).endsWith(".vtt");
        assertThat(source.getHlsPlaylistUrl()).isNull();
        assertThat(source.getVideoProcessedAt()).isEqualTo(NOW);
    }

    @Test
    void completionAfterCancelIsRefused() {
        UUID jobId = newJob();
        jobService.advance(jobId, JobStatus.DOWNLOADING);

        assertThat(jobService.forceCancelled(jobId)).isTrue();
        assertThat(jobService.complete(jobId, completion())).isFalse();
        assertThat(jobService.advance(jobId, JobStatus.EXTRACTING_AUDIO)).isFalse();

        DubbingJob job = jobRepository.findById(jobId).orElseThrow();
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorMessage()).isEqualTo(JobService.CANCELLED_MESSAGE);
        assertThat(job.getDubbedVideoUrl()).isNull();
    }

    @Test
    void regeneratedJobTakesOverTheSource() {
        UUID cancelled = newJob();
        jobService.forceCancelled(cancelled);
        assertThat(jobService.isLatestForSource(sourceId, cancelled)).isTrue();

        DubbingJob replacement = jobRepository.saveAndFlush(new DubbingJob(sourceId, "https://cdn.example.com/a.mp4",
                DubbingOptions.defaults().normalized("zh"), NOW.plusSeconds(60)));

        assertThat(jobService.isLatestForSource(sourceId, cancelled)).isFalse();
        assertThat(jobService.isLatestForSource(sourceId, replacement.getId())).isTrue();
    }

    @Test
    void markFailedMirrorsOntoSourceOnlyOnce() {
        UUID jobId = newJob();

        assertThat(jobService.markFailed(jobId, "x".repeat(2500), "trace")).isTrue();
        assertThat(jobService.markFailed(jobId, "again", null)).isFalse();

        DubbingJob job = jobRepository.findById(jobId).orElseThrow();
        assertThat(job.getErrorMessage()).hasSize(2000);
        assertThat(job.getFailedAt()).isEqualTo(NOW);
        assertThat(sourceRepository.findById(sourceId).orElseThrow().getVideoStatus()).isEqualTo(VideoStatus.FAILED);
    }

    @Test
    void recordFailedAttemptIsEmptyOnceTheJobIsTerminal() {
        UUID jobId = newJob();

        assertThat(jobService.recordFailedAttempt(jobId, "boom")).get()
                .extracting(DubbingJob::getRetryCount).isEqualTo(1);

        jobService.forceCancelled(jobId);
        assertThat(jobService.recordFailedAttempt(jobId, "boom")).isEmpty();
    }
}
