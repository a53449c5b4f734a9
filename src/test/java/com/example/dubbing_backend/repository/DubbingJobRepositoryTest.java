package com.example.dubbing_backend.repository;

import com.example.dubbing_backend.dto.DubbingOptions;
import com.example.dubbing_backend.model.DubbingJob;
import com.example.dubbing_backend.model.SourceVideo;
import com.example.dubbing_backend.util.JobStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.Sort;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class DubbingJobRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private DubbingJobRepository jobRepository;

    @Autowired
    private SourceVideoRepository sourceRepository;

    private UUID sourceId;

    @BeforeEach
    void setUp() {
        sourceId = sourceRepository.saveAndFlush(new SourceVideo("demo", "https://cdn.example.com/a.mp4")).getId();
    }

    private DubbingJob newJob(Instant queuedAt) {
        DubbingJob job = new DubbingJob(sourceId, "https://cdn.example.com/a.mp4", DubbingOptions.defaults().normalized("zh"), queuedAt);
        return jobRepository.saveAndFlush(job);
    }

    @Test
    void progressNeverMovesBackwards() {
        UUID id = newJob(T0).getId();

        assertThat(jobRepository.advance(id, JobStatus.TRANSCRIBING, "TRANSCRIBING", 30, false, T0, JobStatus.ACTIVE)).isEqualTo(1);
        assertThat(jobRepository.advance(id, JobStatus.DOWNLOADING, "DOWNLOADING", 10, true, T0.plusSeconds(5), JobStatus.ACTIVE)).isEqualTo(1);

        DubbingJob reloaded = jobRepository.findById(id).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(JobStatus.DOWNLOADING);
        assertThat(reloaded.getCurrentStep()).isEqualTo("DOWNLOADING");
        assertThat(reloaded.getProgress()).isEqualTo(30);
        assertThat(reloaded.getStartedAt()).isEqualTo(T0.plusSeconds(5));
    }

    @Test
    void failedJobIsFrozenAgainstLateWorkerWrites() {
        UUID id = newJob(T0).getId();

        assertThat(jobRepository.markFailed(id, "Job cancelled by user", null, T0, JobStatus.ACTIVE)).isEqualTo(1);
        assertThat(jobRepository.advance(id, JobStatus.UPLOADING, "UPLOADING", 90, false, T0, JobStatus.ACTIVE)).isZero();
        assertThat(jobRepository.recordFailedAttempt(id, "late", T0, JobStatus.ACTIVE)).isZero();
        assertThat(jobRepository.markFailed(id, "late failure", "trace", T0, JobStatus.ACTIVE)).isZero();

        DubbingJob reloaded = jobRepository.findById(id).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(reloaded.getErrorMessage()).isEqualTo("Job cancelled by user");
        assertThat(reloaded.getProgress()).isZero();
    }

    @Test
    void failedAttemptsStopCountingAtMaxRetries() {
        UUID id = newJob(T0).getId();

        for (int i = 0; i < 5; i++) {
            jobRepository.recordFailedAttempt(id, "boom " + i, T0, JobStatus.ACTIVE);
        }

        DubbingJob reloaded = jobRepository.findById(id).orElseThrow();
        assertThat(reloaded.getRetryCount()).isEqualTo(reloaded.getMaxRetries());
        assertThat(reloaded.getErrorMessage()).isEqualTo("boom 4");
        assertThat(reloaded.getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void rearmOnlyAppliesToFailedJobs() {
        UUID id = newJob(T0).getId();
        assertThat(jobRepository.rearmFailed(id, T0)).isZero();

        jobRepository.advance(id, JobStatus.TRANSLATING, "TRANSLATING", 50, true, T0, JobStatus.ACTIVE);
        jobRepository.markFailed(id, "translator down", "trace", T0.plusSeconds(10), JobStatus.ACTIVE);
        assertThat(jobRepository.rearmFailed(id, T0.plusSeconds(60))).isEqualTo(1);

        DubbingJob reloaded = jobRepository.findById(id).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(reloaded.getProgress()).isZero();
        assertThat(reloaded.getCurrentStep()).isNull();
        assertThat(reloaded.getStartedAt()).isNull();
        assertThat(reloaded.getFailedAt()).isNull();
        assertThat(reloaded.getErrorMessage()).isNull();
        assertThat(reloaded.getRetryCount()).isEqualTo(1);
        assertThat(reloaded.getQueuedAt()).isEqualTo(T0.plusSeconds(60));
    }

    @Test
    void latestJobIsTheMostRecentlyQueued() {
        UUID older = newJob(T0).getId();
        jobRepository.markFailed(older, "Job cancelled by user", null, T0.plusSeconds(10), JobStatus.ACTIVE);
        DubbingJob newer = newJob(T0.plusSeconds(30));

        assertThat(jobRepository.findTopBySourceVideoIdOrderByQueuedAtDesc(sourceId))
                .get().extracting(DubbingJob::getId).isEqualTo(newer.getId());
    }

    @Test
    void offsetPagingSkipsRows() {
        for (int i = 0; i < 5; i++) {
            newJob(T0.plusSeconds(i));
        }

        var page = jobRepository.findAll(new OffsetPageRequest(3, 10, Sort.by(Sort.Direction.DESC, "queuedAt")));

        assertThat(page.getTotalElements()).isEqualTo(5);
        assertThat(page.getContent()).hasSize(2);
        assertThat(page.getContent().get(0).getQueuedAt()).isEqualTo(T0.plusSeconds(1));
    }
}
