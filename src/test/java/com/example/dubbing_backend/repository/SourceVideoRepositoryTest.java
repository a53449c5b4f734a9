package com.example.dubbing_backend.repository;

import com.example.dubbing_backend.model.SourceVideo;
import com.example.dubbing_backend.util.VideoStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class SourceVideoRepositoryTest {

    @Autowired
    private SourceVideoRepository sourceRepository;

    @Test
    void onlyOneAdmissionWinsWhileActive() {
        UUID id = sourceRepository.saveAndFlush(new SourceVideo("demo", "https://cdn.example.com/a.mp4")).getId();
        Instant now = Instant.parse("2026-03-01T10:00:00Z");

        assertThat(sourceRepository.claimForQueue(id, now, VideoStatus.ACTIVE)).isEqualTo(1);
        assertThat(sourceRepository.claimForQueue(id, now, VideoStatus.ACTIVE)).isZero();

        sourceRepository.updateStatus(id, VideoStatus.PROCESSING, now);
        assertThat(sourceRepository.claimForQueue(id, now, VideoStatus.ACTIVE)).isZero();

        sourceRepository.updateStatus(id, VideoStatus.COMPLETED, now);
        assertThat(sourceRepository.claimForQueue(id, now, VideoStatus.ACTIVE)).isEqualTo(1);
        assertThat(sourceRepository.findById(id).orElseThrow().getVideoStatus()).isEqualTo(VideoStatus.QUEUED);
    }

    @Test
    void unknownSourceIsNeverClaimed() {
        assertThat(sourceRepository.claimForQueue(UUID.randomUUID(), Instant.now(), VideoStatus.ACTIVE)).isZero();
    }
}
