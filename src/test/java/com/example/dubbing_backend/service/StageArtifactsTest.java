package com.example.dubbing_backend.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class StageArtifactsTest {

    @TempDir
    Path root;

    @Test
    void openCreatesPerAttemptDirectory() throws Exception {
        UUID jobId = UUID.randomUUID();

        StageArtifacts first = StageArtifacts.open(jobId, root);
        StageArtifacts second = StageArtifacts.open(jobId, root);

        assertThat(first.workDir()).isDirectory();
        assertThat(first.workDir().getFileName().toString()).startsWith(jobId + "-");
        assertThat(first.workDir()).isNotEqualTo(second.workDir());
        first.close();
        second.close();
    }

    @Test
    void closeRemovesEverythingTracked() throws Exception {
        Path outside = Files.writeString(root.resolve("encoded.mp4"), "x");
        StageArtifacts artifacts = StageArtifacts.open(UUID.randomUUID(), root);
        Path nested = Files.createDirectories(artifacts.workDir().resolve("hls"));
        Files.writeString(nested.resolve("segment_000.ts"), "ts");

        assertThat(artifacts.track(outside)).isEqualTo(outside);
        assertThat(artifacts.track(null)).isNull();
        artifacts.track(outside);
        assertThat(artifacts.tracked()).hasSize(2);

        artifacts.close();

        assertThat(root).isEmptyDirectory();
        assertThat(artifacts.tracked()).isEmpty();
    }

    @Test
    void cleanupFailureIsLoggedAndDoesNotStopTheRest() throws Exception {
        FileSystem zip = FileSystems.newFileSystem(root.resolve("broken.zip"), Map.of("create", "true"));
        Path unreachable = zip.getPath("/gone.wav");
        zip.close();

        Logger logger = (Logger) org.slf4j.LoggerFactory.getLogger(StageArtifacts.class);
        ListAppender<ILoggingEvent> listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);

        try {
            UUID jobId = UUID.randomUUID();
            StageArtifacts artifacts = StageArtifacts.open(jobId, root);
            Path audio = Files.writeString(artifacts.workDir().resolve("audio.wav"), "pcm");
            artifacts.track(audio);
            artifacts.track(unreachable);

            artifacts.close();

            assertThat(audio).doesNotExist();
            assertThat(artifacts.workDir()).doesNotExist();
            List<String> warnMessages = listAppender.list.stream()
                    .filter(event -> event.getLevel() == Level.WARN)
                    .map(ILoggingEvent::getFormattedMessage)
                    .toList();
            assertThat(warnMessages).anyMatch(msg -> msg.startsWith("Temp cleanup failed jobId=" + jobId));
        } finally {
            logger.detachAppender(listAppender);
            listAppender.stop();
        }
    }
}
