package com.example.dubbing_backend.engine;

import com.example.dubbing_backend.exception.ToolTimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRunnerTest {

    private final ProcessRunner runner = new ProcessRunner();

    @Test
    void capturesCombinedOutput() throws Exception {
        ProcessRunner.ProcessResult result = runner.run(List.of("sh", "-c", "echo out; echo err 1>&2"), Duration.ofSeconds(10));

        assertThat(result.ok()).isTrue();
        assertThat(result.output()).contains("out").contains("err");
    }

    @Test
    void feedsStdinFromFile(@TempDir Path tmp) throws Exception {
        Path input = Files.writeString(tmp.resolve("text.txt"), "xin chào");

        String output = runner.runChecked("cat", List.of("cat"), Duration.ofSeconds(10), input);

        assertThat(output).isEqualTo("xin chào");
    }

    @Test
    void nonZeroExitFails() {
        assertThatThrownBy(() -> runner.runChecked("sh", List.of("sh", "-c", "echo broken; exit 3"), Duration.ofSeconds(10)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("exit=3")
                .hasMessageContaining("broken");
    }

    @Test
    void slowProcessIsKilledAtTheDeadline() {
        assertThatThrownBy(() -> runner.runChecked("sleep", List.of("sleep", "5"), Duration.ofMillis(200)))
                .isInstanceOfSatisfying(ToolTimeoutException.class,
                        e -> assertThat(e.getLimit()).isEqualTo(Duration.ofMillis(200)));
    }

    @Test
    void truncateKeepsTheTail() {
        String longOutput = "a".repeat(5_000) + "tail";

        assertThat(ProcessRunner.truncate(longOutput)).hasSize(4_000).endsWith("tail");
        assertThat(ProcessRunner.truncate(null)).isEqualTo("<no output>");
    }
}
