package com.example.dubbing_backend.engine;

import com.example.dubbing_backend.exception.ToolTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;

/**
 * Runs external media tools (ffmpeg, yt-dlp, whisper, piper) with a hard deadline.
 */
@Component
public class ProcessRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessRunner.class);
    private static final int LOG_SNIPPET_MAX = 4_000;

    public record ProcessResult(int code, String output, boolean timedOut) {
        public boolean ok() {
            return !timedOut && code == 0;
        }
    }

    public ProcessResult run(List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        return run(cmd, timeout, null);
    }

    /**
     * @param stdin file fed to the process' standard input, or {@code null}.
     */
    public ProcessResult run(List<String> cmd, Duration timeout, Path stdin) throws IOException, InterruptedException {
        LOGGER.debug("PROC START cmd={}", cmd);
        ProcessBuilder builder = new ProcessBuilder(cmd).redirectErrorStream(true);
        if (stdin != null) {
            builder.redirectInput(stdin.toFile());
        }
        Process p = builder.start();
        StringJoiner joiner = new StringJoiner(System.lineSeparator());
        Thread reader = new Thread(() -> {
            try (var buffered = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = buffered.readLine()) != null) {
                    synchronized (joiner) {
                        joiner.add(line);
                    }
                }
            } catch (IOException e) {
                LOGGER.debug("PROC output stream closed early cmd={} error={}", cmd.get(0), e.toString());
            }
        }, "proc-reader");
        reader.setDaemon(true);
        reader.start();

        boolean finished;
        try {
            finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            throw e;
        }
        if (!finished) {
            p.destroyForcibly();
            p.waitFor(5, TimeUnit.SECONDS);
        }
        reader.join(TimeUnit.SECONDS.toMillis(5));
        int code = finished ? p.exitValue() : -1;
        String output;
        synchronized (joiner) {
            output = joiner.toString();
        }
        return new ProcessResult(code, output, !finished);
    }

    /**
     * Runs {@code cmd} and fails unless it exits with 0.
     *
     * @throws ToolTimeoutException when the deadline passed and the process was killed.
     * @throws IllegalStateException on a non-zero exit code.
     */
    public String runChecked(String tool, List<String> cmd, Duration timeout) throws IOException, InterruptedException {
        return runChecked(tool, cmd, timeout, null);
    }

    public String runChecked(String tool, List<String> cmd, Duration timeout, Path stdin) throws IOException, InterruptedException {
        ProcessResult result = run(cmd, timeout, stdin);
        if (result.timedOut()) {
            LOGGER.warn("PROC TIMEOUT tool={} after={}s log={}", tool, timeout.toSeconds(), truncate(result.output()));
            throw new ToolTimeoutException(tool, timeout);
        }
        if (result.code() != 0) {
            throw new IllegalStateException(tool + " exit=" + result.code() + " log=" + truncate(result.output()));
        }
        return result.output();
    }

    static String truncate(String output) {
        if (output == null || output.isBlank()) {
            return "<no output>";
        }
        if (output.length() <= LOG_SNIPPET_MAX) {
            return output;
        }
        return output.substring(output.length() - LOG_SNIPPET_MAX);
    }
}
