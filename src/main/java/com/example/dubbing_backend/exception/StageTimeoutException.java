package com.example.dubbing_backend.exception;

import com.example.dubbing_backend.util.JobStatus;

import java.time.Duration;

public class StageTimeoutException extends TransientStageException {
    private final Duration limit;

    public StageTimeoutException(JobStatus stage, Duration limit, Throwable cause) {
        super(stage, stage.name() + " timed out after " + limit.toSeconds() + "s", cause);
        this.limit = limit;
    }

    public Duration getLimit() {
        return limit;
    }
}
