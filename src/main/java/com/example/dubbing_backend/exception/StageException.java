package com.example.dubbing_backend.exception;

import com.example.dubbing_backend.util.JobStatus;

/**
 * Failure of one pipeline stage. Subclasses tell the worker whether another delivery can help.
 */
public abstract class StageException extends RuntimeException {
    private final JobStatus stage;

    protected StageException(JobStatus stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public JobStatus getStage() {
        return stage;
    }

    public abstract boolean isRetryable();
}
