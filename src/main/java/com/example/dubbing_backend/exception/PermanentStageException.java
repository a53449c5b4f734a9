package com.example.dubbing_backend.exception;

import com.example.dubbing_backend.util.JobStatus;

/** Input that will fail the same way on every delivery. */
public class PermanentStageException extends StageException {
    public PermanentStageException(JobStatus stage, String message, Throwable cause) {
        super(stage, message, cause);
    }

    public PermanentStageException(JobStatus stage, String message) {
        this(stage, message, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
