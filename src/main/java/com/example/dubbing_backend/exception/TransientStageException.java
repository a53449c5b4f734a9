package com.example.dubbing_backend.exception;

import com.example.dubbing_backend.util.JobStatus;

public class TransientStageException extends StageException {
    public TransientStageException(JobStatus stage, String message, Throwable cause) {
        super(stage, message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
