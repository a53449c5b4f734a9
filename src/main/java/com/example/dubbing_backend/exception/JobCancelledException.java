package com.example.dubbing_backend.exception;

import java.util.UUID;

/** The job was finalized by someone else while this attempt was still running. */
public class JobCancelledException extends RuntimeException {
    private final UUID jobId;

    public JobCancelledException(UUID jobId) {
        super("Job " + jobId + " is no longer active");
        this.jobId = jobId;
    }

    public UUID getJobId() {
        return jobId;
    }
}
