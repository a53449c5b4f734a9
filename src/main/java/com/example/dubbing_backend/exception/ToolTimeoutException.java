package com.example.dubbing_backend.exception;

import java.time.Duration;

/** An external command was killed after exceeding its deadline. */
public class ToolTimeoutException extends RuntimeException {
    private final Duration limit;

    public ToolTimeoutException(String tool, Duration limit) {
        super(tool + " timed out after " + limit.toSeconds() + "s");
        this.limit = limit;
    }

    public Duration getLimit() {
        return limit;
    }
}
