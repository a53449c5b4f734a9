package com.example.dubbing_backend.util;

import java.util.EnumSet;
import java.util.Set;

/**
 * Denormalized dubbing state shown on the source video.
 */
public enum VideoStatus {
    NONE,
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<VideoStatus> ACTIVE = EnumSet.of(QUEUED, PROCESSING);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }
}
