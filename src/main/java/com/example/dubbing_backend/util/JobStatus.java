package com.example.dubbing_backend.util;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a dubbing job. Pipeline stages carry the fixed progress checkpoint
 * that is persisted when the stage starts.
 */
public enum JobStatus {
    QUEUED(0),
    DOWNLOADING(10),
    EXTRACTING_AUDIO(20),
    SEPARATING_AUDIO(25),
    TRANSCRIBING(30),
    TRANSLATING(50),
    GENERATING_VOICE(60),
    MIXING_AUDIO(70),
    ENCODING_VIDEO(80),
    GENERATING_HLS(85),
    UPLOADING(90),
    COMPLETED(100),
    FAILED(-1),
    CANCELLED(-1);

    public static final Set<JobStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);
    public static final Set<JobStatus> ACTIVE = EnumSet.range(QUEUED, UPLOADING);

    private final int checkpoint;

    JobStatus(int checkpoint) {
        this.checkpoint = checkpoint;
    }

    /** Progress percentage bound to this stage; negative for failure states. */
    public int checkpoint() {
        return checkpoint;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public boolean isActive() {
        return !isTerminal();
    }

    /** True once a worker has picked the job up and it has not finished yet. */
    public boolean isStarted() {
        return isActive() && this != QUEUED;
    }
}
