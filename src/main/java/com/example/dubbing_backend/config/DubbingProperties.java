package com.example.dubbing_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Job admission and retry policy.
 */
@ConfigurationProperties(prefix = "dubbing")
public class DubbingProperties {

    private int maxRetries = 3;
    private long backoffBaseMs = 5_000;
    private long backoffMaxMs = 300_000;
    private long estimatedProcessingSeconds = 300;
    private String defaultSourceLang = "zh";
    private double thumbnailAtSeconds = 1.0;
    private double ttsSpeed = 1.0;
    private double ttsPitch = 1.0;
    /**
     * Gain applied to the background track under the dubbed voice, in dB.
     */
    private double duckingDb = -6.0;

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getBackoffBaseMs() {
        return backoffBaseMs;
    }

    public void setBackoffBaseMs(long backoffBaseMs) {
        this.backoffBaseMs = backoffBaseMs;
    }

    public long getBackoffMaxMs() {
        return backoffMaxMs;
    }

    public void setBackoffMaxMs(long backoffMaxMs) {
        this.backoffMaxMs = backoffMaxMs;
    }

    public long getEstimatedProcessingSeconds() {
        return estimatedProcessingSeconds;
    }

    public void setEstimatedProcessingSeconds(long estimatedProcessingSeconds) {
        this.estimatedProcessingSeconds = estimatedProcessingSeconds;
    }

    public String getDefaultSourceLang() {
        return defaultSourceLang;
    }

    public void setDefaultSourceLang(String defaultSourceLang) {
        this.defaultSourceLang = defaultSourceLang;
    }

    public double getThumbnailAtSeconds() {
        return thumbnailAtSeconds;
    }

    public void setThumbnailAtSeconds(double thumbnailAtSeconds) {
        this.thumbnailAtSeconds = thumbnailAtSeconds;
    }

    public double getTtsSpeed() {
        return ttsSpeed;
    }

    public void setTtsSpeed(double ttsSpeed) {
        this.ttsSpeed = ttsSpeed;
    }

    public double getTtsPitch() {
        return ttsPitch;
    }

    public void setTtsPitch(double ttsPitch) {
        this.ttsPitch = ttsPitch;
    }

    public double getDuckingDb() {
        return duckingDb;
    }

    public void setDuckingDb(double duckingDb) {
        this.duckingDb = duckingDb;
    }
}
