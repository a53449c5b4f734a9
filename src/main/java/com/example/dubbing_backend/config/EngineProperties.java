package com.example.dubbing_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Binaries, models and deadlines of the command line tools behind the default engines.
 */
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {
    private String ffmpegBin = "ffmpeg";
    private String ffprobeBin = "ffprobe";
    private String ytdlpBin = "yt-dlp";
    private String whisperBin = "whisper";
    private String whisperModel = "tiny";
    private String piperBin = "piper";
    private String piperModelsDir = "./models/piper";
    /**
     * Optional source separation command. {@code {input}} and {@code {outputDir}} are substituted;
     * it must leave {@code vocals.wav} and {@code no_vocals.wav} in the output directory.
     * Empty means pass-through.
     */
    private List<String> separatorCommand = new ArrayList<>();
    private int hlsSegmentSeconds = 10;
    private Http http = new Http();
    private Timeouts timeouts = new Timeouts();

    public String getFfmpegBin() { return ffmpegBin; }
    public void setFfmpegBin(String ffmpegBin) { this.ffmpegBin = ffmpegBin; }

    public String getFfprobeBin() { return ffprobeBin; }
    public void setFfprobeBin(String ffprobeBin) { this.ffprobeBin = ffprobeBin; }

    public String getYtdlpBin() { return ytdlpBin; }
    public void setYtdlpBin(String ytdlpBin) { this.ytdlpBin = ytdlpBin; }

    public String getWhisperBin() { return whisperBin; }
    public void setWhisperBin(String whisperBin) { this.whisperBin = whisperBin; }

    public String getWhisperModel() { return whisperModel; }
    public void setWhisperModel(String whisperModel) { this.whisperModel = whisperModel; }

    public String getPiperBin() { return piperBin; }
    public void setPiperBin(String piperBin) { this.piperBin = piperBin; }

    public String getPiperModelsDir() { return piperModelsDir; }
    public void setPiperModelsDir(String piperModelsDir) { this.piperModelsDir = piperModelsDir; }

    public List<String> getSeparatorCommand() { return separatorCommand; }
    public void setSeparatorCommand(List<String> separatorCommand) { this.separatorCommand = separatorCommand; }


    public int getHlsSegmentSeconds() { return hlsSegmentSeconds; }
    public void setHlsSegmentSeconds(int hlsSegmentSeconds) { this.hlsSegmentSeconds = hlsSegmentSeconds; }

    public Http getHttp() { return http; }
    public void setHttp(Http http) { this.http = http; }

    public Timeouts getTimeouts() { return timeouts; }
    public void setTimeouts(Timeouts timeouts) { this.timeouts = timeouts; }

    public static class Http {
        private Duration timeout = Duration.ofSeconds(120);
        private String userAgent = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome Safari";
        private int maxRedirects = 5;

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public int getMaxRedirects() { return maxRedirects; }
        public void setMaxRedirects(int maxRedirects) { this.maxRedirects = maxRedirects; }
    }

    public static class Timeouts {
        private Duration download = Duration.ofMinutes(15);
        private Duration probe = Duration.ofSeconds(60);
        private Duration audio = Duration.ofMinutes(10);
        private Duration separation = Duration.ofMinutes(30);
        private Duration transcription = Duration.ofMinutes(60);
        private Duration synthesis = Duration.ofMinutes(15);
        private Duration encoding = Duration.ofMinutes(60);
        private Duration packaging = Duration.ofMinutes(30);

        public Duration getDownload() { return download; }
        public void setDownload(Duration download) { this.download = download; }

        public Duration getProbe() { return probe; }
        public void setProbe(Duration probe) { this.probe = probe; }

        public Duration getAudio() { return audio; }
        public void setAudio(Duration audio) { this.audio = audio; }

        public Duration getSeparation() { return separation; }
        public void setSeparation(Duration separation) { this.separation = separation; }

        public Duration getTranscription() { return transcription; }
        public void setTranscription(Duration transcription) { this.transcription = transcription; }

        public Duration getSynthesis() { return synthesis; }
        public void setSynthesis(Duration synthesis) { this.synthesis = synthesis; }

        public Duration getEncoding() { return encoding; }
        public void setEncoding(Duration encoding) { this.encoding = encoding; }

        public Duration getPackaging() { return packaging; }
        public void setPackaging(Duration packaging) { this.packaging = packaging; }
    }
}
