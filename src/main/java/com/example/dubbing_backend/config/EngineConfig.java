package com.example.dubbing_backend.config;

import com.example.dubbing_backend.engine.FfmpegAudioEngine;
import com.example.dubbing_backend.engine.FfmpegVideoEncoder;
import com.example.dubbing_backend.engine.HttpTranslator;
import com.example.dubbing_backend.engine.Interfaces.Downloader;
import com.example.dubbing_backend.engine.Interfaces.Transcriber;
import com.example.dubbing_backend.engine.Interfaces.Translator;
import com.example.dubbing_backend.engine.Interfaces.VoiceSynthesizer;
import com.example.dubbing_backend.engine.PiperVoiceSynthesizer;
import com.example.dubbing_backend.engine.ProcessRunner;
import com.example.dubbing_backend.engine.UrlVideoDownloader;
import com.example.dubbing_backend.engine.WhisperCliTranscriber;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Wires the default engine implementations. {@link FfmpegAudioEngine} serves extraction, separation
 * and mixing; {@link FfmpegVideoEncoder} serves encoding, HLS packaging and thumbnails.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    @Bean
    public Downloader downloader(ProcessRunner runner, EngineProperties props, ObjectMapper objectMapper) {
        return new UrlVideoDownloader(runner, props, objectMapper);
    }

    @Bean
    public FfmpegAudioEngine ffmpegAudioEngine(ProcessRunner runner, EngineProperties props) {
        return new FfmpegAudioEngine(runner, props);
    }

    @Bean
    public Transcriber transcriber(ProcessRunner runner, EngineProperties props, ObjectMapper objectMapper) {
        return new WhisperCliTranscriber(runner, props, objectMapper);
    }

    @Bean
    public Translator translator(@Qualifier("translatorWebClient") WebClient client, TranslatorProperties props) {
        return new HttpTranslator(client, props);
    }

    @Bean
    public VoiceSynthesizer voiceSynthesizer(ProcessRunner runner, EngineProperties props) {
        return new PiperVoiceSynthesizer(runner, props);
    }

    @Bean
    public FfmpegVideoEncoder ffmpegVideoEncoder(ProcessRunner runner, EngineProperties props) {
        return new FfmpegVideoEncoder(runner, props);
    }
}
