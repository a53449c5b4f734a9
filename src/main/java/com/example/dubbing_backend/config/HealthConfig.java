package com.example.dubbing_backend.config;

import com.example.dubbing_backend.engine.ProcessRunner;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.List;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator ffmpegHealth(ProcessRunner runner, EngineProperties props) {
        return () -> {
            try {
                var result = runner.run(List.of(props.getFfmpegBin(), "-version"), Duration.ofSeconds(10));
                if (result.ok()) return Health.up().withDetail("ffmpeg", "ok").build();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                return Health.down(e).withDetail("ffmpeg", "missing").build();
            }
            return Health.down().withDetail("ffmpeg", "missing").build();
        };
    }

    @Bean
    public HealthIndicator translatorHealth(@Qualifier("translatorWebClient") WebClient translator) {
        return () -> {
            try {
                translator.head().uri("/")
                        .retrieve()
                        .toBodilessEntity()
                        .block(Duration.ofSeconds(2));
                return Health.up().withDetail("translator", "ok").build();
            } catch (Exception e) {
                return Health.down(e).withDetail("translator", "unreachable").build();
            }
        };
    }
}
