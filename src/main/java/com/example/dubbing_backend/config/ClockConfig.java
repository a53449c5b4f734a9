package com.example.dubbing_backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Single time source for queue scheduling, job timestamps and completion estimates.
 */
@Configuration
class ClockConfig {
    @Bean
    public Clock dubbingClock(@Value("${dubbing.time-zone:UTC}") String zone) {
        return Clock.system(ZoneId.of(zone));
    }
}
