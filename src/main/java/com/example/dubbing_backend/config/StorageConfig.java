package com.example.dubbing_backend.config;

import com.example.dubbing_backend.service.Interfaces.ObjectStore;
import com.example.dubbing_backend.service.LocalObjectStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@EnableConfigurationProperties(StorageProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public ObjectStore objectStore(StorageProperties properties, ObjectMapper objectMapper) {
        Path base = Path.of(properties.getLocal().getBaseDir());
        var store = new LocalObjectStore(base, properties.getPublicBaseUrl(), objectMapper);
        LoggerFactory.getLogger(StorageConfig.class)
                .info("Object store wired: base={}, publicBaseUrl={}, workDir={}", base, properties.getPublicBaseUrl(), properties.getWorkDir());
        return store;
    }
}
