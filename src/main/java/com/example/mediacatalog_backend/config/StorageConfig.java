package com.example.mediacatalog_backend.config;

import com.example.mediacatalog_backend.service.LocalObjectStore;
import com.example.mediacatalog_backend.service.Interfaces.ObjectStore;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

@EnableConfigurationProperties(ObjectStoreProperties.class)
@Configuration
public class StorageConfig {

    @Bean
    public ObjectStore objectStore(ObjectStoreProperties properties, Clock clock) {
        Path base = Path.of(properties.getBaseDir());
        var store = new LocalObjectStore(base, properties.getPublicBaseUrl(),
                Duration.ofSeconds(properties.getUploadUrlTtlSeconds()), clock);
        LoggerFactory.getLogger(StorageConfig.class)
                .info("Object store wired: base={}, publicBaseUrl={}", base, properties.getPublicBaseUrl());
        return store;
    }
}
