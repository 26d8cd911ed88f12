package com.example.mediacatalog_backend.config;

import com.example.mediacatalog_backend.service.Interfaces.ObjectStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HealthConfig {

    @Bean
    public HealthIndicator objectStoreHealth(ObjectStore objectStore) {
        return () -> {
            try {
                if (objectStore.isAvailable()) return Health.up().withDetail("objectStore", "ok").build();
            } catch (RuntimeException e) {
                return Health.down(e).withDetail("objectStore", "error").build();
            }
            return Health.down().withDetail("objectStore", "not writable").build();
        };
    }
}
