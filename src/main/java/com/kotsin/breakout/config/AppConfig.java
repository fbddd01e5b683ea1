package com.kotsin.breakout.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class AppConfig {

    /**
     * Fill ids already applied by the live engine. Brokers redeliver on reconnect.
     */
    @Bean
    public Cache<String, Boolean> processedFillsCache(
            @Value("${fills.idempotency.max-entries:100000}") long maxEntries) {
        return Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(Duration.ofDays(1))
                .build();
    }
}
