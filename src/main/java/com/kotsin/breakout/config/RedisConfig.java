package com.kotsin.breakout.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

/**
 * Template for session snapshots, stored as one JSON string value per session date.
 */
@Configuration
public class RedisConfig {

    @Bean
    public RedisTemplate<String, String> sessionStringRedisTemplate(RedisConnectionFactory connectionFactory) {
        RedisTemplate<String, String> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        // snapshots are plain string values; no hash operations, so no hash serializers
        template.setKeySerializer(StringRedisSerializer.UTF_8);
        template.setValueSerializer(StringRedisSerializer.UTF_8);
        template.setEnableDefaultSerializer(false);
        return template;
    }
}
