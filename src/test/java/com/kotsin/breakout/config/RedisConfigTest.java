package com.kotsin.breakout.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class RedisConfigTest {

    @Test
    @DisplayName("The session template writes string keys and values and configures nothing for hashes")
    void sessionTemplate() {
        RedisConnectionFactory factory = mock(RedisConnectionFactory.class);
        RedisTemplate<String, String> template = new RedisConfig().sessionStringRedisTemplate(factory);
        template.afterPropertiesSet();

        assertSame(factory, template.getConnectionFactory());
        assertInstanceOf(StringRedisSerializer.class, template.getKeySerializer());
        assertInstanceOf(StringRedisSerializer.class, template.getValueSerializer());
        assertNull(template.getHashKeySerializer());
        assertNull(template.getHashValueSerializer());
    }
}
