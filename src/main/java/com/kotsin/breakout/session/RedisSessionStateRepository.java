package com.kotsin.breakout.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Session snapshots as JSON strings in Redis.
 *
 * <p>Each save first copies the current value to {@code <key>:backup}, so a write torn by a
 * crash still leaves the previous snapshot readable.
 */
@Slf4j
public class RedisSessionStateRepository implements SessionStateRepository {

    private static final String KEY_PREFIX = "breakout:session:";
    private static final Duration TTL = Duration.ofDays(7);

    private final RedisTemplate<String, String> redis;
    private final ObjectMapper mapper;

    public RedisSessionStateRepository(RedisTemplate<String, String> redis, ObjectMapper mapper) {
        this.redis = redis;
        this.mapper = mapper;
    }

    static String key(LocalDate date) {
        return KEY_PREFIX + date;
    }

    static String backupKey(LocalDate date) {
        return key(date) + ":backup";
    }

    @Override
    public void save(SessionSnapshot snapshot) {
        String json;
        try {
            json = mapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise session snapshot for " + snapshot.getSessionDate(), e);
        }
        String key = key(snapshot.getSessionDate());
        String previous = redis.opsForValue().get(key);
        if (previous != null) {
            redis.opsForValue().set(backupKey(snapshot.getSessionDate()), previous, TTL);
        }
        redis.opsForValue().set(key, json, TTL);
    }

    @Override
    public Optional<SessionSnapshot> load(LocalDate sessionDate) {
        Optional<SessionSnapshot> primary = read(key(sessionDate));
        if (primary.isPresent()) {
            return primary;
        }
        Optional<SessionSnapshot> backup = read(backupKey(sessionDate));
        backup.ifPresent(s -> log.warn("session_snapshot_backup_used date={} savedAt={}", sessionDate, s.getSavedAt()));
        return backup;
    }

    private Optional<SessionSnapshot> read(String key) {
        String raw = redis.opsForValue().get(key);
        if (raw == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(raw, SessionSnapshot.class));
        } catch (JsonProcessingException e) {
            log.error("session_snapshot_unreadable key={} err={}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
