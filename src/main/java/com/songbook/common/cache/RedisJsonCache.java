package com.songbook.common.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Redis 中以 JSON 存放的简单 KV 缓存。缓存只是加速，任何 Redis 异常都退化为 miss。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisJsonCache {

    /**
     * Redis 故障时 fail-fast：避免每次读写都卡在连接超时上。
     */
    private static final long REDIS_FAIL_FAST_MS = 10_000;
    private static final AtomicLong REDIS_UNAVAILABLE_UNTIL_MS = new AtomicLong(0);

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;

    public <T> T get(String key, Class<T> type) {
        if (key == null || key.isBlank() || type == null || shouldFailFast()) {
            return null;
        }
        try {
            String raw = redis.opsForValue().get(key);
            if (raw == null || raw.isBlank()) {
                return null;
            }
            return objectMapper.readValue(raw, type);
        } catch (Exception e) {
            log.debug("redis json cache get failed: key={}, err={}", key, e.toString());
            markRedisDown();
            return null;
        }
    }

    public void set(String key, Object value, Duration ttl) {
        if (key == null || key.isBlank() || value == null || shouldFailFast()) {
            return;
        }
        long sec = ttl == null ? 0 : ttl.toSeconds();
        if (sec <= 0) {
            sec = 60;
        }
        try {
            redis.opsForValue().set(key, objectMapper.writeValueAsString(value), Duration.ofSeconds(sec));
        } catch (Exception e) {
            log.debug("redis json cache set failed: key={}, err={}", key, e.toString());
            markRedisDown();
        }
    }

    /**
     * 删除不走 fail-fast：写路径上的失效必须尽量送达，失败只记录。
     */
    public void delete(String key) {
        if (key == null || key.isBlank()) {
            return;
        }
        try {
            redis.delete(key);
        } catch (Exception e) {
            log.warn("redis json cache delete failed: key={}, err={}", key, e.toString());
            markRedisDown();
        }
    }

    private static boolean shouldFailFast() {
        return System.currentTimeMillis() < REDIS_UNAVAILABLE_UNTIL_MS.get();
    }

    private static void markRedisDown() {
        long until = System.currentTimeMillis() + REDIS_FAIL_FAST_MS;
        REDIS_UNAVAILABLE_UNTIL_MS.accumulateAndGet(until, Math::max);
    }
}
