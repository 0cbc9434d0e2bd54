package com.eventradar.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;

/**
 * Job lock on a Redis string key (SET NX with TTL) whose value is the owning manager ID.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisJobLock implements JobLock {

    private final StringRedisTemplate redis;

    @Override
    public boolean tryAcquire(String key, String owner, Duration ttl) {
        Boolean acquired = redis.opsForValue().setIfAbsent(key, owner, ttl);
        if (Boolean.TRUE.equals(acquired)) {
            return true;
        }
        String holder = redis.opsForValue().get(key);
        if (owner.equals(holder)) {
            redis.expire(key, ttl);
            return true;
        }
        log.debug("Job lock held by another manager: key={}, holder={}", key, holder);
        return false;
    }

    @Override
    public boolean refresh(String key, String owner, Duration ttl) {
        String holder = redis.opsForValue().get(key);
        if (!owner.equals(holder)) {
            return false;
        }
        return Boolean.TRUE.equals(redis.expire(key, ttl));
    }

    @Override
    public void release(String key, String owner) {
        String holder = redis.opsForValue().get(key);
        if (owner.equals(holder)) {
            redis.delete(key);
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }
}
