package com.eventradar.lock;

import java.time.Duration;

/**
 * Distributed lock ensuring one scheduler instance watches a given job at a time.
 * Implementations throw {@link RuntimeException}s on store failures; callers treat those as best-effort.
 */
public interface JobLock {

    /**
     * @return true if the lock was taken (or already held by this owner), false if another owner holds it
     */
    boolean tryAcquire(String key, String owner, Duration ttl);

    /** Extends the TTL when this owner still holds the lock. */
    boolean refresh(String key, String owner, Duration ttl);

    void release(String key, String owner);

    boolean isEnabled();
}
