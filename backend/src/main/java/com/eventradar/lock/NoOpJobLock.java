package com.eventradar.lock;

import java.time.Duration;

/** Used when the distributed job lock is disabled: every acquire succeeds. */
public class NoOpJobLock implements JobLock {

    @Override
    public boolean tryAcquire(String key, String owner, Duration ttl) {
        return true;
    }

    @Override
    public boolean refresh(String key, String owner, Duration ttl) {
        return true;
    }

    @Override
    public void release(String key, String owner) {
        // nothing held
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
