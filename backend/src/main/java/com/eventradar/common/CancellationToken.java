package com.eventradar.common;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation signal. Cancelling a token cancels every child derived from it;
 * cancelling a child leaves its parent and siblings untouched.
 */
public final class CancellationToken {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final List<CancellationToken> children = new CopyOnWriteArrayList<>();
    private final CancellationToken parent;

    private CancellationToken(CancellationToken parent) {
        this.parent = parent;
    }

    public static CancellationToken root() {
        return new CancellationToken(null);
    }

    /**
     * New token that is cancelled together with this one. A child of an already cancelled token starts cancelled.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken(this);
        children.add(child);
        if (isCancelled()) {
            child.cancel();
        }
        return child;
    }

    public void cancel() {
        synchronized (cancelled) {
            if (cancelled.getCount() == 0) {
                return;
            }
            cancelled.countDown();
        }
        for (CancellationToken child : children) {
            child.cancel();
        }
        children.clear();
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits up to {@code timeout} for cancellation.
     *
     * @return true if the token was cancelled before the timeout elapsed
     */
    public boolean await(Duration timeout) throws InterruptedException {
        return cancelled.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Blocks until the token is cancelled.
     */
    public void await() throws InterruptedException {
        cancelled.await();
    }

    int childCount() {
        return children.size();
    }
}
