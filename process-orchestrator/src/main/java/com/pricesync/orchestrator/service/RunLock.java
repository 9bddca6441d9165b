package com.pricesync.orchestrator.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide guard: at most one chain runs at a time, whether started by an
 * operator or by a schedule.
 *
 * Callers block until the lock is free; nothing is skipped or cancelled. The lock
 * is fair so waiting runs start in arrival order.
 */
@Component
@Slf4j
public class RunLock {

    private final ReentrantLock lock = new ReentrantLock(true);
    private volatile String holder;

    /**
     * Value returned by the guarded action, plus whether the caller had to wait for
     * another run to release the lock first.
     */
    public record Outcome<T>(T value, boolean waited) {
    }

    public boolean isHeld() {
        return lock.isLocked();
    }

    /** Run context currently holding the lock, null when free. */
    public String holder() {
        return holder;
    }

    /** Number of callers currently blocked waiting for the lock (estimate). */
    public int queueLength() {
        return lock.getQueueLength();
    }

    /**
     * Acquire the lock, run {@code action}, release on every exit path.
     *
     * @param context manual invocation id or scheduled job id, used for logging only
     */
    public <T> T runExclusive(String context, Supplier<T> action) {
        return runTracked(context, action).value();
    }

    /**
     * Same as {@link #runExclusive}, also reporting whether the lock was busy on arrival.
     */
    public <T> Outcome<T> runTracked(String context, Supplier<T> action) {
        boolean waited = !tryAcquire(context);
        if (waited) {
            log.info("[{}] waiting for run lock held by [{}], {} in queue", context, holder, lock.getQueueLength() + 1);
            lock.lock();
        }
        try {
            holder = context;
            log.info("[{}] acquired run lock", context);
            return new Outcome<>(action.get(), waited);
        } finally {
            holder = null;
            lock.unlock();
            log.info("[{}] released run lock", context);
        }
    }

    // timed tryLock honours fairness, the untimed one barges past queued callers
    private boolean tryAcquire(String context) {
        try {
            return lock.tryLock(0, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("[" + context + "] interrupted while acquiring run lock", e);
        }
    }
}
