package com.pricesync.orchestrator.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunLockTest {

    @Test
    void releasesAfterException() {
        RunLock lock = new RunLock();

        assertThatThrownBy(() -> lock.runExclusive("manual-1", () -> {
            throw new IllegalStateException("chain blew up");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(lock.isHeld()).isFalse();
        assertThat(lock.holder()).isNull();
        assertThat(lock.runExclusive("manual-2", () -> "ran")).isEqualTo("ran");
    }

    @Test
    void holderIsVisibleWhileRunning() {
        RunLock lock = new RunLock();

        String seen = lock.runExclusive("schedule_Sale", lock::holder);

        assertThat(seen).isEqualTo("schedule_Sale");
        assertThat(lock.holder()).isNull();
    }

    @Test
    void secondCallerWaitsInsteadOfOverlapping() throws Exception {
        RunLock lock = new RunLock();
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        CountDownLatch firstInside = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            Future<?> first = pool.submit(() -> lock.runExclusive("manual-a", () -> {
                firstInside.countDown();
                track(concurrent, maxConcurrent);
                return null;
            }));
            assertThat(firstInside.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(lock.isHeld()).isTrue();

            Future<?> second = pool.submit(() -> lock.runExclusive("schedule_Sale", () -> {
                track(concurrent, maxConcurrent);
                return null;
            }));

            first.get(5, TimeUnit.SECONDS);
            second.get(5, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxConcurrent.get()).isEqualTo(1);
        assertThat(lock.isHeld()).isFalse();
    }

    private static void track(AtomicInteger concurrent, AtomicInteger maxConcurrent) {
        int now = concurrent.incrementAndGet();
        maxConcurrent.accumulateAndGet(now, Math::max);
        try {
            Thread.sleep(200);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        concurrent.decrementAndGet();
    }

    @Test
    void reportsWhetherCallerHadToWait() throws Exception {
        RunLock lock = new RunLock();
        CountDownLatch firstInside = new CountDownLatch(1);
        CountDownLatch releaseFirst = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);

        try {
            Future<RunLock.Outcome<String>> first = pool.submit(() -> lock.runTracked("manual-a", () -> {
                firstInside.countDown();
                await(releaseFirst);
                return "a";
            }));
            assertThat(firstInside.await(5, TimeUnit.SECONDS)).isTrue();

            Future<RunLock.Outcome<String>> second = pool.submit(() -> lock.runTracked("schedule_Sale", () -> "b"));
            long deadline = System.currentTimeMillis() + 5000;
            while (lock.queueLength() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            releaseFirst.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(new RunLock.Outcome<>("a", false));
            assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo(new RunLock.Outcome<>("b", true));
        } finally {
            pool.shutdownNow();
        }

        assertThat(lock.runTracked("manual-c", () -> "c").waited()).isFalse();
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
