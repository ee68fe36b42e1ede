package com.caf.backend.modules.notification.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class KeyedLocksTest {

    @Test
    void sameKeyIsMutuallyExclusive() throws Exception {
        KeyedLocks locks = new KeyedLocks(8);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return locks.withLock("user|key", () -> {
                        int current = inside.incrementAndGet();
                        maxInside.accumulateAndGet(current, Math::max);
                        Thread.yield();
                        inside.decrementAndGet();
                        return current;
                    });
                }));
            }
            start.countDown();
            for (Future<Integer> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void lockIsReleasedWhenActionThrows() {
        KeyedLocks locks = new KeyedLocks(1);

        assertThatThrownBy(() -> locks.withLock("a", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.withLock("a", () -> "ok")).isEqualTo("ok");
    }

    @Test
    void stripeCountMustBePositive() {
        assertThatThrownBy(() -> new KeyedLocks(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
