package com.chunkvault.core.concurrent;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class StripedLocksTest {

    @Test
    void shouldHoldEveryKeyStripeWhileRunning() {
        StripedLocks locks = new StripedLocks(16);

        locks.runWithLocks(List.of("a", "b", "c"), () -> {
            assertThat(locks.lockFor("a").isHeldByCurrentThread()).isTrue();
            assertThat(locks.lockFor("b").isHeldByCurrentThread()).isTrue();
            assertThat(locks.lockFor("c").isHeldByCurrentThread()).isTrue();
        });

        assertThat(locks.lockFor("a").isHeldByCurrentThread()).isFalse();
        assertThat(locks.lockFor("c").isHeldByCurrentThread()).isFalse();
    }

    @Test
    void shouldReleaseLocksWhenActionThrows() {
        StripedLocks locks = new StripedLocks(4);

        assertThatThrownBy(() -> locks.runWithLocks(List.of("x", "y"), () -> {
            throw new IllegalStateException("fails");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(locks.lockFor("x").isLocked()).isFalse();
        assertThat(locks.lockFor("y").isLocked()).isFalse();
    }

    @Test
    void shouldNotDeadlockOnOppositeKeyOrder() throws Exception {
        StripedLocks locks = new StripedLocks(64);
        AtomicInteger runs = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            Future<?> forward = pool.submit(() -> {
                go.await();
                for (int i = 0; i < 1000; i++) {
                    locks.runWithLocks(List.of("left", "right"), runs::incrementAndGet);
                }
                return null;
            });
            Future<?> backward = pool.submit(() -> {
                go.await();
                for (int i = 0; i < 1000; i++) {
                    locks.runWithLocks(List.of("right", "left"), runs::incrementAndGet);
                }
                return null;
            });
            go.countDown();

            forward.get(10, TimeUnit.SECONDS);
            backward.get(10, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }
        assertThat(runs.get()).isEqualTo(2000);
    }
}
