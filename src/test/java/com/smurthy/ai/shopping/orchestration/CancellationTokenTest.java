package com.smurthy.ai.shopping.orchestration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    @Test
    @DisplayName("A cancelled token reports the first reason and ignores later cancels")
    void firstReasonWins() {
        CancellationToken token = CancellationToken.create();

        token.cancel("shopper left");
        token.cancel("deadline expired");

        assertThat(token.isCancelled()).isTrue();
        assertThat(token.reason()).isEqualTo("shopper left");
        assertThatThrownBy(token::throwIfCancelled)
                .isInstanceOf(CancellationException.class)
                .hasMessage("shopper left");
    }

    @Test
    @DisplayName("Listeners run once on cancel, and at once when registered after it")
    void listenersRunOnce() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger before = new AtomicInteger();
        AtomicInteger after = new AtomicInteger();

        token.onCancel(before::incrementAndGet);
        token.cancel("stop");
        token.cancel("stop again");
        token.onCancel(after::incrementAndGet);

        assertThat(before).hasValue(1);
        assertThat(after).hasValue(1);
    }

    @Test
    @DisplayName("Registering while another thread cancels still runs the listener exactly once")
    void racingRegistrationRunsOnce() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 2_000; i++) {
                CancellationToken token = CancellationToken.create();
                AtomicInteger runs = new AtomicInteger();
                AtomicInteger reasonSeen = new AtomicInteger();
                CountDownLatch go = new CountDownLatch(1);

                Future<?> register = pool.submit(() -> {
                    go.await();
                    token.onCancel(() -> {
                        runs.incrementAndGet();
                        if ("race".equals(token.reason())) {
                            reasonSeen.incrementAndGet();
                        }
                    });
                    return null;
                });
                Future<?> cancel = pool.submit(() -> {
                    go.await();
                    token.cancel("race");
                    return null;
                });
                go.countDown();
                register.get(5, TimeUnit.SECONDS);
                cancel.get(5, TimeUnit.SECONDS);

                assertThat(runs).as("iteration %d", i).hasValue(1);
                assertThat(reasonSeen).as("iteration %d", i).hasValue(1);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
