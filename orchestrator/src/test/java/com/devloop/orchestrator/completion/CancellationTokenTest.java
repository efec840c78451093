package com.devloop.orchestrator.completion;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CancellationTokenTest {

    @Test
    void cancel_closesRegisteredResourcesOnce() {
        CancellationToken token = new CancellationToken();
        AtomicInteger closes = new AtomicInteger();
        token.register(closes::incrementAndGet);

        token.cancel();
        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThat(closes).hasValue(1);
    }

    @Test
    void register_afterCancel_closesImmediately() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        AtomicInteger closes = new AtomicInteger();

        token.register(closes::incrementAndGet);

        assertThat(closes).hasValue(1);
    }

    @Test
    void unregister_preventsClose() {
        CancellationToken token = new CancellationToken();
        AtomicInteger closes = new AtomicInteger();
        AutoCloseable resource = closes::incrementAndGet;
        token.register(resource);

        token.unregister(resource);
        token.cancel();

        assertThat(closes).hasValue(0);
    }

    @Test
    void sleep_returnsTrueWhenNotCancelled() {
        assertThat(new CancellationToken().sleep(Duration.ofMillis(5))).isTrue();
    }

    @Test
    void sleep_wakesEarlyOnCancel() {
        CancellationToken token = new CancellationToken();
        new Thread(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException ignored) {
                Thread.currentThread().interrupt();
            }
            token.cancel();
        }).start();

        long start = System.nanoTime();
        boolean slept = token.sleep(Duration.ofSeconds(10));

        assertThat(slept).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }
}
