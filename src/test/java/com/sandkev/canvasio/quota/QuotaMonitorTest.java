package com.sandkev.canvasio.quota;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotaMonitorTest {

    @Test
    void allowsCallsBeforeFirstObservation() throws Exception {
        var quota = new QuotaMonitor(300, Duration.ofMillis(20));
        quota.consume(1);

        assertThat(quota.mayProceed()).isTrue();
        assertThat(quota.remaining()).isEmpty();
        quota.awaitCapacity(); // returns immediately
    }

    @Test
    void observationOverwritesLocalEstimate() {
        var quota = new QuotaMonitor(300, Duration.ofMillis(20));
        quota.observe(700);
        quota.consume(1);
        quota.consume(1);
        assertThat(quota.remaining()).hasValue(698);

        quota.observe(650.5);
        assertThat(quota.remaining()).hasValue(650.5);
    }

    @Test
    void consumeCanPushBelowBuffer() {
        var quota = new QuotaMonitor(300, Duration.ofMillis(20));
        quota.observe(301);
        quota.consume(1);
        assertThat(quota.mayProceed()).isTrue();
        quota.consume(1);
        assertThat(quota.mayProceed()).isFalse();
    }

    @Test
    void blocksBelowBufferAndResumesOnObservation() throws Exception {
        var quota = new QuotaMonitor(300, Duration.ofMillis(50));
        quota.observe(100);

        CompletableFuture<Void> waiter = CompletableFuture.runAsync(() -> {
            try {
                quota.awaitCapacity();
            } catch (InterruptedException e) {
                throw new IllegalStateException(e);
            }
        });

        Thread.sleep(120);
        assertThat(waiter).isNotDone();

        long raisedAt = System.nanoTime();
        quota.observe(900);
        waiter.get(2, TimeUnit.SECONDS);
        assertThat(Duration.ofNanos(System.nanoTime() - raisedAt)).isLessThan(Duration.ofMillis(500));
    }

    @Test
    void runsStatusCheckOncePerIntervalWhileHeld() throws Exception {
        var quota = new QuotaMonitor(300, Duration.ofMillis(20));
        quota.observe(0);
        var checks = new AtomicInteger();
        quota.setStatusCheck(() -> {
            if (checks.incrementAndGet() == 3) quota.observe(500);
        });

        quota.awaitCapacity();

        assertThat(checks.get()).isEqualTo(3);
        assertThat(quota.remaining()).hasValue(500);
    }

    @Test
    void failingStatusCheckDoesNotEndTheWait() throws Exception {
        var quota = new QuotaMonitor(300, Duration.ofMillis(10));
        quota.observe(0);
        var checks = new AtomicInteger();
        quota.setStatusCheck(() -> {
            if (checks.incrementAndGet() < 3) throw new IllegalStateException("probe down");
            quota.observe(1000);
        });

        quota.awaitCapacity();
        assertThat(checks.get()).isEqualTo(3);
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> new QuotaMonitor(300, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
