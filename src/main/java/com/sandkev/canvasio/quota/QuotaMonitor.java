package com.sandkev.canvasio.quota;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.OptionalDouble;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks the server-reported remaining request quota.
 * <p>
 * The counter is only ever overwritten from a server observation; local {@link #consume(double)}
 * calls pre-decrement it so a burst of dispatches cannot overshoot the buffer before the next
 * response arrives. Until the first observation the monitor lets every call through.
 */
@Slf4j
public class QuotaMonitor {

    private final double buffer;
    private final Duration checkStatusInterval;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition capacityRaised = lock.newCondition();

    private double remaining;
    private boolean observed;

    private volatile Runnable statusCheck = () -> {};

    public QuotaMonitor(double buffer, Duration checkStatusInterval) {
        if (buffer < 0) throw new IllegalArgumentException("buffer < 0");
        if (checkStatusInterval == null || checkStatusInterval.isNegative() || checkStatusInterval.isZero()) {
            throw new IllegalArgumentException("checkStatusInterval must be positive");
        }
        this.buffer = buffer;
        this.checkStatusInterval = checkStatusInterval;
    }

    /** Optimistic pre-decrement before a call is sent. */
    public void consume(double cost) {
        lock.lock();
        try {
            remaining -= cost;
        } finally {
            lock.unlock();
        }
    }

    /** Server truth: replaces whatever the local estimate was. */
    public void observe(double serverRemaining) {
        lock.lock();
        try {
            remaining = serverRemaining;
            observed = true;
            if (canProceed()) {
                capacityRaised.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean mayProceed() {
        lock.lock();
        try {
            return canProceed();
        } finally {
            lock.unlock();
        }
    }

    /** Empty until the first server observation. */
    public OptionalDouble remaining() {
        lock.lock();
        try {
            return observed ? OptionalDouble.of(remaining) : OptionalDouble.empty();
        } finally {
            lock.unlock();
        }
    }

    public double buffer() {
        return buffer;
    }

    public Duration checkStatusInterval() {
        return checkStatusInterval;
    }

    /**
     * Hook run after every full {@link #checkStatusInterval()} spent waiting, so that something
     * can fetch a fresh reading when no response is on its way.
     */
    public void setStatusCheck(Runnable statusCheck) {
        this.statusCheck = statusCheck == null ? () -> {} : statusCheck;
    }

    /**
     * Blocks while the remaining quota is below the buffer. Wakes on every observation that
     * restores capacity and otherwise re-checks once per status interval.
     */
    public void awaitCapacity() throws InterruptedException {
        boolean waited = false;
        while (true) {
            lock.lock();
            try {
                if (canProceed()) {
                    if (waited) log.info("Quota recovered: remaining={} buffer={}", remaining, buffer);
                    return;
                }
                if (!waited) {
                    log.warn("Quota low: remaining={} < buffer={}, holding dispatch", remaining, buffer);
                    waited = true;
                }
                if (capacityRaised.await(checkStatusInterval.toNanos(), TimeUnit.NANOSECONDS)) {
                    continue;
                }
            } finally {
                lock.unlock();
            }
            runStatusCheck();
        }
    }

    private void runStatusCheck() {
        try {
            statusCheck.run();
        } catch (RuntimeException e) {
            log.warn("Quota status check failed: {}", e.toString());
        }
    }

    private boolean canProceed() {
        return !observed || remaining >= buffer;
    }
}
