package com.sandkev.canvasio.scheduler;

import java.time.Duration;

/**
 * @param callLimit        maximum calls in flight
 * @param minSendInterval  minimum gap between two dispatch starts
 * @param maxAttempts      attempts per call for transport failures and 5xx responses
 * @param maxQuotaRetries  requeues per call after a quota rejection
 * @param statusPath       GET path used to refresh the quota reading while dispatch is held
 */
public record SchedulerSettings(int callLimit,
                                Duration minSendInterval,
                                int maxAttempts,
                                int maxQuotaRetries,
                                String statusPath) {

    public SchedulerSettings {
        if (callLimit <= 0) throw new IllegalArgumentException("callLimit <= 0");
        if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts <= 0");
        if (maxQuotaRetries < 0) throw new IllegalArgumentException("maxQuotaRetries < 0");
        minSendInterval = minSendInterval == null ? Duration.ZERO : minSendInterval;
        if (minSendInterval.isNegative()) throw new IllegalArgumentException("minSendInterval < 0");
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(30, Duration.ofMillis(50), 5, 20, "/api/v1/users/self");
    }
}
