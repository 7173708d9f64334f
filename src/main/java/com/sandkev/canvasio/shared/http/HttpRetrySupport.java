package com.sandkev.canvasio.shared.http;

import java.util.Locale;

/**
 * Classifies Canvas responses for the scheduler's retry policy.
 */
public final class HttpRetrySupport {

    public static final String RATE_LIMIT_REMAINING = "X-Rate-Limit-Remaining";

    private HttpRetrySupport() {}

    /** Canvas throttles with 429, or with a 403 whose body says so. */
    public static boolean isQuotaRejection(int status, String body) {
        if (status == 429) return true;
        return status == 403 && body != null
                && body.toLowerCase(Locale.ROOT).contains("rate limit exceeded");
    }

    public static boolean isTransientServerError(int status) {
        return status == 500 || status == 502 || status == 503 || status == 504;
    }

    public static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    /** Parses the quota header; Canvas sends a decimal such as {@code 699.85}. */
    public static Double parseRemaining(String v) {
        if (v == null || v.isBlank()) return null;
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
