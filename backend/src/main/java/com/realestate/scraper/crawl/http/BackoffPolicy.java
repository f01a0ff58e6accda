package com.realestate.scraper.crawl.http;

import java.time.Duration;

public final class BackoffPolicy {

    private BackoffPolicy() {
    }

    /**
     * Delay before retry number {@code retry} (1-based): {@code base * 2^(retry-1)}, capped at
     * {@code max} when {@code max} is positive.
     */
    public static Duration delayForAttempt(int retry, Duration base, Duration max) {
        if (base == null || base.isZero() || base.isNegative()) {
            return Duration.ZERO;
        }
        int exponent = Math.min(Math.max(0, retry - 1), 30);
        long baseMs = base.toMillis();
        long delayMs = baseMs > (Long.MAX_VALUE >> exponent) ? Long.MAX_VALUE : baseMs << exponent;
        if (max != null && !max.isZero() && !max.isNegative()) {
            delayMs = Math.min(delayMs, max.toMillis());
        }
        return Duration.ofMillis(delayMs);
    }
}
