package com.realestate.scraper.crawl.model;

import java.time.Instant;

/**
 * Mutable per-domain pacing state. Fields are guarded by the instance monitor, held only for
 * single reads and writes. {@link #turnLock()} serializes callers waiting for a turn, so a penalty
 * can land while one of them sleeps.
 */
public class DomainRateState {
    private final String domain;
    private final long minDelayMs;
    private final long maxDelayMs;
    private final Object turnLock = new Object();
    private Instant lastRequestAt;
    private Instant notBefore;
    private long crawlDelayMs;

    public DomainRateState(String domain, long minDelayMs, long maxDelayMs) {
        this.domain = domain;
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = Math.max(minDelayMs, maxDelayMs);
    }

    public String domain() {
        return domain;
    }

    public Object turnLock() {
        return turnLock;
    }

    public long minDelayMs() {
        return minDelayMs;
    }

    public long maxDelayMs() {
        return maxDelayMs;
    }

    public synchronized long crawlDelayMs() {
        return crawlDelayMs;
    }

    public synchronized void setCrawlDelayMs(long crawlDelayMs) {
        this.crawlDelayMs = Math.max(0, crawlDelayMs);
    }

    public synchronized Instant lastRequestAt() {
        return lastRequestAt;
    }

    public synchronized void recordRequest(Instant at) {
        this.lastRequestAt = at;
    }

    public synchronized Instant notBefore() {
        return notBefore;
    }

    public synchronized void extendNotBefore(Instant candidate) {
        if (notBefore == null || candidate.isAfter(notBefore)) {
            notBefore = candidate;
        }
    }
}
