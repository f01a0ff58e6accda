package com.realestate.scraper.crawl.model;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A scrape job owned by the runner thread executing it. Other threads may only request
 * cancellation and read snapshots.
 */
public class ScrapeJob {
    private final String id;
    private final String siteKey;
    private final Clock clock;
    private final int maxEvents;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private final AtomicReference<JobProgress> progress;
    private final Deque<JobEvent> events = new ConcurrentLinkedDeque<>();
    private final AtomicInteger eventCount = new AtomicInteger();

    public ScrapeJob(String id, String siteKey, Clock clock, int maxEvents) {
        this.id = id;
        this.siteKey = siteKey;
        this.clock = clock;
        this.maxEvents = Math.max(1, maxEvents);
        this.progress = new AtomicReference<>(JobProgress.pending(id, siteKey, clock.instant()));
    }

    public String id() {
        return id;
    }

    public String siteKey() {
        return siteKey;
    }

    public JobProgress snapshot() {
        return progress.get();
    }

    public JobStatus status() {
        return progress.get().status();
    }

    /**
     * Moves the job to {@code target}.
     *
     * @throws IllegalStateException if the current status does not allow the transition
     */
    public JobProgress transitionTo(JobStatus target, String message) {
        while (true) {
            JobProgress current = progress.get();
            if (!current.status().canTransitionTo(target)) {
                throw new IllegalStateException(
                    "Illegal job transition " + current.status() + " -> " + target + " for job " + id
                );
            }
            JobProgress next = current.withStatus(target, clock.instant(), message);
            if (progress.compareAndSet(current, next)) {
                return next;
            }
        }
    }

    /**
     * Like {@link #transitionTo} but returns {@code false} instead of throwing when the job has
     * already moved somewhere the transition is not allowed from.
     */
    public boolean tryTransitionTo(JobStatus target, String message) {
        while (true) {
            JobProgress current = progress.get();
            if (!current.status().canTransitionTo(target)) {
                return false;
            }
            JobProgress next = current.withStatus(target, clock.instant(), message);
            if (progress.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    /**
     * Counts one fetched page together with its emitted records and per-record errors in a single
     * snapshot swap.
     */
    public void recordPage(int records, int recordErrors) {
        progress.updateAndGet(current -> current.plus(1, records, recordErrors, 0));
    }

    public void addErrors(int count) {
        if (count > 0) {
            progress.updateAndGet(current -> current.plus(0, 0, count, 0));
        }
    }

    public void recordBlocked() {
        progress.updateAndGet(current -> current.plus(0, 0, 0, 1));
    }

    public boolean requestCancel() {
        if (status().isTerminal()) {
            return false;
        }
        cancelRequested.set(true);
        return true;
    }

    /**
     * Cancels the job only if it has not started; a running job is left to its runner.
     */
    public boolean cancelIfPending() {
        while (true) {
            JobProgress current = progress.get();
            if (current.status() != JobStatus.PENDING) {
                return false;
            }
            JobProgress next = current.withStatus(JobStatus.CANCELLED, clock.instant(), null);
            if (progress.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public void recordEvent(String level, String reasonCode, String message, String url) {
        events.addLast(new JobEvent(clock.instant(), level, reasonCode, message, url));
        if (eventCount.incrementAndGet() > maxEvents) {
            if (events.pollFirst() != null) {
                eventCount.decrementAndGet();
            }
        }
    }

    public List<JobEvent> events() {
        return new ArrayList<>(events);
    }
}
