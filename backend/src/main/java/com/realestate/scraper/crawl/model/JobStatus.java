package com.realestate.scraper.crawl.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Scrape job lifecycle. Transitions only move forward: {@code PENDING -> RUNNING -> terminal},
 * plus {@code PENDING -> FAILED} for a job rejected at launch and {@code PENDING -> CANCELLED}
 * for a job cancelled before it started.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(JobStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<JobStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, FAILED, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
