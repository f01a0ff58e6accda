package com.realestate.scraper.crawl.model;

import java.time.Instant;

/**
 * Immutable progress snapshot of a scrape job. The job swaps whole snapshots atomically so a
 * reader never observes a half-applied update.
 */
public record JobProgress(
    String jobId,
    String siteKey,
    JobStatus status,
    long urlsVisited,
    long recordsFound,
    long errors,
    long urlsBlocked,
    Instant createdAt,
    Instant startedAt,
    Instant finishedAt,
    String errorMessage
) {
    public static JobProgress pending(String jobId, String siteKey, Instant createdAt) {
        return new JobProgress(jobId, siteKey, JobStatus.PENDING, 0, 0, 0, 0, createdAt, null, null, null);
    }

    public JobProgress withStatus(JobStatus next, Instant at, String message) {
        Instant started = startedAt;
        Instant finished = finishedAt;
        if (next == JobStatus.RUNNING) {
            started = at;
        }
        if (next.isTerminal()) {
            finished = at;
        }
        return new JobProgress(
            jobId,
            siteKey,
            next,
            urlsVisited,
            recordsFound,
            errors,
            urlsBlocked,
            createdAt,
            started,
            finished,
            message == null ? errorMessage : message
        );
    }

    public JobProgress plus(long visited, long records, long errorCount, long blocked) {
        return new JobProgress(
            jobId,
            siteKey,
            status,
            urlsVisited + visited,
            recordsFound + records,
            errors + errorCount,
            urlsBlocked + blocked,
            createdAt,
            startedAt,
            finishedAt,
            errorMessage
        );
    }
}
