package com.realestate.scraper.crawl.model;

import java.util.concurrent.CompletableFuture;

/**
 * Returned by a launch; {@code completion} finishes with the terminal snapshot of the job.
 */
public record ScrapeJobHandle(String jobId, CompletableFuture<JobProgress> completion) {
}
