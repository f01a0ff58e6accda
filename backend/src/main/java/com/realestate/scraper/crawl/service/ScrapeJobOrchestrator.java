package com.realestate.scraper.crawl.service;

import com.realestate.scraper.config.ScraperProperties;
import com.realestate.scraper.crawl.model.JobEvent;
import com.realestate.scraper.crawl.model.JobProgress;
import com.realestate.scraper.crawl.model.JobStatus;
import com.realestate.scraper.crawl.model.ScrapeJob;
import com.realestate.scraper.crawl.model.ScrapeJobHandle;
import com.realestate.scraper.crawl.model.ScrapeJobRequest;
import com.realestate.scraper.crawl.model.SiteConfig;
import com.realestate.scraper.crawl.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Owns the job registry. Launching validates the site configuration, registers the job as
 * PENDING and hands it to the job executor; every job runs on its own worker thread. The registry
 * keeps at most {@code scraper.max-retained-jobs} entries by evicting the oldest finished jobs.
 */
@Service
public class ScrapeJobOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJobOrchestrator.class);

    private final SiteConfigProvider siteConfigProvider;
    private final ScrapeJobRunner runner;
    private final ExecutorService jobExecutor;
    private final ScraperProperties properties;
    private final Clock clock;
    private final Map<String, ScrapeJob> jobs = new ConcurrentHashMap<>();

    public ScrapeJobOrchestrator(
        SiteConfigProvider siteConfigProvider,
        ScrapeJobRunner runner,
        @Qualifier("jobExecutor") ExecutorService jobExecutor,
        ScraperProperties properties,
        Clock clock
    ) {
        this.siteConfigProvider = siteConfigProvider;
        this.runner = runner;
        this.jobExecutor = jobExecutor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Launches a job for a configured site. A missing, inactive or invalid configuration still
     * registers the job, which goes straight to FAILED without any network access.
     *
     * @throws DuplicateScrapeJobException if a job with the same id is registered and not finished
     */
    public ScrapeJobHandle launch(ScrapeJobRequest request) {
        String siteKey = request == null ? null : request.siteKey();
        SiteConfig config = null;
        String lookupProblem = null;
        try {
            Optional<SiteConfig> found = siteConfigProvider.get(siteKey);
            if (found.isPresent()) {
                config = found.get();
            } else {
                lookupProblem = "site config not found: " + siteKey;
            }
        } catch (JobConfigInvalidException e) {
            lookupProblem = e.getMessage();
        }
        if (config != null && request.startUrl() != null && !request.startUrl().isBlank()) {
            config = config.withStartUrl(request.startUrl().trim());
        }
        Integer maxPages = request == null ? null : request.maxPages();
        return launch(request == null ? null : request.jobId(), siteKey, config, maxPages, lookupProblem);
    }

    public ScrapeJobHandle launch(String jobId, SiteConfig config) {
        return launch(jobId, config == null ? null : config.key(), config, null, null);
    }

    private ScrapeJobHandle launch(
        String requestedId,
        String siteKey,
        SiteConfig config,
        Integer requestedMaxPages,
        String lookupProblem
    ) {
        ScrapeJob job = register(requestedId, siteKey);

        List<String> problems = new ArrayList<>();
        if (lookupProblem != null) {
            problems.add(lookupProblem);
        } else {
            problems.addAll(SiteConfigValidator.validate(config));
        }
        if (requestedMaxPages != null && requestedMaxPages < 1) {
            problems.add("max pages must be at least 1");
        }
        if (!problems.isEmpty()) {
            String message = String.join("; ", problems);
            job.recordEvent(JobEvent.ERROR, ReasonCodes.JOB_CONFIG_INVALID, message, null);
            job.tryTransitionTo(JobStatus.FAILED, message);
            log.warn("Scrape job {} rejected site={} problems={}", job.id(), siteKey, message);
            return new ScrapeJobHandle(job.id(), CompletableFuture.completedFuture(job.snapshot()));
        }

        int maxPages = resolveMaxPages(requestedMaxPages, config);
        SiteConfig runConfig = config;
        try {
            CompletableFuture<JobProgress> completion = CompletableFuture.supplyAsync(
                () -> runner.run(job, runConfig, maxPages),
                jobExecutor
            );
            log.info("Scrape job {} queued site={} maxPages={}", job.id(), siteKey, maxPages);
            return new ScrapeJobHandle(job.id(), completion);
        } catch (RejectedExecutionException e) {
            String message = "job executor rejected job";
            job.recordEvent(JobEvent.ERROR, null, message, null);
            job.tryTransitionTo(JobStatus.FAILED, message);
            log.warn("Scrape job {} rejected by executor", job.id(), e);
            return new ScrapeJobHandle(job.id(), CompletableFuture.completedFuture(job.snapshot()));
        }
    }

    /**
     * Requests cancellation. A job that has not started yet is cancelled at once; a running job
     * stops before its next fetch and discards any response still in flight.
     *
     * @return {@code false} when the job had already finished
     */
    public boolean cancel(String jobId) {
        ScrapeJob job = find(jobId);
        if (!job.requestCancel()) {
            return false;
        }
        if (job.cancelIfPending()) {
            job.recordEvent(JobEvent.INFO, null, "job cancelled before start", null);
            log.info("Scrape job {} cancelled before start", jobId);
        } else {
            log.info("Cancellation requested for scrape job {} status={}", jobId, job.status());
        }
        return true;
    }

    public JobProgress getProgress(String jobId) {
        return find(jobId).snapshot();
    }

    public List<JobEvent> getEvents(String jobId) {
        return find(jobId).events();
    }

    public List<JobProgress> listJobs() {
        return jobs.values().stream()
            .map(ScrapeJob::snapshot)
            .sorted(Comparator.comparing(JobProgress::createdAt).reversed())
            .toList();
    }

    private ScrapeJob register(String requestedId, String siteKey) {
        String id = requestedId == null || requestedId.isBlank()
            ? UUID.randomUUID().toString()
            : requestedId.trim();
        ScrapeJob candidate = new ScrapeJob(id, siteKey, clock, properties.getMaxEventsPerJob());
        ScrapeJob registered = jobs.compute(id, (key, existing) -> {
            if (existing != null && !existing.status().isTerminal()) {
                return existing;
            }
            return candidate;
        });
        if (registered != candidate) {
            throw new DuplicateScrapeJobException("Scrape job already active: " + id);
        }
        evictFinishedJobs();
        return candidate;
    }

    private void evictFinishedJobs() {
        int excess = jobs.size() - properties.getMaxRetainedJobs();
        if (excess <= 0) {
            return;
        }
        List<ScrapeJob> evictable = jobs.values().stream()
            .filter(job -> job.status().isTerminal())
            .sorted(Comparator
                .comparing((ScrapeJob job) -> job.snapshot().finishedAt(), Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(job -> job.snapshot().createdAt()))
            .limit(excess)
            .toList();
        for (ScrapeJob job : evictable) {
            jobs.remove(job.id(), job);
        }
        if (!evictable.isEmpty()) {
            log.debug("Evicted {} finished scrape jobs, {} retained", evictable.size(), jobs.size());
        }
    }

    private int resolveMaxPages(Integer requested, SiteConfig config) {
        if (requested != null) {
            return requested;
        }
        if (config.maxPages() != null) {
            return config.maxPages();
        }
        return properties.getDefaultMaxPages();
    }

    private ScrapeJob find(String jobId) {
        ScrapeJob job = jobId == null ? null : jobs.get(jobId);
        if (job == null) {
            throw new ScrapeJobNotFoundException(jobId);
        }
        return job;
    }
}
