package com.realestate.scraper.crawl.service;

import com.realestate.scraper.crawl.dedup.UrlDeduplicator;
import com.realestate.scraper.crawl.http.DomainRateLimiter;
import com.realestate.scraper.crawl.http.PageFetcher;
import com.realestate.scraper.crawl.model.FetchOutcome;
import com.realestate.scraper.crawl.model.FrontierUrl;
import com.realestate.scraper.crawl.model.JobEvent;
import com.realestate.scraper.crawl.model.JobProgress;
import com.realestate.scraper.crawl.model.JobStatus;
import com.realestate.scraper.crawl.model.ListingRecord;
import com.realestate.scraper.crawl.model.PaginationType;
import com.realestate.scraper.crawl.model.ParsedPage;
import com.realestate.scraper.crawl.model.ScrapeJob;
import com.realestate.scraper.crawl.model.SiteConfig;
import com.realestate.scraper.crawl.parse.ListingPageParser;
import com.realestate.scraper.crawl.robots.RobotsDecision;
import com.realestate.scraper.crawl.robots.RobotsPolicyCache;
import com.realestate.scraper.crawl.util.PaginationUrls;
import com.realestate.scraper.crawl.util.ReasonCodes;
import com.realestate.scraper.crawl.util.UrlCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Runs one job's fetch loop on the calling thread: frontier pop, dedup, robots check, rate-limit
 * turn, fetch, parse, emit. Per-URL and per-record failures are counted and the loop moves on.
 */
@Component
public class ScrapeJobRunner {
    private static final Logger log = LoggerFactory.getLogger(ScrapeJobRunner.class);
    static final String MDC_JOB_ID = "jobId";
    static final int MAX_REDIRECTS = 5;

    private final UrlDeduplicator deduplicator;
    private final RobotsPolicyCache robotsPolicyCache;
    private final DomainRateLimiter rateLimiter;
    private final PageFetcher fetcher;
    private final ListingPageParser parser;
    private final RecordSink recordSink;

    public ScrapeJobRunner(
        UrlDeduplicator deduplicator,
        RobotsPolicyCache robotsPolicyCache,
        DomainRateLimiter rateLimiter,
        PageFetcher fetcher,
        ListingPageParser parser,
        RecordSink recordSink
    ) {
        this.deduplicator = deduplicator;
        this.robotsPolicyCache = robotsPolicyCache;
        this.rateLimiter = rateLimiter;
        this.fetcher = fetcher;
        this.parser = parser;
        this.recordSink = recordSink;
    }

    public JobProgress run(ScrapeJob job, SiteConfig config, int maxPages) {
        MDC.put(MDC_JOB_ID, job.id());
        try {
            if (job.isCancelRequested()) {
                job.tryTransitionTo(JobStatus.CANCELLED, null);
                return job.snapshot();
            }
            if (!job.tryTransitionTo(JobStatus.RUNNING, null)) {
                log.info("Scrape job {} not started, status={}", job.id(), job.status());
                return job.snapshot();
            }
            log.info("Starting scrape job site={} startUrl={} maxPages={}", config.key(), config.startUrl(), maxPages);
            job.recordEvent(JobEvent.INFO, null, "job started", config.startUrl());

            Deque<FrontierUrl> frontier = new ArrayDeque<>();
            frontier.addLast(FrontierUrl.listingPage(config.startUrl(), 1));
            while (!frontier.isEmpty()) {
                if (job.isCancelRequested()) {
                    break;
                }
                processUrl(job, config, maxPages, frontier.pollFirst(), frontier);
            }

            if (job.isCancelRequested()) {
                finish(job, JobStatus.CANCELLED, null);
                log.info("Scrape job {} cancelled, {} queued urls dropped", job.id(), frontier.size());
            } else {
                finish(job, JobStatus.COMPLETED, null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (job.isCancelRequested()) {
                finish(job, JobStatus.CANCELLED, null);
            } else {
                finish(job, JobStatus.FAILED, "interrupted");
            }
        } catch (RuntimeException e) {
            log.warn("Scrape job {} failed", job.id(), e);
            job.recordEvent(JobEvent.ERROR, null, "job failed: " + e.getMessage(), null);
            finish(job, JobStatus.FAILED, "exception=" + e.getClass().getSimpleName());
        } finally {
            deduplicator.forget(job.id());
            MDC.remove(MDC_JOB_ID);
        }
        return job.snapshot();
    }

    private void processUrl(
        ScrapeJob job,
        SiteConfig config,
        int maxPages,
        FrontierUrl next,
        Deque<FrontierUrl> frontier
    ) throws InterruptedException {
        String url = next.url();
        if (!deduplicator.markIfNew(job.id(), url)) {
            log.debug("Skipping already visited url {}", url);
            return;
        }

        RobotsDecision decision = robotsPolicyCache.check(url);
        if (!decision.isAllowed()) {
            job.recordBlocked();
            String reason = decision == RobotsDecision.UNAVAILABLE
                ? ReasonCodes.ROBOTS_UNAVAILABLE
                : ReasonCodes.ROBOTS_DISALLOWED;
            job.recordEvent(JobEvent.WARNING, reason, "blocked by robots policy", url);
            log.info("Blocked url={} reason={}", url, reason);
            return;
        }

        rateLimiter.awaitTurn(UrlCanonicalizer.domainOf(url));
        if (job.isCancelRequested()) {
            log.debug("Cancelled while waiting for a turn, not fetching {}", url);
            return;
        }
        log.info("Fetching {} page {}: {}", next.kind(), next.pageNumber(), url);
        FetchOutcome outcome = fetcher.fetch(url);
        if (job.isCancelRequested()) {
            log.debug("Discarding result for {} after cancellation", url);
            return;
        }
        if (outcome.isRedirect()) {
            followRedirect(job, next, outcome.redirectLocation(), frontier);
            return;
        }
        if (!outcome.isSuccessful()) {
            String reason = ReasonCodes.fromOutcome(outcome);
            job.addErrors(1);
            job.recordEvent(
                JobEvent.ERROR,
                reason,
                "fetch failed status=" + outcome.statusCode() + " attempts=" + outcome.attempts(),
                url
            );
            log.warn("Failed to fetch url={} status={} reason={} attempts={}", url, outcome.statusCode(), reason, outcome.attempts());
            return;
        }

        String pageUrl = outcome.finalUrlOrRequested();
        ParsedPage page;
        try {
            page = next.kind() == FrontierUrl.Kind.DETAIL_PAGE
                ? parser.parseDetail(outcome.body(), pageUrl, config)
                : parser.parse(outcome.body(), pageUrl, config);
        } catch (RuntimeException e) {
            job.recordPage(0, 1);
            job.recordEvent(JobEvent.ERROR, ReasonCodes.PARSE_FAILED, "parse failed: " + e.getMessage(), url);
            log.warn("Failed to parse url={}", url, e);
            return;
        }

        int emitted = 0;
        int sinkErrors = 0;
        for (ListingRecord record : page.records()) {
            try {
                recordSink.emit(job.id(), record);
                emitted++;
            } catch (RuntimeException e) {
                sinkErrors++;
                job.recordEvent(JobEvent.ERROR, ReasonCodes.SINK_FAILED, "record sink failed: " + e.getMessage(), record.sourceUrl());
                log.warn("Record sink failed for {}", record.sourceUrl(), e);
            }
        }
        for (String parseError : page.parseErrors()) {
            job.recordEvent(JobEvent.WARNING, ReasonCodes.PARSE_FIELD_MISSING, parseError, url);
        }
        job.recordPage(emitted, page.skippedRecords() + sinkErrors);

        if (next.kind() == FrontierUrl.Kind.LISTING_PAGE) {
            enqueueDiscovered(job, config, maxPages, next, page, frontier);
        }
    }

    /**
     * Queues the redirect target ahead of everything else. The target is a new frontier URL, so it
     * goes through dedup, the robots check for its own domain and that domain's rate limiter.
     */
    private void followRedirect(ScrapeJob job, FrontierUrl from, String target, Deque<FrontierUrl> frontier) {
        if (from.redirects() >= MAX_REDIRECTS) {
            job.addErrors(1);
            job.recordEvent(JobEvent.ERROR, ReasonCodes.TOO_MANY_REDIRECTS, "redirect limit reached, last location " + target, from.url());
            log.warn("Too many redirects url={} location={}", from.url(), target);
            return;
        }
        job.recordEvent(JobEvent.INFO, null, "redirected to " + target, from.url());
        log.info("Redirect {} -> {}", from.url(), target);
        frontier.addFirst(from.redirectedTo(target));
    }

    private void enqueueDiscovered(
        ScrapeJob job,
        SiteConfig config,
        int maxPages,
        FrontierUrl current,
        ParsedPage page,
        Deque<FrontierUrl> frontier
    ) {
        for (String detailUrl : page.detailUrls()) {
            if (!deduplicator.isVisited(job.id(), detailUrl)) {
                frontier.addLast(FrontierUrl.detailPage(detailUrl));
            }
        }
        if (current.pageNumber() >= maxPages) {
            log.info("Reached max pages {} for job {}", maxPages, job.id());
            return;
        }
        String nextPage;
        if (config.paginationType() == PaginationType.HTML_NEXT) {
            nextPage = page.nextUrl();
        } else {
            nextPage = page.isEmpty() ? null : PaginationUrls.pageUrl(config, config.startUrl(), current.pageNumber() + 1);
        }
        if (nextPage == null) {
            log.info("No more pages after page {}", current.pageNumber());
            return;
        }
        if (!deduplicator.isVisited(job.id(), nextPage)) {
            frontier.addLast(FrontierUrl.listingPage(nextPage, current.pageNumber() + 1));
        }
    }

    private void finish(ScrapeJob job, JobStatus status, String message) {
        if (job.tryTransitionTo(status, message)) {
            JobProgress progress = job.snapshot();
            job.recordEvent(
                status == JobStatus.FAILED ? JobEvent.ERROR : JobEvent.INFO,
                null,
                "job " + status.name().toLowerCase(Locale.ROOT),
                null
            );
            log.info(
                "Scrape job {} finished status={} urlsVisited={} recordsFound={} errors={} urlsBlocked={}",
                job.id(),
                status,
                progress.urlsVisited(),
                progress.recordsFound(),
                progress.errors(),
                progress.urlsBlocked()
            );
        }
    }
}
