package com.realestate.scraper.crawl.model;

/**
 * Launch request for a job identified by site key. {@code startUrl} and {@code maxPages} override
 * the site configuration when present.
 */
public record ScrapeJobRequest(
    String jobId,
    String siteKey,
    String startUrl,
    Integer maxPages
) {
    public static ScrapeJobRequest forSite(String jobId, String siteKey) {
        return new ScrapeJobRequest(jobId, siteKey, null, null);
    }
}
