package com.realestate.scraper.crawl.api;

public record ScrapeJobLaunchRequest(
    String jobId,
    String siteKey,
    String startUrl,
    Integer maxPages
) {
}
