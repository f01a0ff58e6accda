package com.realestate.scraper.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ScrapeJobNotFoundException extends RuntimeException {
    public ScrapeJobNotFoundException(String jobId) {
        super("Scrape job not found: " + jobId);
    }
}
