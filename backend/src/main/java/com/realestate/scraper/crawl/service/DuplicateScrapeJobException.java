package com.realestate.scraper.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class DuplicateScrapeJobException extends RuntimeException {
    public DuplicateScrapeJobException(String message) {
        super(message);
    }
}
