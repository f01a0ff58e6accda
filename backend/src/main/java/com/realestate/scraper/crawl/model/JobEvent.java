package com.realestate.scraper.crawl.model;

import java.time.Instant;

public record JobEvent(
    Instant at,
    String level,
    String reasonCode,
    String message,
    String url
) {
    public static final String INFO = "info";
    public static final String WARNING = "warning";
    public static final String ERROR = "error";
}
