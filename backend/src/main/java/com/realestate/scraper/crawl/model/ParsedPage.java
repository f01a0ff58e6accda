package com.realestate.scraper.crawl.model;

import java.util.List;

/**
 * Result of parsing one fetched page. {@code parseErrors} holds one message per listing element
 * that was skipped because a required field was missing.
 */
public record ParsedPage(
    List<ListingRecord> records,
    String nextUrl,
    List<String> detailUrls,
    List<String> parseErrors
) {
    public ParsedPage {
        records = records == null ? List.of() : List.copyOf(records);
        detailUrls = detailUrls == null ? List.of() : List.copyOf(detailUrls);
        parseErrors = parseErrors == null ? List.of() : List.copyOf(parseErrors);
    }

    public static ParsedPage empty() {
        return new ParsedPage(List.of(), null, List.of(), List.of());
    }

    public int skippedRecords() {
        return parseErrors.size();
    }

    public boolean isEmpty() {
        return records.isEmpty() && detailUrls.isEmpty() && parseErrors.isEmpty();
    }
}
