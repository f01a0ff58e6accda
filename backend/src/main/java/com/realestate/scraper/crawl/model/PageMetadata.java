package com.realestate.scraper.crawl.model;

import java.util.List;

/**
 * SEO elements of a detail page: the {@code <title>}, the meta description and every non-empty
 * heading in document order.
 */
public record PageMetadata(String pageTitle, String metaDescription, List<Heading> headings) {

    public PageMetadata {
        headings = headings == null ? List.of() : List.copyOf(headings);
    }

    public record Heading(String level, String text) {
    }
}
