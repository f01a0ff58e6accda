package com.realestate.scraper.crawl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SiteConfig(
    String key,
    String name,
    String baseUrl,
    String startUrl,
    boolean active,
    String listingSelector,
    String listingLinkSelector,
    String linkPattern,
    String imageFilter,
    PaginationType paginationType,
    String nextPageSelector,
    String paginationParam,
    Integer maxPages,
    Map<String, FieldSelector> fields,
    Map<String, String> textPatterns
) {
    public SiteConfig {
        fields = fields == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        textPatterns = textPatterns == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(textPatterns));
        paginationType = paginationType == null ? PaginationType.HTML_NEXT : paginationType;
    }

    public SiteConfig(
        String key,
        String name,
        String baseUrl,
        String startUrl,
        boolean active,
        String listingSelector,
        String listingLinkSelector,
        String linkPattern,
        String imageFilter,
        PaginationType paginationType,
        String nextPageSelector,
        String paginationParam,
        Integer maxPages,
        Map<String, FieldSelector> fields
    ) {
        this(
            key,
            name,
            baseUrl,
            startUrl,
            active,
            listingSelector,
            listingLinkSelector,
            linkPattern,
            imageFilter,
            paginationType,
            nextPageSelector,
            paginationParam,
            maxPages,
            fields,
            Map.of()
        );
    }

    /**
     * Listing pages only yield links to detail pages; records are read from the detail pages.
     */
    public boolean usesDetailPages() {
        return listingLinkSelector != null && !listingLinkSelector.isBlank();
    }

    public List<String> requiredFields() {
        return fields.entrySet().stream()
            .filter(entry -> entry.getValue().required())
            .map(Map.Entry::getKey)
            .toList();
    }

    public SiteConfig withStartUrl(String url) {
        return new SiteConfig(
            key,
            name,
            baseUrl,
            url,
            active,
            listingSelector,
            listingLinkSelector,
            linkPattern,
            imageFilter,
            paginationType,
            nextPageSelector,
            paginationParam,
            maxPages,
            fields,
            textPatterns
        );
    }
}
