package com.realestate.scraper.crawl.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ListingRecord(
    String siteKey,
    String sourceUrl,
    String title,
    String price,
    String address,
    String description,
    Map<String, String> attributes,
    List<String> imageUrls,
    List<String> imageAltTexts,
    PageMetadata pageMetadata
) {
    public static final String TITLE = "title";
    public static final String PRICE = "price";
    public static final String ADDRESS = "address";
    public static final String DESCRIPTION = "description";
    public static final String IMAGE = "image";

    public ListingRecord {
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        imageUrls = imageUrls == null ? List.of() : List.copyOf(imageUrls);
        imageAltTexts = imageAltTexts == null ? List.of() : List.copyOf(imageAltTexts);
    }
}
