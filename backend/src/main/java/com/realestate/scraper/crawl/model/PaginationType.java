package com.realestate.scraper.crawl.model;

import java.util.Locale;

public enum PaginationType {
    HTML_NEXT,
    QUERY_PARAM,
    INCREMENTAL_PATH;

    public static PaginationType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return HTML_NEXT;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (PaginationType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown pagination type: " + value);
    }
}
