package com.realestate.scraper.crawl.util;

import com.realestate.scraper.crawl.model.PaginationType;
import com.realestate.scraper.crawl.model.SiteConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds listing-page URLs for sites whose pagination is generated rather than linked.
 */
public final class PaginationUrls {

    private PaginationUrls() {
    }

    /**
     * URL of listing page {@code pageNumber} (1-based) derived from the start URL, or {@code null}
     * for {@link PaginationType#HTML_NEXT} sites.
     */
    public static String pageUrl(SiteConfig config, String startUrl, int pageNumber) {
        return switch (config.paginationType()) {
            case QUERY_PARAM -> withQueryParam(startUrl, config.paginationParam(), pageNumber);
            case INCREMENTAL_PATH -> withPathSuffix(startUrl, pageNumber);
            case HTML_NEXT -> null;
        };
    }

    static String withQueryParam(String url, String param, int pageNumber) {
        int fragmentIdx = url.indexOf('#');
        String base = fragmentIdx >= 0 ? url.substring(0, fragmentIdx) : url;
        int queryIdx = base.indexOf('?');
        if (queryIdx < 0) {
            return base + "?" + param + "=" + pageNumber;
        }
        String path = base.substring(0, queryIdx);
        List<String> parts = new ArrayList<>();
        boolean replaced = false;
        for (String part : base.substring(queryIdx + 1).split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            String name = part.contains("=") ? part.substring(0, part.indexOf('=')) : part;
            if (name.equals(param)) {
                parts.add(param + "=" + pageNumber);
                replaced = true;
            } else {
                parts.add(part);
            }
        }
        if (!replaced) {
            parts.add(param + "=" + pageNumber);
        }
        return path + "?" + String.join("&", parts);
    }

    static String withPathSuffix(String url, int pageNumber) {
        String base = url;
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/" + pageNumber;
    }
}
