package com.realestate.scraper.crawl.model;

/**
 * A queued URL. {@code redirects} counts the hops already taken to reach it, so redirect chains
 * stay bounded even when every hop is a new URL.
 */
public record FrontierUrl(String url, Kind kind, int pageNumber, int redirects) {

    public enum Kind {
        LISTING_PAGE,
        DETAIL_PAGE
    }

    public static FrontierUrl listingPage(String url, int pageNumber) {
        return new FrontierUrl(url, Kind.LISTING_PAGE, pageNumber, 0);
    }

    public static FrontierUrl detailPage(String url) {
        return new FrontierUrl(url, Kind.DETAIL_PAGE, 0, 0);
    }

    public FrontierUrl redirectedTo(String target) {
        return new FrontierUrl(target, kind, pageNumber, redirects + 1);
    }
}
