package com.realestate.scraper.crawl.robots;

public enum RobotsDecision {
    ALLOWED,
    DISALLOWED,
    UNAVAILABLE;

    public boolean isAllowed() {
        return this == ALLOWED;
    }
}
