package com.realestate.scraper.crawl.model;

import com.realestate.scraper.crawl.robots.RobotsRules;

import java.time.Instant;

/**
 * Cached robots decision for one domain. A {@code deniedAll} policy is what a failed robots.txt
 * load leaves behind until the entry expires.
 */
public record RobotsPolicy(
    String domain,
    RobotsRules rules,
    boolean deniedAll,
    Instant fetchedAt,
    Instant expiresAt
) {
    public static RobotsPolicy loaded(String domain, RobotsRules rules, Instant fetchedAt, Instant expiresAt) {
        return new RobotsPolicy(domain, rules, false, fetchedAt, expiresAt);
    }

    public static RobotsPolicy denyAll(String domain, Instant fetchedAt, Instant expiresAt) {
        return new RobotsPolicy(domain, RobotsRules.disallowAll(), true, fetchedAt, expiresAt);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean isAllowed(String pathAndQuery) {
        if (deniedAll) {
            return false;
        }
        return rules.isAllowed(pathAndQuery);
    }
}
