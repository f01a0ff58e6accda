package com.realestate.scraper.crawl.http;

import java.time.Duration;

/**
 * Blocking pause used for politeness delays and retry backoff, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = duration -> {
        long millis = duration.toMillis();
        if (millis > 0) {
            Thread.sleep(millis);
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
