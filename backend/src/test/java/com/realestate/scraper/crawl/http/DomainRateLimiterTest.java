package com.realestate.scraper.crawl.http;

import com.realestate.scraper.config.ScraperProperties;
import com.realestate.scraper.crawl.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DomainRateLimiterTest {
    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private ExecutorService executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void concurrentCallersForOneDomainAreSpacedByMinDelay() throws Exception {
        MutableClock clock = new MutableClock(START);
        DomainRateLimiter limiter = new DomainRateLimiter(properties(1000, 1500), clock, clock::advance);
        executor = Executors.newFixedThreadPool(6);

        List<Future<Instant>> futures = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            futures.add(executor.submit(() -> limiter.awaitTurn("listings.example.com")));
        }
        List<Instant> granted = new ArrayList<>();
        for (Future<Instant> future : futures) {
            granted.add(future.get(5, TimeUnit.SECONDS));
        }
        Collections.sort(granted);

        assertThat(granted.get(0)).isEqualTo(START);
        for (int i = 1; i < granted.size(); i++) {
            Duration gap = Duration.between(granted.get(i - 1), granted.get(i));
            assertThat(gap).isGreaterThanOrEqualTo(Duration.ofMillis(1000));
            assertThat(gap).isLessThanOrEqualTo(Duration.ofMillis(1500));
        }
    }

    @Test
    void waitingOnOneDomainDoesNotBlockAnother() throws Exception {
        MutableClock clock = new MutableClock(START);
        CountDownLatch sleeping = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Sleeper blockingSleeper = duration -> {
            sleeping.countDown();
            release.await();
            clock.advance(duration);
        };
        DomainRateLimiter limiter = new DomainRateLimiter(properties(2000, 2000), clock, blockingSleeper);
        executor = Executors.newFixedThreadPool(2);

        limiter.awaitTurn("a.example.com");
        Future<Instant> blocked = executor.submit(() -> limiter.awaitTurn("a.example.com"));
        assertThat(sleeping.await(5, TimeUnit.SECONDS)).isTrue();

        Instant other = CompletableFuture.supplyAsync(() -> {
            try {
                return limiter.awaitTurn("b.example.com");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }, executor).get(2, TimeUnit.SECONDS);

        assertThat(other).isEqualTo(START);
        assertThat(blocked.isDone()).isFalse();

        release.countDown();
        assertThat(blocked.get(5, TimeUnit.SECONDS)).isEqualTo(START.plusMillis(2000));
    }

    @Test
    void penaltyPushesNextTurnBack() throws Exception {
        MutableClock clock = new MutableClock(START);
        DomainRateLimiter limiter = new DomainRateLimiter(properties(0, 0), clock, clock::advance);

        limiter.awaitTurn("example.com");
        limiter.penalize("example.com", Duration.ofSeconds(30));
        Instant next = limiter.awaitTurn("example.com");

        assertThat(next).isEqualTo(START.plusSeconds(30));
        assertThat(limiter.lastRequestAt("EXAMPLE.com")).isEqualTo(next);
    }

    @Test
    void penaltyDuringWaitIsNotBlockedAndExtendsTheWait() throws Exception {
        MutableClock clock = new MutableClock(START);
        CountDownLatch sleeping = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Sleeper blockingSleeper = duration -> {
            sleeping.countDown();
            release.await();
            clock.advance(duration);
        };
        DomainRateLimiter limiter = new DomainRateLimiter(properties(2000, 2000), clock, blockingSleeper);
        executor = Executors.newFixedThreadPool(2);

        limiter.awaitTurn("example.com");
        Future<Instant> waiting = executor.submit(() -> limiter.awaitTurn("example.com"));
        assertThat(sleeping.await(5, TimeUnit.SECONDS)).isTrue();

        CompletableFuture.runAsync(() -> limiter.penalize("example.com", Duration.ofSeconds(30)), executor)
            .get(2, TimeUnit.SECONDS);
        assertThat(waiting.isDone()).isFalse();

        release.countDown();
        assertThat(waiting.get(5, TimeUnit.SECONDS)).isEqualTo(START.plusSeconds(30));
    }

    @Test
    void crawlDelayRaisesSpacingAboveConfiguredDelay() throws Exception {
        MutableClock clock = new MutableClock(START);
        DomainRateLimiter limiter = new DomainRateLimiter(properties(100, 200), clock, clock::advance);

        limiter.applyCrawlDelay("example.com", Duration.ofSeconds(10));
        Instant first = limiter.awaitTurn("example.com");
        Instant second = limiter.awaitTurn("example.com");

        assertThat(Duration.between(first, second)).isEqualTo(Duration.ofSeconds(10));
    }

    private ScraperProperties properties(long minDelayMs, long maxDelayMs) {
        ScraperProperties properties = new ScraperProperties();
        properties.setMinDelayMs(minDelayMs);
        properties.setMaxDelayMs(maxDelayMs);
        return properties;
    }
}
