package com.realestate.scraper.crawl.robots;

import com.realestate.scraper.config.ScraperProperties;
import com.realestate.scraper.crawl.MutableClock;
import com.realestate.scraper.crawl.http.DomainRateLimiter;
import com.realestate.scraper.crawl.http.PageFetcher;
import com.realestate.scraper.crawl.model.RobotsPolicy;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RobotsPolicyCacheTest {
    private MockWebServer server;
    private ExecutorService httpExecutor;
    private ExecutorService callers;
    private ScraperProperties properties;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        httpExecutor = Executors.newFixedThreadPool(4);
        properties = new ScraperProperties();
        properties.setMinDelayMs(0);
        properties.setMaxDelayMs(0);
        properties.setMaxRetries(0);
        properties.setRequestTimeoutSeconds(5);
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        httpExecutor.shutdownNow();
        if (callers != null) {
            callers.shutdownNow();
        }
    }

    @Test
    void serverErrorDeniesEverythingOnTheDomain() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(500));
        RobotsPolicyCache cache = cache();

        assertThat(cache.check(url("/for-sale"))).isEqualTo(RobotsDecision.UNAVAILABLE);
        assertThat(cache.check(url("/for-rent"))).isEqualTo(RobotsDecision.UNAVAILABLE);
        assertThat(cache.isAllowed(url("/"))).isFalse();

        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/robots.txt");
    }

    @Test
    void missingRobotsFileIsTreatedAsUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThat(cache().check(url("/for-sale"))).isEqualTo(RobotsDecision.UNAVAILABLE);
    }

    @Test
    void htmlServedAsRobotsIsMalformed() {
        server.enqueue(new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/html")
            .setBody("<!DOCTYPE html><html><body>Welcome</body></html>"));

        RobotsPolicy policy = cache().resolve(server.url("/").uri());

        assertThat(policy.deniedAll()).isTrue();
    }

    @Test
    void parsedRulesAreCachedPerDomain() {
        server.enqueue(robots("User-agent: *\nDisallow: /private\n"));
        RobotsPolicyCache cache = cache();

        assertThat(cache.check(url("/private/offers"))).isEqualTo(RobotsDecision.DISALLOWED);
        assertThat(cache.check(url("/homes/1"))).isEqualTo(RobotsDecision.ALLOWED);
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void entryIsReloadedAfterTtl() {
        properties.getRobots().setTtlMinutes(60);
        server.enqueue(robots("User-agent: *\nDisallow: /a\n"));
        server.enqueue(robots("User-agent: *\nDisallow: /b\n"));
        RobotsPolicyCache cache = cache();

        assertThat(cache.check(url("/a"))).isEqualTo(RobotsDecision.DISALLOWED);
        clock.advance(Duration.ofMinutes(59));
        assertThat(cache.check(url("/b"))).isEqualTo(RobotsDecision.ALLOWED);
        assertThat(server.getRequestCount()).isEqualTo(1);

        clock.advance(Duration.ofMinutes(1));
        assertThat(cache.check(url("/b"))).isEqualTo(RobotsDecision.DISALLOWED);
        assertThat(cache.check(url("/a"))).isEqualTo(RobotsDecision.ALLOWED);
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void robotsRedirectIsFollowedHopByHop() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(301).setHeader("Location", "/robots-v2.txt"));
        server.enqueue(robots("User-agent: *\nDisallow: /private\n"));

        RobotsPolicyCache cache = cache();

        assertThat(cache.check(url("/private/1"))).isEqualTo(RobotsDecision.DISALLOWED);
        assertThat(cache.check(url("/homes/1"))).isEqualTo(RobotsDecision.ALLOWED);
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/robots.txt");
        assertThat(server.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/robots-v2.txt");
    }

    @Test
    void endlessRobotsRedirectsDenyTheDomain() {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return new MockResponse().setResponseCode(302).setHeader("Location", "/robots.txt?again");
            }
        });

        assertThat(cache().check(url("/homes/1"))).isEqualTo(RobotsDecision.UNAVAILABLE);
        assertThat(server.getRequestCount()).isEqualTo(6);
    }

    @Test
    void concurrentLookupsFetchRobotsOnce() throws Exception {
        server.setDispatcher(new Dispatcher() {
            @Override
            public MockResponse dispatch(RecordedRequest request) {
                return robots("User-agent: *\nAllow: /\n").setBodyDelay(200, TimeUnit.MILLISECONDS);
            }
        });
        RobotsPolicyCache cache = cache();
        callers = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        List<Future<RobotsDecision>> results = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            String path = "/listing/" + i;
            results.add(callers.submit(() -> {
                start.await();
                return cache.check(url(path));
            }));
        }
        start.countDown();
        for (Future<RobotsDecision> result : results) {
            assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo(RobotsDecision.ALLOWED);
        }

        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void crawlerTokenComesFromUserAgentProduct() {
        assertThat(RobotsPolicyCache.agentToken("RealEstateResearchBot/1.0 (+contact: a@b.c)"))
            .isEqualTo("realestateresearchbot");
        assertThat(RobotsPolicyCache.looksMalformed("User-agent: *\nDisallow: /x")).isFalse();
        assertThat(RobotsPolicyCache.looksMalformed("\u0000\u0000")).isTrue();
    }

    private RobotsPolicyCache cache() {
        DomainRateLimiter limiter = new DomainRateLimiter(properties, clock, clock::advance);
        PageFetcher fetcher = new PageFetcher(properties, httpExecutor, limiter, duration -> { });
        return new RobotsPolicyCache(properties, fetcher, limiter, clock);
    }

    private String url(String path) {
        return server.url(path).toString();
    }

    private static MockResponse robots(String body) {
        return new MockResponse()
            .setResponseCode(200)
            .setHeader("Content-Type", "text/plain")
            .setBody(body);
    }
}
