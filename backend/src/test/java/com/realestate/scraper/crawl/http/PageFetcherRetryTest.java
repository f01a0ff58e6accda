package com.realestate.scraper.crawl.http;

import com.realestate.scraper.config.ScraperProperties;
import com.realestate.scraper.crawl.model.FetchClassification;
import com.realestate.scraper.crawl.model.FetchOutcome;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

class PageFetcherRetryTest {
    private MockWebServer server;
    private ExecutorService executor;
    private ScraperProperties properties;
    private final List<Duration> backoffSleeps = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = new ScraperProperties();
        properties.setMinDelayMs(0);
        properties.setMaxDelayMs(0);
        properties.setRequestTimeoutSeconds(5);
        properties.setMaxRetries(3);
        properties.setBaseBackoffMs(10);
        properties.setMaxBackoffMs(25);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void retriesServerErrorsThenReturnsBody() {
        server.enqueue(new MockResponse().setResponseCode(500));
        server.enqueue(new MockResponse().setResponseCode(502));
        server.enqueue(new MockResponse().setResponseCode(503));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>ok</html>"));

        FetchOutcome outcome = fetcher().fetch(server.url("/listings").toString());

        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.statusCode()).isEqualTo(200);
        assertThat(outcome.attempts()).isEqualTo(4);
        assertThat(outcome.body()).isEqualTo("<html>ok</html>");
        assertThat(server.getRequestCount()).isEqualTo(4);
        assertThat(backoffSleeps).containsExactly(
            Duration.ofMillis(10),
            Duration.ofMillis(20),
            Duration.ofMillis(25)
        );
    }

    @Test
    void redirectIsReportedInsteadOfFollowed() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/moved?id=4"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("should not be requested"));

        FetchOutcome outcome = fetcher().fetch(server.url("/listings").toString());

        assertThat(outcome.isRedirect()).isTrue();
        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.statusCode()).isEqualTo(302);
        assertThat(outcome.redirectLocation()).isEqualTo(server.url("/moved?id=4").toString());
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(backoffSleeps).isEmpty();
    }

    @Test
    void redirectWithoutLocationIsNonRetriable() {
        server.enqueue(new MockResponse().setResponseCode(301));

        FetchOutcome outcome = fetcher().fetch(server.url("/listings").toString());

        assertThat(outcome.isRedirect()).isFalse();
        assertThat(outcome.classification()).isEqualTo(FetchClassification.NON_RETRIABLE);
    }

    @Test
    void forbiddenIsReturnedImmediatelyWithoutBody() {
        server.enqueue(new MockResponse().setResponseCode(403).setBody("go away"));

        FetchOutcome outcome = fetcher().fetch(server.url("/private").toString());

        assertThat(outcome.classification()).isEqualTo(FetchClassification.NON_RETRIABLE);
        assertThat(outcome.statusCode()).isEqualTo(403);
        assertThat(outcome.body()).isNull();
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(server.getRequestCount()).isEqualTo(1);
        assertThat(backoffSleeps).isEmpty();
    }

    @Test
    void exhaustedRetriesComeBackAsFailureOutcome() {
        properties.setMaxRetries(2);
        for (int i = 0; i < 3; i++) {
            server.enqueue(new MockResponse().setResponseCode(503));
        }

        FetchOutcome outcome = fetcher().fetch(server.url("/busy").toString());

        assertThat(outcome.isSuccessful()).isFalse();
        assertThat(outcome.isRetriable()).isTrue();
        assertThat(outcome.statusCode()).isEqualTo(503);
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void sendsConfiguredUserAgent() throws Exception {
        properties.setUserAgent("ListingsBot/2.1 (+contact: ops@example.org)");
        server.enqueue(new MockResponse().setResponseCode(200).setBody("ok"));

        fetcher().fetch(server.url("/ua").toString());

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request).isNotNull();
        assertThat(request.getHeader("User-Agent")).isEqualTo("ListingsBot/2.1 (+contact: ops@example.org)");
    }

    @Test
    void retryAfterOn429PenalizesDomain() {
        properties.setMaxRetries(0);
        properties.setMaxBackoffMs(60_000);
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "7"));
        DomainRateLimiter limiter = Mockito.mock(DomainRateLimiter.class);

        FetchOutcome outcome = new PageFetcher(properties, executor, limiter, backoffSleeps::add)
            .fetch(server.url("/slow-down").toString());

        assertThat(outcome.statusCode()).isEqualTo(429);
        verify(limiter).penalize(anyString(), eq(Duration.ofSeconds(7)));
    }

    @Test
    void malformedUrlIsNotRetried() {
        FetchOutcome outcome = fetcher().fetch("http://bad host/with spaces");

        assertThat(outcome.errorCode()).isEqualTo(FetchOutcome.INVALID_URL);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(server.getRequestCount()).isZero();
    }

    private PageFetcher fetcher() {
        DomainRateLimiter limiter = new DomainRateLimiter(properties, Clock.systemUTC(), duration -> { });
        return new PageFetcher(properties, executor, limiter, backoffSleeps::add);
    }
}
