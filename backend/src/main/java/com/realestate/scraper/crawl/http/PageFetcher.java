package com.realestate.scraper.crawl.http;

import com.realestate.scraper.config.ScraperProperties;
import com.realestate.scraper.crawl.model.FetchClassification;
import com.realestate.scraper.crawl.model.FetchOutcome;
import com.realestate.scraper.crawl.util.UrlCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Issues single GET requests with the crawler's identifying User-Agent and retries transient
 * failures (429, 5xx, timeouts, I/O errors) with exponential backoff. Failures come back as a
 * {@link FetchOutcome}, never as exceptions. Redirects are reported, not followed, so every hop
 * goes through the caller's robots check and rate-limiter turn.
 */
@Service
public class PageFetcher {
    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);
    private static final Pattern IDENTIFIABLE_USER_AGENT = Pattern.compile(".+/.+\\s*\\(\\+.+\\)");
    private static final Pattern CHARSET = Pattern.compile("charset=\"?([\\w.:-]+)\"?", Pattern.CASE_INSENSITIVE);
    public static final String HTML_ACCEPT = "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8";

    private final ScraperProperties properties;
    private final HttpClient client;
    private final DomainRateLimiter rateLimiter;
    private final Sleeper sleeper;

    public PageFetcher(
        ScraperProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor,
        DomainRateLimiter rateLimiter,
        Sleeper sleeper
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.rateLimiter = rateLimiter;
        this.sleeper = sleeper;
        if (!IDENTIFIABLE_USER_AGENT.matcher(properties.getUserAgent()).matches()) {
            log.warn(
                "User-Agent '{}' does not follow the identifiable bot format 'BotName/Version (+contact: email)'",
                properties.getUserAgent()
            );
        }
    }

    public FetchOutcome fetch(String url) {
        return fetch(url, HTML_ACCEPT);
    }

    /**
     * Fetches {@code url}. The caller is expected to have taken a rate-limiter turn for the first
     * attempt; each retry waits its backoff and then takes a fresh turn.
     */
    public FetchOutcome fetch(String url, String acceptHeader) {
        int maxAttempts = 1 + properties.getMaxRetries();
        FetchOutcome last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1 && !waitBeforeRetry(url, attempt - 1)) {
                return last;
            }
            last = executeOnce(url, acceptHeader).withAttempts(attempt);
            if (!last.isRetriable() || attempt >= maxAttempts) {
                break;
            }
            log.debug(
                "retriable fetch url={} attempt={} status={} errorCode={}",
                url,
                attempt,
                last.statusCode(),
                last.errorCode()
            );
        }
        if (last != null && last.isRetriable()) {
            log.warn(
                "fetch retries exhausted url={} attempts={} status={} errorCode={}",
                url,
                last.attempts(),
                last.statusCode(),
                last.errorCode()
            );
        }
        return last;
    }

    private FetchOutcome executeOnce(String url, String acceptHeader) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorOutcome(url, startedAt, FetchOutcome.INVALID_URL, "URL missing host or malformed");
        }
        try {
            String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
            HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", safeAccept)
                .header("Accept-Language", "pt-PT,pt;q=0.9,en;q=0.8")
                .GET()
                .build();

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status == 429) {
                applyRetryAfter(uri, response);
            }
            FetchClassification classification = FetchClassification.fromStatus(status);
            String redirectLocation = null;
            if (isRedirectStatus(status)) {
                redirectLocation = redirectTarget(uri, response);
                classification = redirectLocation == null
                    ? FetchClassification.NON_RETRIABLE
                    : FetchClassification.REDIRECT;
            }
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            String body = null;
            if (classification == FetchClassification.SUCCESS && response.body() != null) {
                body = new String(response.body(), charsetOf(contentType));
            }
            return new FetchOutcome(
                url,
                response.uri(),
                status,
                body,
                contentType,
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                1,
                classification,
                null,
                null,
                redirectLocation
            );
        } catch (HttpTimeoutException e) {
            return errorOutcome(url, startedAt, FetchOutcome.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorOutcome(url, startedAt, FetchOutcome.IO_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorOutcome(url, startedAt, FetchOutcome.INTERRUPTED, e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorOutcome(url, startedAt, FetchOutcome.INVALID_URL, e.getMessage());
        }
    }

    private boolean waitBeforeRetry(String url, int retry) {
        Duration delay = BackoffPolicy.delayForAttempt(
            retry,
            Duration.ofMillis(properties.getBaseBackoffMs()),
            Duration.ofMillis(properties.getMaxBackoffMs())
        );
        try {
            sleeper.sleep(delay);
            String domain = UrlCanonicalizer.domainOf(url);
            if (domain != null) {
                rateLimiter.awaitTurn(domain);
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void applyRetryAfter(URI uri, HttpResponse<?> response) {
        String value = response.headers().firstValue("Retry-After").orElse(null);
        if (value == null || value.isBlank()) {
            return;
        }
        long seconds;
        try {
            seconds = Long.parseLong(value.trim());
        } catch (NumberFormatException ignored) {
            return;
        }
        long millis = seconds * 1000L;
        if (properties.getMaxBackoffMs() > 0) {
            millis = Math.min(millis, properties.getMaxBackoffMs());
        }
        String domain = UrlCanonicalizer.domainOf(uri.toString());
        if (domain != null) {
            rateLimiter.penalize(domain, Duration.ofMillis(millis));
        }
    }

    private static boolean isRedirectStatus(int status) {
        return status == 301 || status == 302 || status == 303 || status == 307 || status == 308;
    }

    private static String redirectTarget(URI requested, HttpResponse<?> response) {
        String location = response.headers().firstValue("Location").orElse(null);
        if (location == null || location.isBlank()) {
            return null;
        }
        try {
            URI target = requested.resolve(location.trim());
            if (target.getHost() == null) {
                return null;
            }
            String scheme = target.getScheme() == null ? "" : target.getScheme().toLowerCase(Locale.ROOT);
            return "http".equals(scheme) || "https".equals(scheme) ? target.toString() : null;
        } catch (IllegalArgumentException e) {
            log.debug("unusable redirect location url={} location={}", requested, location);
            return null;
        }
    }

    private Charset charsetOf(String contentType) {
        if (contentType == null) {
            return StandardCharsets.UTF_8;
        }
        Matcher matcher = CHARSET.matcher(contentType);
        if (matcher.find()) {
            try {
                return Charset.forName(matcher.group(1).toLowerCase(Locale.ROOT));
            } catch (IllegalArgumentException ignored) {
                return StandardCharsets.UTF_8;
            }
        }
        return StandardCharsets.UTF_8;
    }

    private FetchOutcome errorOutcome(String url, Instant startedAt, String code, String message) {
        return new FetchOutcome(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            1,
            FetchClassification.fromErrorCode(code),
            code,
            message,
            null
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        return UrlCanonicalizer.safeUri(value);
    }
}
