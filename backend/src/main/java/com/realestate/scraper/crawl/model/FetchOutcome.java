package com.realestate.scraper.crawl.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record FetchOutcome(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    int attempts,
    FetchClassification classification,
    String errorCode,
    String errorMessage,
    String redirectLocation
) {
    public static final String TIMEOUT = "timeout";
    public static final String IO_ERROR = "io_error";
    public static final String INVALID_URL = "invalid_url";
    public static final String INTERRUPTED = "interrupted";

    public boolean isSuccessful() {
        return classification == FetchClassification.SUCCESS;
    }

    public boolean isRetriable() {
        return classification == FetchClassification.RETRIABLE;
    }

    /**
     * True for a 3xx answer with a usable {@code Location}; {@link #redirectLocation()} is then the
     * absolute target. Redirects are never followed by the fetcher itself.
     */
    public boolean isRedirect() {
        return classification == FetchClassification.REDIRECT && redirectLocation != null;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }

    public FetchOutcome withAttempts(int attemptCount) {
        return new FetchOutcome(
            requestedUrl,
            finalUri,
            statusCode,
            body,
            contentType,
            fetchedAt,
            duration,
            attemptCount,
            classification,
            errorCode,
            errorMessage,
            redirectLocation
        );
    }
}
