package com.realestate.scraper.crawl.http;

import com.realestate.scraper.config.ScraperProperties;
import com.realestate.scraper.crawl.model.DomainRateState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Spaces out requests to the same domain by a random delay drawn from
 * {@code [minDelayMs, maxDelayMs]}. Each domain has its own state and turn lock, so callers for one
 * domain queue behind each other while other domains proceed independently.
 */
@Component
public class DomainRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(DomainRateLimiter.class);

    private final ScraperProperties properties;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<String, DomainRateState> states = new ConcurrentHashMap<>();

    public DomainRateLimiter(ScraperProperties properties, Clock clock, Sleeper sleeper) {
        this.properties = properties;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    /**
     * Blocks until a request to {@code domain} may be issued, then records it as the domain's last
     * request before returning.
     *
     * @return the instant recorded as the new last request
     */
    public Instant awaitTurn(String domain) throws InterruptedException {
        DomainRateState state = stateFor(domain);
        synchronized (state.turnLock()) {
            long delayMs = randomDelayMs(state);
            Instant now = clock.instant();
            Instant allowedAt = nextAllowedAt(state, delayMs);
            while (allowedAt != null && now.isBefore(allowedAt)) {
                Duration wait = Duration.between(now, allowedAt);
                log.debug("rate limit wait domain={} waitMs={}", state.domain(), wait.toMillis());
                sleeper.sleep(wait);
                now = clock.instant();
                // A penalty may have arrived while sleeping.
                allowedAt = nextAllowedAt(state, delayMs);
            }
            state.recordRequest(now);
            return now;
        }
    }

    /**
     * Pushes the next allowed request for {@code domain} to at least {@code now + duration}.
     */
    public void penalize(String domain, Duration duration) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            return;
        }
        DomainRateState state = stateFor(domain);
        state.extendNotBefore(clock.instant().plus(duration));
        log.info("rate limit penalty domain={} durationMs={}", state.domain(), duration.toMillis());
    }

    /**
     * Raises the spacing for {@code domain} to at least the robots.txt {@code Crawl-delay}.
     */
    public void applyCrawlDelay(String domain, Duration crawlDelay) {
        if (crawlDelay == null || crawlDelay.isNegative()) {
            return;
        }
        DomainRateState state = stateFor(domain);
        state.setCrawlDelayMs(crawlDelay.toMillis());
        if (crawlDelay.toMillis() > state.minDelayMs()) {
            log.info("robots crawl-delay applied domain={} delayMs={}", state.domain(), crawlDelay.toMillis());
        }
    }

    public Instant lastRequestAt(String domain) {
        DomainRateState state = states.get(key(domain));
        return state == null ? null : state.lastRequestAt();
    }

    private Instant nextAllowedAt(DomainRateState state, long delayMs) {
        Instant last = state.lastRequestAt();
        Instant allowedAt = last == null ? null : last.plusMillis(delayMs);
        Instant notBefore = state.notBefore();
        if (notBefore != null && (allowedAt == null || notBefore.isAfter(allowedAt))) {
            allowedAt = notBefore;
        }
        return allowedAt;
    }

    private long randomDelayMs(DomainRateState state) {
        long min = state.minDelayMs();
        long max = state.maxDelayMs();
        long delay = max <= min ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
        return Math.max(delay, state.crawlDelayMs());
    }

    private DomainRateState stateFor(String domain) {
        String key = key(domain);
        return states.computeIfAbsent(
            key,
            ignored -> new DomainRateState(key, properties.getMinDelayMs(), properties.getMaxDelayMs())
        );
    }

    private String key(String domain) {
        return domain == null ? "" : domain.toLowerCase(Locale.ROOT);
    }
}
