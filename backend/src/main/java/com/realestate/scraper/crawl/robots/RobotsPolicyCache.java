package com.realestate.scraper.crawl.robots;

import com.realestate.scraper.config.ScraperProperties;
import com.realestate.scraper.crawl.http.DomainRateLimiter;
import com.realestate.scraper.crawl.http.PageFetcher;
import com.realestate.scraper.crawl.model.FetchOutcome;
import com.realestate.scraper.crawl.model.RobotsPolicy;
import com.realestate.scraper.crawl.util.UrlCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide robots.txt cache keyed by domain. A load failure of any kind caches a deny-all
 * policy for the full TTL; there is no fail-open mode.
 */
@Service
public class RobotsPolicyCache {
    private static final Logger log = LoggerFactory.getLogger(RobotsPolicyCache.class);
    private static final String ROBOTS_ACCEPT = "text/plain,text/*;q=0.9,*/*;q=0.1";
    private static final Duration MAX_CRAWL_DELAY = Duration.ofSeconds(60);
    private static final int MAX_ROBOTS_REDIRECTS = 5;

    private final ScraperProperties properties;
    private final PageFetcher fetcher;
    private final DomainRateLimiter rateLimiter;
    private final Clock clock;
    private final String agentToken;
    private final Map<String, RobotsPolicy> policies = new ConcurrentHashMap<>();
    private final Map<String, Object> domainLocks = new ConcurrentHashMap<>();

    public RobotsPolicyCache(
        ScraperProperties properties,
        PageFetcher fetcher,
        DomainRateLimiter rateLimiter,
        Clock clock
    ) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
        this.agentToken = agentToken(properties.getUserAgent());
    }

    public RobotsPolicy resolve(String domain) {
        return resolve(URI.create("https://" + domain + "/"));
    }

    /**
     * Returns the cached policy for the domain of {@code uri}, loading robots.txt on a miss or
     * after expiry. Loads for one domain are serialized; other domains are unaffected.
     */
    public RobotsPolicy resolve(URI uri) {
        String domain = UrlCanonicalizer.domainOf(uri.toString());
        if (domain == null) {
            throw new IllegalArgumentException("URL has no host: " + uri);
        }
        RobotsPolicy cached = policies.get(domain);
        if (cached != null && !cached.isExpired(clock.instant())) {
            return cached;
        }
        Object lock = domainLocks.computeIfAbsent(domain, ignored -> new Object());
        synchronized (lock) {
            cached = policies.get(domain);
            if (cached != null && !cached.isExpired(clock.instant())) {
                return cached;
            }
            String scheme = uri.getScheme() == null ? "https" : uri.getScheme().toLowerCase(Locale.ROOT);
            RobotsPolicy loaded = load(domain, scheme);
            policies.put(domain, loaded);
            return loaded;
        }
    }

    public RobotsDecision check(String url) {
        URI uri = UrlCanonicalizer.safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return RobotsDecision.DISALLOWED;
        }
        RobotsPolicy policy = resolve(uri);
        if (policy.deniedAll()) {
            return RobotsDecision.UNAVAILABLE;
        }
        return policy.isAllowed(UrlCanonicalizer.pathAndQuery(uri))
            ? RobotsDecision.ALLOWED
            : RobotsDecision.DISALLOWED;
    }

    public boolean isAllowed(String url) {
        return check(url).isAllowed();
    }

    public boolean isAllowed(String domain, String path) {
        RobotsPolicy policy = resolve(domain);
        return policy.isAllowed(path);
    }

    private RobotsPolicy load(String domain, String scheme) {
        String robotsUrl = scheme + "://" + domain + "/robots.txt";
        Instant startedAt = clock.instant();
        Instant expiresAt = startedAt.plus(Duration.ofMinutes(properties.getRobots().getTtlMinutes()));
        FetchOutcome fetch;
        String target = robotsUrl;
        int redirects = 0;
        while (true) {
            try {
                rateLimiter.awaitTurn(UrlCanonicalizer.domainOf(target));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                // Denied for this call only: an already-expired entry is reloaded on the next lookup.
                return RobotsPolicy.denyAll(domain, startedAt, startedAt);
            }
            fetch = fetcher.fetch(target, ROBOTS_ACCEPT);
            if (!fetch.isRedirect()) {
                break;
            }
            if (redirects >= MAX_ROBOTS_REDIRECTS) {
                log.warn("robots redirect limit reached host={} lastLocation={} decision=disallow_all", domain, fetch.redirectLocation());
                return RobotsPolicy.denyAll(domain, startedAt, expiresAt);
            }
            redirects++;
            target = fetch.redirectLocation();
            log.debug("robots redirect host={} hop={} location={}", domain, redirects, target);
        }
        if (!fetch.isSuccessful()) {
            log.warn(
                "robots fetch failed host={} status={} errorCode={} errorMessage={} attempts={} decision=disallow_all",
                domain,
                fetch.statusCode(),
                fetch.errorCode(),
                fetch.errorMessage(),
                fetch.attempts()
            );
            return RobotsPolicy.denyAll(domain, startedAt, expiresAt);
        }
        String body = fetch.body() == null ? "" : fetch.body();
        if (looksMalformed(body)) {
            log.warn("robots content malformed host={} contentType={} decision=disallow_all", domain, fetch.contentType());
            return RobotsPolicy.denyAll(domain, startedAt, expiresAt);
        }

        RobotsRules rules = RobotsRules.parse(body, agentToken);
        if (rules.getCrawlDelaySeconds() != null) {
            Duration crawlDelay = Duration.ofSeconds(rules.getCrawlDelaySeconds());
            rateLimiter.applyCrawlDelay(domain, crawlDelay.compareTo(MAX_CRAWL_DELAY) > 0 ? MAX_CRAWL_DELAY : crawlDelay);
        }
        log.info(
            "Loaded robots host={} rules={} sitemaps={} agent={}",
            domain,
            rules.getRules().size(),
            rules.getSitemapUrls().size(),
            agentToken
        );
        return RobotsPolicy.loaded(domain, rules, startedAt, expiresAt);
    }

    static boolean looksMalformed(String body) {
        if (body.indexOf('\u0000') >= 0) {
            return true;
        }
        String head = body.stripLeading().toLowerCase(Locale.ROOT);
        return head.startsWith("<!doctype html") || head.startsWith("<html") || head.contains("<body");
    }

    static String agentToken(String userAgent) {
        return RobotsRules.productToken(userAgent);
    }
}
