package com.realestate.scraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT = "RealEstateResearchBot/1.0 (+contact: you@example.com)";

    private String userAgent;
    private long minDelayMs = 2000;
    private long maxDelayMs = 5000;
    private int requestTimeoutSeconds = 30;
    private int maxRetries = 3;
    private long baseBackoffMs = 1000;
    private long maxBackoffMs = 30000;
    private int jobConcurrency = 4;
    private int defaultMaxPages = 10;
    private int maxEventsPerJob = 200;
    private int maxRetainedJobs = 500;
    private Robots robots = new Robots();
    private List<Site> sites = new ArrayList<>();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public long getMinDelayMs() {
        return Math.max(0, minDelayMs);
    }

    public void setMinDelayMs(long minDelayMs) {
        this.minDelayMs = Math.max(0, minDelayMs);
    }

    /**
     * Upper bound of the randomized per-request delay; never below {@link #getMinDelayMs()}.
     */
    public long getMaxDelayMs() {
        return Math.max(getMinDelayMs(), maxDelayMs);
    }

    public void setMaxDelayMs(long maxDelayMs) {
        this.maxDelayMs = Math.max(0, maxDelayMs);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = requestTimeoutSeconds;
    }

    public int getMaxRetries() {
        return Math.max(0, maxRetries);
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = Math.max(0, maxRetries);
    }

    public long getBaseBackoffMs() {
        return Math.max(0, baseBackoffMs);
    }

    public void setBaseBackoffMs(long baseBackoffMs) {
        this.baseBackoffMs = Math.max(0, baseBackoffMs);
    }

    public long getMaxBackoffMs() {
        return maxBackoffMs;
    }

    public void setMaxBackoffMs(long maxBackoffMs) {
        this.maxBackoffMs = maxBackoffMs;
    }

    public int getJobConcurrency() {
        return Math.max(1, jobConcurrency);
    }

    public void setJobConcurrency(int jobConcurrency) {
        this.jobConcurrency = Math.max(1, jobConcurrency);
    }

    public int getDefaultMaxPages() {
        return Math.max(1, defaultMaxPages);
    }

    public void setDefaultMaxPages(int defaultMaxPages) {
        this.defaultMaxPages = Math.max(1, defaultMaxPages);
    }

    public int getMaxEventsPerJob() {
        return Math.max(1, maxEventsPerJob);
    }

    public void setMaxEventsPerJob(int maxEventsPerJob) {
        this.maxEventsPerJob = maxEventsPerJob;
    }

    /**
     * Upper bound on registered jobs. Finished jobs beyond it are evicted oldest first; jobs that
     * have not finished are never evicted.
     */
    public int getMaxRetainedJobs() {
        return Math.max(1, maxRetainedJobs);
    }

    public void setMaxRetainedJobs(int maxRetainedJobs) {
        this.maxRetainedJobs = maxRetainedJobs;
    }

    public Robots getRobots() {
        return robots;
    }

    public void setRobots(Robots robots) {
        this.robots = robots;
    }

    public List<Site> getSites() {
        return sites;
    }

    public void setSites(List<Site> sites) {
        this.sites = sites == null ? new ArrayList<>() : sites;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Robots {
        private int ttlMinutes = 60;

        public int getTtlMinutes() {
            return Math.max(1, ttlMinutes);
        }

        public void setTtlMinutes(int ttlMinutes) {
            this.ttlMinutes = ttlMinutes;
        }
    }

    /**
     * Site configuration as bound from {@code scraper.sites[*]}. Converted into an immutable
     * {@link com.realestate.scraper.crawl.model.SiteConfig} by the site-config provider.
     */
    public static class Site {
        private String key;
        private String name;
        private String baseUrl;
        private String startUrl;
        private boolean active = true;
        private String listingSelector;
        private String listingLinkSelector;
        private String linkPattern;
        private String imageFilter;
        private String paginationType = "html_next";
        private String nextPageSelector;
        private String paginationParam;
        private Integer maxPages;
        private Map<String, Field> fields = new LinkedHashMap<>();
        private Map<String, String> textPatterns = new LinkedHashMap<>();

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getStartUrl() {
            return startUrl;
        }

        public void setStartUrl(String startUrl) {
            this.startUrl = startUrl;
        }

        public boolean isActive() {
            return active;
        }

        public void setActive(boolean active) {
            this.active = active;
        }

        public String getListingSelector() {
            return listingSelector;
        }

        public void setListingSelector(String listingSelector) {
            this.listingSelector = listingSelector;
        }

        public String getListingLinkSelector() {
            return listingLinkSelector;
        }

        public void setListingLinkSelector(String listingLinkSelector) {
            this.listingLinkSelector = listingLinkSelector;
        }

        public String getLinkPattern() {
            return linkPattern;
        }

        public void setLinkPattern(String linkPattern) {
            this.linkPattern = linkPattern;
        }

        public String getImageFilter() {
            return imageFilter;
        }

        public void setImageFilter(String imageFilter) {
            this.imageFilter = imageFilter;
        }

        public String getPaginationType() {
            return paginationType;
        }

        public void setPaginationType(String paginationType) {
            this.paginationType = paginationType;
        }

        public String getNextPageSelector() {
            return nextPageSelector;
        }

        public void setNextPageSelector(String nextPageSelector) {
            this.nextPageSelector = nextPageSelector;
        }

        public String getPaginationParam() {
            return paginationParam;
        }

        public void setPaginationParam(String paginationParam) {
            this.paginationParam = paginationParam;
        }

        public Integer getMaxPages() {
            return maxPages;
        }

        public void setMaxPages(Integer maxPages) {
            this.maxPages = maxPages;
        }

        public Map<String, Field> getFields() {
            return fields;
        }

        public void setFields(Map<String, Field> fields) {
            this.fields = fields == null ? new LinkedHashMap<>() : fields;
        }

        public Map<String, String> getTextPatterns() {
            return textPatterns;
        }

        public void setTextPatterns(Map<String, String> textPatterns) {
            this.textPatterns = textPatterns == null ? new LinkedHashMap<>() : textPatterns;
        }
    }

    public static class Field {
        private String selector;
        private String attribute;
        private boolean required;

        public String getSelector() {
            return selector;
        }

        public void setSelector(String selector) {
            this.selector = selector;
        }

        public String getAttribute() {
            return attribute;
        }

        public void setAttribute(String attribute) {
            this.attribute = attribute;
        }

        public boolean isRequired() {
            return required;
        }

        public void setRequired(boolean required) {
            this.required = required;
        }
    }
}
