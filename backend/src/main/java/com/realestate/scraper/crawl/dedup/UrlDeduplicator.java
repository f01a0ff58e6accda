package com.realestate.scraper.crawl.dedup;

import com.realestate.scraper.crawl.util.UrlCanonicalizer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-job visited sets of canonical URLs. Each job's set is private to that job and dropped with
 * {@link #forget(String)} when the job ends.
 */
@Component
public class UrlDeduplicator {
    private final Map<String, Set<String>> visitedByJob = new ConcurrentHashMap<>();

    /**
     * Records {@code url} for {@code jobId}. Returns {@code true} only for the first call with an
     * equivalent URL; the check and the mark are a single atomic set insertion.
     */
    public boolean markIfNew(String jobId, String url) {
        return visited(jobId).add(UrlCanonicalizer.canonicalize(url));
    }

    public boolean isVisited(String jobId, String url) {
        Set<String> visited = visitedByJob.get(jobId);
        return visited != null && visited.contains(UrlCanonicalizer.canonicalize(url));
    }

    public int visitedCount(String jobId) {
        Set<String> visited = visitedByJob.get(jobId);
        return visited == null ? 0 : visited.size();
    }

    public void forget(String jobId) {
        visitedByJob.remove(jobId);
    }

    private Set<String> visited(String jobId) {
        return visitedByJob.computeIfAbsent(jobId, ignored -> ConcurrentHashMap.newKeySet());
    }
}
