package com.realestate.scraper.crawl.api;

import com.realestate.scraper.crawl.model.JobEvent;
import com.realestate.scraper.crawl.model.JobProgress;
import com.realestate.scraper.crawl.model.ScrapeJobHandle;
import com.realestate.scraper.crawl.model.ScrapeJobRequest;
import com.realestate.scraper.crawl.service.ScrapeJobOrchestrator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api/scrape-jobs")
public class ScrapeJobController {
    private final ScrapeJobOrchestrator orchestrator;

    public ScrapeJobController(ScrapeJobOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public ResponseEntity<JobProgress> launch(@RequestBody ScrapeJobLaunchRequest request) {
        if (request == null || request.siteKey() == null || request.siteKey().isBlank()) {
            throw new ResponseStatusException(BAD_REQUEST, "siteKey is required");
        }
        ScrapeJobHandle handle = orchestrator.launch(new ScrapeJobRequest(
            request.jobId(),
            request.siteKey().trim(),
            request.startUrl(),
            request.maxPages()
        ));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(orchestrator.getProgress(handle.jobId()));
    }

    @GetMapping
    public List<JobProgress> listJobs() {
        return orchestrator.listJobs();
    }

    @GetMapping("/{jobId}")
    public JobProgress getProgress(@PathVariable("jobId") String jobId) {
        return orchestrator.getProgress(jobId);
    }

    @GetMapping("/{jobId}/events")
    public List<JobEvent> getEvents(@PathVariable("jobId") String jobId) {
        return orchestrator.getEvents(jobId);
    }

    @PostMapping("/{jobId}/cancel")
    public Map<String, Object> cancel(@PathVariable("jobId") String jobId) {
        boolean accepted = orchestrator.cancel(jobId);
        return Map.of(
            "jobId", jobId,
            "cancelRequested", accepted,
            "status", orchestrator.getProgress(jobId).status()
        );
    }
}
