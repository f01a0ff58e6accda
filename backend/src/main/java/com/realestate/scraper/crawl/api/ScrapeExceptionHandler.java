package com.realestate.scraper.crawl.api;

import com.realestate.scraper.crawl.service.DuplicateScrapeJobException;
import com.realestate.scraper.crawl.service.JobConfigInvalidException;
import com.realestate.scraper.crawl.service.ScrapeJobNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScrapeExceptionHandler {

  @ExceptionHandler(ScrapeJobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(ScrapeJobNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "scrape_job_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(DuplicateScrapeJobException.class)
  public ResponseEntity<Map<String, String>> handleDuplicate(DuplicateScrapeJobException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "duplicate_scrape_job", "message", ex.getMessage()));
  }

  @ExceptionHandler(JobConfigInvalidException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidConfig(JobConfigInvalidException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of(
            "error", "job_config_invalid",
            "message", ex.getMessage(),
            "problems", ex.getProblems()));
  }
}
