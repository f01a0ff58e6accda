package com.realestate.scraper.crawl.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;

@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class JobConfigInvalidException extends RuntimeException {
    private final List<String> problems;

    public JobConfigInvalidException(String message) {
        this(message, List.of(message));
    }

    public JobConfigInvalidException(String message, List<String> problems) {
        super(message);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
