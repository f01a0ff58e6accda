package com.realestate.scraper.crawl.model;

public enum FetchClassification {
    SUCCESS,
    REDIRECT,
    RETRIABLE,
    NON_RETRIABLE;

    public static FetchClassification fromStatus(int status) {
        if (status >= 200 && status < 300) {
            return SUCCESS;
        }
        if (status == 429 || (status >= 500 && status < 600)) {
            return RETRIABLE;
        }
        return NON_RETRIABLE;
    }

    public static FetchClassification fromErrorCode(String errorCode) {
        if (errorCode == null || errorCode.isBlank()) {
            return NON_RETRIABLE;
        }
        return switch (errorCode) {
            case FetchOutcome.TIMEOUT, FetchOutcome.IO_ERROR -> RETRIABLE;
            default -> NON_RETRIABLE;
        };
    }
}
