package com.realestate.scraper.crawl.service;

import com.realestate.scraper.crawl.model.ListingRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback sink used when no persistence-backed sink is registered.
 */
public class LoggingRecordSink implements RecordSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingRecordSink.class);

    @Override
    public void emit(String jobId, ListingRecord record) {
        log.info(
            "listing job={} site={} url={} title={} price={} address={}",
            jobId,
            record.siteKey(),
            record.sourceUrl(),
            record.title(),
            record.price(),
            record.address()
        );
    }
}
