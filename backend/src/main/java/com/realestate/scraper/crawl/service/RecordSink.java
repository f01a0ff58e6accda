package com.realestate.scraper.crawl.service;

import com.realestate.scraper.crawl.model.ListingRecord;

/**
 * Receives every successfully parsed listing. Implemented by the persistence layer; called from
 * the job's runner thread, once per record.
 */
public interface RecordSink {
    void emit(String jobId, ListingRecord record);
}
