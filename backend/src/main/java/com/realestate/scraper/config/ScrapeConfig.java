package com.realestate.scraper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.realestate.scraper.crawl.http.Sleeper;
import com.realestate.scraper.crawl.service.LoggingRecordSink;
import com.realestate.scraper.crawl.service.PropertiesSiteConfigProvider;
import com.realestate.scraper.crawl.service.RecordSink;
import com.realestate.scraper.crawl.service.SiteConfigProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScrapeConfig {

    @Bean(name = "jobExecutor", destroyMethod = "shutdownNow")
    public ExecutorService jobExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getJobConcurrency());
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ScraperProperties properties) {
        int size = Math.max(4, properties.getJobConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordSink recordSink() {
        return new LoggingRecordSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public SiteConfigProvider siteConfigProvider(ScraperProperties properties) {
        return new PropertiesSiteConfigProvider(properties);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
