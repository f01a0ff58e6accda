package com.realestate.scraper.crawl.service;

import com.realestate.scraper.crawl.model.SiteConfig;

import java.util.List;
import java.util.Optional;

public interface SiteConfigProvider {
    Optional<SiteConfig> get(String siteKey);

    List<SiteConfig> list();
}
