package com.realestate.scraper.crawl.service;

import com.realestate.scraper.config.ScraperProperties;
import com.realestate.scraper.crawl.model.FieldSelector;
import com.realestate.scraper.crawl.model.PaginationType;
import com.realestate.scraper.crawl.model.SiteConfig;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Serves site configurations declared under {@code scraper.sites} in the application config.
 */
public class PropertiesSiteConfigProvider implements SiteConfigProvider {
    private final ScraperProperties properties;

    public PropertiesSiteConfigProvider(ScraperProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<SiteConfig> get(String siteKey) {
        if (siteKey == null || siteKey.isBlank()) {
            return Optional.empty();
        }
        for (ScraperProperties.Site site : properties.getSites()) {
            if (siteKey.equalsIgnoreCase(site.getKey())) {
                return Optional.of(toSiteConfig(site));
            }
        }
        return Optional.empty();
    }

    @Override
    public List<SiteConfig> list() {
        List<SiteConfig> configs = new ArrayList<>();
        for (ScraperProperties.Site site : properties.getSites()) {
            configs.add(toSiteConfig(site));
        }
        return configs;
    }

    static SiteConfig toSiteConfig(ScraperProperties.Site site) {
        PaginationType paginationType;
        try {
            paginationType = PaginationType.fromValue(site.getPaginationType());
        } catch (IllegalArgumentException e) {
            throw new JobConfigInvalidException("site '" + site.getKey() + "': " + e.getMessage());
        }
        Map<String, FieldSelector> fields = new LinkedHashMap<>();
        site.getFields().forEach((name, field) -> fields.put(
            name,
            new FieldSelector(field.getSelector(), field.getAttribute(), field.isRequired())
        ));
        return new SiteConfig(
            site.getKey(),
            site.getName() == null ? site.getKey() : site.getName(),
            site.getBaseUrl(),
            site.getStartUrl(),
            site.isActive(),
            site.getListingSelector(),
            site.getListingLinkSelector(),
            site.getLinkPattern(),
            site.getImageFilter(),
            paginationType,
            site.getNextPageSelector(),
            site.getPaginationParam(),
            site.getMaxPages(),
            fields,
            site.getTextPatterns()
        );
    }
}
