package com.realestate.scraper.crawl.service;

import com.realestate.scraper.config.ScraperProperties;
import com.realestate.scraper.crawl.model.PaginationType;
import com.realestate.scraper.crawl.model.SiteConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertiesSiteConfigProviderTest {

    @Test
    void convertsBoundSiteIntoImmutableConfig() {
        ScraperProperties properties = new ScraperProperties();
        ScraperProperties.Site site = site("idealista-pt", "incremental-path");
        site.getTextPatterns().put("bedrooms", "T(\\d)");
        properties.setSites(List.of(site));

        SiteConfig config = new PropertiesSiteConfigProvider(properties).get("IDEALISTA-PT").orElseThrow();

        assertThat(config.key()).isEqualTo("idealista-pt");
        assertThat(config.name()).isEqualTo("idealista-pt");
        assertThat(config.paginationType()).isEqualTo(PaginationType.INCREMENTAL_PATH);
        assertThat(config.fields()).containsOnlyKeys("title");
        assertThat(config.fields().get("title").required()).isTrue();
        assertThat(config.fields().get("title").attribute()).isEqualTo("title");
        assertThat(config.textPatterns()).containsEntry("bedrooms", "T(\\d)");
    }

    @Test
    void unknownKeyIsEmpty() {
        assertThat(new PropertiesSiteConfigProvider(new ScraperProperties()).get("missing")).isEmpty();
    }

    @Test
    void unknownPaginationTypeIsInvalidConfig() {
        ScraperProperties properties = new ScraperProperties();
        properties.setSites(List.of(site("broken", "infinite_scroll")));

        assertThatThrownBy(() -> new PropertiesSiteConfigProvider(properties).get("broken"))
            .isInstanceOf(JobConfigInvalidException.class)
            .hasMessageContaining("infinite_scroll");
    }

    private ScraperProperties.Site site(String key, String paginationType) {
        ScraperProperties.Field title = new ScraperProperties.Field();
        title.setSelector("a.listing-title");
        title.setAttribute("title");
        title.setRequired(true);
        ScraperProperties.Site site = new ScraperProperties.Site();
        site.setKey(key);
        site.setStartUrl("https://www.example.pt/comprar-casas/lisboa/");
        site.setPaginationType(paginationType);
        site.getFields().put("title", title);
        return site;
    }
}
