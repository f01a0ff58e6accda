package com.realestate.scraper.crawl.parse;

import com.realestate.scraper.crawl.model.FieldSelector;
import com.realestate.scraper.crawl.model.ListingRecord;
import com.realestate.scraper.crawl.model.PageMetadata;
import com.realestate.scraper.crawl.model.PaginationType;
import com.realestate.scraper.crawl.model.ParsedPage;
import com.realestate.scraper.crawl.model.SiteConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a site's selector configuration to fetched HTML. Stateless and free of I/O.
 *
 * <p>Fields come from selectors first; text patterns only fill fields no selector produced.
 */
@Component
public class ListingPageParser {
    private static final Logger log = LoggerFactory.getLogger(ListingPageParser.class);
    private static final String URL_FIELD = "url";
    private static final List<String> IMAGE_ATTRIBUTES = List.of("src", "data-src", "data-lazy-src");

    /**
     * Parses a results page: listing records (or detail-page links in detail mode) plus the next
     * page reference for {@link PaginationType#HTML_NEXT} sites.
     */
    public ParsedPage parse(String html, String pageUrl, SiteConfig config) {
        if (html == null || html.isBlank()) {
            return ParsedPage.empty();
        }
        Document document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        String nextUrl = nextPageUrl(document, pageUrl, config);

        if (config.usesDetailPages()) {
            List<String> links = detailLinks(document, config);
            log.debug("Found {} listing links on page {}", links.size(), pageUrl);
            return new ParsedPage(List.of(), nextUrl, links, List.of());
        }

        List<Element> listings = config.listingSelector() == null || config.listingSelector().isBlank()
            ? List.<Element>of(document)
            : select(document, config.listingSelector());
        return extractRecords(listings, pageUrl, config, nextUrl, null);
    }

    /**
     * Parses a detail page as a single listing, including the page's SEO metadata.
     */
    public ParsedPage parseDetail(String html, String pageUrl, SiteConfig config) {
        if (html == null || html.isBlank()) {
            return ParsedPage.empty();
        }
        Document document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        return extractRecords(List.of(document), pageUrl, config, null, pageMetadata(document));
    }

    private ParsedPage extractRecords(
        List<Element> listings,
        String pageUrl,
        SiteConfig config,
        String nextUrl,
        PageMetadata metadata
    ) {
        List<ListingRecord> records = new ArrayList<>();
        List<String> parseErrors = new ArrayList<>();
        int index = 0;
        for (Element listing : listings) {
            index++;
            Map<String, String> values = new LinkedHashMap<>();
            Images images = Images.NONE;
            String missing = null;
            for (Map.Entry<String, FieldSelector> entry : config.fields().entrySet()) {
                String field = entry.getKey();
                FieldSelector selector = entry.getValue();
                if (ListingRecord.IMAGE.equals(field)) {
                    images = images(listing, selector, config.imageFilter());
                    if (images.urls().isEmpty() && selector.required()) {
                        missing = field;
                        break;
                    }
                    continue;
                }
                String value = extractField(listing, selector);
                if (value == null && selector.required()) {
                    missing = field;
                    break;
                }
                if (value != null) {
                    values.put(field, value);
                }
            }
            if (missing != null) {
                parseErrors.add("listing #" + index + " on " + pageUrl + " missing required field '" + missing + "'");
                continue;
            }
            applyTextPatterns(listing, config.textPatterns(), values);
            records.add(toRecord(config.key(), pageUrl, values, images, metadata));
        }
        if (!parseErrors.isEmpty()) {
            log.debug("Skipped {} of {} listings on {}", parseErrors.size(), listings.size(), pageUrl);
        }
        return new ParsedPage(records, nextUrl, List.of(), parseErrors);
    }

    private ListingRecord toRecord(
        String siteKey,
        String pageUrl,
        Map<String, String> values,
        Images images,
        PageMetadata metadata
    ) {
        Map<String, String> attributes = new LinkedHashMap<>(values);
        String title = attributes.remove(ListingRecord.TITLE);
        String price = attributes.remove(ListingRecord.PRICE);
        String address = attributes.remove(ListingRecord.ADDRESS);
        String description = attributes.remove(ListingRecord.DESCRIPTION);
        String sourceUrl = attributes.remove(URL_FIELD);
        return new ListingRecord(
            siteKey,
            sourceUrl == null ? pageUrl : sourceUrl,
            title,
            price,
            address,
            description,
            attributes,
            images.urls(),
            images.altTexts(),
            metadata
        );
    }

    private void applyTextPatterns(Element scope, Map<String, String> patterns, Map<String, String> values) {
        if (patterns.isEmpty()) {
            return;
        }
        String text = scope.text();
        for (Map.Entry<String, String> entry : patterns.entrySet()) {
            if (values.containsKey(entry.getKey())) {
                continue;
            }
            Matcher matcher = Pattern.compile(entry.getValue(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL).matcher(text);
            if (!matcher.find()) {
                continue;
            }
            String value = matcher.groupCount() >= 1 ? matcher.group(1) : matcher.group();
            if (value != null && !value.isBlank()) {
                values.put(entry.getKey(), value.trim());
            }
        }
    }

    private PageMetadata pageMetadata(Document document) {
        String title = document.title().trim();
        Element description = document.selectFirst("meta[name=description]");
        String metaDescription = description == null ? "" : description.attr("content").trim();
        List<PageMetadata.Heading> headings = new ArrayList<>();
        for (int level = 1; level <= 6; level++) {
            for (Element heading : document.select("h" + level)) {
                String text = heading.text().trim();
                if (!text.isEmpty()) {
                    headings.add(new PageMetadata.Heading("h" + level, text));
                }
            }
        }
        return new PageMetadata(
            title.isEmpty() ? null : title,
            metaDescription.isEmpty() ? null : metaDescription,
            headings
        );
    }

    private String extractField(Element root, FieldSelector selector) {
        Elements matches = select(root, selector.selector());
        if (matches.isEmpty()) {
            return null;
        }
        Element first = matches.first();
        String attribute = selector.attribute() == null ? "" : selector.attribute().trim().toLowerCase(Locale.ROOT);
        String value;
        if (attribute.isEmpty() || "text".equals(attribute)) {
            value = first.text();
        } else if ("html".equals(attribute)) {
            value = first.html();
        } else if ("href".equals(attribute) || "src".equals(attribute)) {
            value = first.absUrl(attribute);
            if (value.isBlank()) {
                value = first.attr(attribute);
            }
        } else {
            value = first.attr(attribute);
        }
        value = value == null ? "" : value.trim();
        return value.isEmpty() ? null : value;
    }

    private Images images(Element root, FieldSelector selector, String imageFilter) {
        Pattern filter = imageFilter == null || imageFilter.isBlank() ? null : Pattern.compile(imageFilter);
        Map<String, String> altByUrl = new LinkedHashMap<>();
        for (Element image : select(root, selector.selector())) {
            String url = null;
            for (String attribute : IMAGE_ATTRIBUTES) {
                String candidate = image.absUrl(attribute);
                if (!candidate.isBlank()) {
                    url = candidate;
                    break;
                }
            }
            if (url == null || (filter != null && !filter.matcher(url).find())) {
                continue;
            }
            altByUrl.putIfAbsent(url, image.attr("alt").trim());
        }
        return new Images(new ArrayList<>(altByUrl.keySet()), new ArrayList<>(altByUrl.values()));
    }

    private List<String> detailLinks(Document document, SiteConfig config) {
        Pattern pattern = config.linkPattern() == null || config.linkPattern().isBlank()
            ? null
            : Pattern.compile(config.linkPattern());
        Set<String> links = new LinkedHashSet<>();
        for (Element anchor : select(document, config.listingLinkSelector())) {
            String href = anchor.absUrl("href");
            if (href.isBlank()) {
                continue;
            }
            if (pattern != null && !pattern.matcher(href).find()) {
                continue;
            }
            links.add(href);
        }
        return new ArrayList<>(links);
    }

    private String nextPageUrl(Document document, String pageUrl, SiteConfig config) {
        if (config.paginationType() != PaginationType.HTML_NEXT) {
            return null;
        }
        String selector = config.nextPageSelector();
        if (selector == null || selector.isBlank()) {
            return null;
        }
        Elements matches = select(document, selector);
        if (matches.isEmpty()) {
            return null;
        }
        String href = matches.first().absUrl("href");
        if (href.isBlank() || href.equals(pageUrl)) {
            return null;
        }
        return href;
    }

    private Elements select(Element root, String selector) {
        FieldSelector parsed = FieldSelector.optional(selector);
        if (parsed.isXpath()) {
            return root.selectXpath(parsed.expression());
        }
        return root.select(parsed.expression());
    }

    /** Image URLs with the alt text of each, index-aligned; a missing alt is an empty string. */
    private record Images(List<String> urls, List<String> altTexts) {
        static final Images NONE = new Images(List.of(), List.of());
    }
}
