package com.realestate.scraper.crawl.service;

import com.realestate.scraper.crawl.model.FieldSelector;
import com.realestate.scraper.crawl.model.PaginationType;
import com.realestate.scraper.crawl.model.SiteConfig;
import com.realestate.scraper.crawl.util.UrlCanonicalizer;
import org.jsoup.select.QueryParser;

import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

public final class SiteConfigValidator {

    private SiteConfigValidator() {
    }

    /**
     * Returns every problem found in {@code config}; an empty list means the job may start.
     */
    public static List<String> validate(SiteConfig config) {
        List<String> problems = new ArrayList<>();
        if (config == null) {
            problems.add("site config is missing");
            return problems;
        }
        if (config.key() == null || config.key().isBlank()) {
            problems.add("site key is blank");
        }
        if (!config.active()) {
            problems.add("site '" + config.key() + "' is inactive");
        }
        URI start = UrlCanonicalizer.safeUri(config.startUrl());
        if (start == null
            || start.getHost() == null
            || !("http".equalsIgnoreCase(start.getScheme()) || "https".equalsIgnoreCase(start.getScheme()))) {
            problems.add("start url is not an absolute http(s) url: " + config.startUrl());
        }
        if (config.fields().isEmpty()) {
            problems.add("no field selectors configured");
        }
        for (Map.Entry<String, FieldSelector> entry : config.fields().entrySet()) {
            FieldSelector selector = entry.getValue();
            if (selector == null || selector.selector() == null || selector.selector().isBlank()) {
                problems.add("field '" + entry.getKey() + "' has no selector");
                continue;
            }
            checkSelector("field '" + entry.getKey() + "'", selector.selector(), problems);
        }
        checkOptionalSelector("listing selector", config.listingSelector(), problems);
        checkOptionalSelector("listing link selector", config.listingLinkSelector(), problems);
        checkOptionalSelector("next page selector", config.nextPageSelector(), problems);
        checkPattern("link pattern", config.linkPattern(), problems);
        checkPattern("image filter", config.imageFilter(), problems);
        config.textPatterns().forEach((field, regex) -> {
            if (regex == null || regex.isBlank()) {
                problems.add("text pattern '" + field + "' is blank");
            } else {
                checkPattern("text pattern '" + field + "'", regex, problems);
            }
        });
        if (config.paginationType() == PaginationType.QUERY_PARAM
            && (config.paginationParam() == null || config.paginationParam().isBlank())) {
            problems.add("query_param pagination needs a pagination param");
        }
        if (config.maxPages() != null && config.maxPages() < 1) {
            problems.add("max pages must be at least 1");
        }
        return problems;
    }

    private static void checkOptionalSelector(String label, String selector, List<String> problems) {
        if (selector != null && !selector.isBlank()) {
            checkSelector(label, selector, problems);
        }
    }

    private static void checkSelector(String label, String selector, List<String> problems) {
        FieldSelector parsed = FieldSelector.optional(selector);
        try {
            if (parsed.isXpath()) {
                XPathFactory.newInstance().newXPath().compile(parsed.expression());
            } else {
                QueryParser.parse(parsed.expression());
            }
        } catch (IllegalStateException | IllegalArgumentException | XPathExpressionException e) {
            problems.add(label + " has an invalid selector '" + selector + "': " + e.getMessage());
        }
    }

    private static void checkPattern(String label, String regex, List<String> problems) {
        if (regex == null || regex.isBlank()) {
            return;
        }
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            problems.add(label + " is not a valid regex: " + e.getDescription());
        }
    }
}
