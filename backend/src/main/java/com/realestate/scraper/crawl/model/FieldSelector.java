package com.realestate.scraper.crawl.model;

/**
 * How one listing field is read from a listing element: a CSS selector (or an XPath expression
 * prefixed with {@code xpath:} or starting with {@code /}), an optional attribute to read instead
 * of the element text, and whether a listing without the field is unusable.
 */
public record FieldSelector(String selector, String attribute, boolean required) {

    public static FieldSelector optional(String selector) {
        return new FieldSelector(selector, null, false);
    }

    public static FieldSelector required(String selector) {
        return new FieldSelector(selector, null, true);
    }

    public FieldSelector withAttribute(String attributeName) {
        return new FieldSelector(selector, attributeName, required);
    }

    public boolean isXpath() {
        return selector != null && (selector.startsWith("xpath:") || selector.startsWith("/"));
    }

    public String expression() {
        if (selector != null && selector.startsWith("xpath:")) {
            return selector.substring("xpath:".length()).trim();
        }
        return selector;
    }
}
