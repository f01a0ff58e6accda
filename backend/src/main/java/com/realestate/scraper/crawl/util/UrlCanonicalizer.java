package com.realestate.scraper.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * URL helpers shared by deduplication, robots lookups and rate limiting.
 *
 * <p>Canonical form: lowercase scheme and host, default port dropped, fragment dropped, empty
 * path becomes {@code /}, a single trailing slash is removed from non-root paths, and query
 * parameters are sorted by name then value with their raw encoding kept. Path case is kept.
 */
public final class UrlCanonicalizer {

    private UrlCanonicalizer() {
    }

    public static String canonicalize(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getScheme() == null || uri.getRawAuthority() == null) {
            return url == null ? "" : url.trim();
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        StringBuilder out = new StringBuilder(scheme).append("://").append(authority(uri));

        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        } else if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        out.append(path);

        String query = sortedQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    /**
     * Sharing key for robots and rate limiting: lowercase host, plus the port when it is not the
     * scheme default. Returns {@code null} for URLs without a host.
     */
    public static String domainOf(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return authority(uri);
    }

    public static String pathAndQuery(URI uri) {
        String path = uri.getRawPath() == null || uri.getRawPath().isBlank() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null && !uri.getRawQuery().isBlank()) {
            path = path + "?" + uri.getRawQuery();
        }
        return path;
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String authority(URI uri) {
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        boolean defaultPort = port == -1
            || ("http".equals(scheme) && port == 80)
            || ("https".equals(scheme) && port == 443);
        return defaultPort ? host : host + ":" + port;
    }

    private static String sortedQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isBlank()) {
            return "";
        }
        List<String[]> params = new ArrayList<>();
        for (String part : rawQuery.split("&")) {
            if (part.isEmpty()) {
                continue;
            }
            int eq = part.indexOf('=');
            String name = eq < 0 ? part : part.substring(0, eq);
            String value = eq < 0 ? null : part.substring(eq + 1);
            params.add(new String[] {name, value});
        }
        params.sort(Comparator
            .comparing((String[] p) -> p[0])
            .thenComparing(p -> p[1] == null ? "" : p[1]));
        StringBuilder out = new StringBuilder();
        for (String[] param : params) {
            if (out.length() > 0) {
                out.append('&');
            }
            out.append(param[0]);
            if (param[1] != null) {
                out.append('=').append(param[1]);
            }
        }
        return out.toString();
    }
}
