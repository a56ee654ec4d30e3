package com.spiderjobs.crawl.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class UrlNormalizer {
    private UrlNormalizer() {
    }

    /**
     * Returns the normalized form of an absolute http(s) URL, or null when the URL is malformed.
     * Scheme and host are lower-cased, default ports and fragments dropped, query parameters
     * sorted and a trailing slash removed from non-root paths.
     */
    public static String normalize(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return null;
        }
        URI uri = safeUri(candidate.trim());
        if (uri == null || uri.getHost() == null || uri.getScheme() == null) {
            return null;
        }
        String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return null;
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443)) {
            port = -1;
        }
        String path = uri.getRawPath();
        if (path == null || path.isEmpty()) {
            path = "/";
        } else if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        StringBuilder out = new StringBuilder();
        out.append(scheme).append("://").append(host);
        if (port != -1) {
            out.append(':').append(port);
        }
        out.append(path);
        String query = sortedQuery(uri.getRawQuery());
        if (!query.isEmpty()) {
            out.append('?').append(query);
        }
        return out.toString();
    }

    /**
     * Resolves {@code href} against {@code base}; returns null for unusable links.
     */
    public static String resolve(String base, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("javascript:") || lower.startsWith("mailto:") || lower.startsWith("tel:")
            || lower.startsWith("#")) {
            return null;
        }
        URI baseUri = base == null ? null : safeUri(base);
        URI target = safeUri(trimmed.replace(" ", "%20"));
        if (target == null) {
            return null;
        }
        if (!target.isAbsolute()) {
            if (baseUri == null) {
                return null;
            }
            target = baseUri.resolve(target);
        }
        return target.toString();
    }

    /**
     * Returns {@code url} with query parameter {@code name} set to {@code value}.
     */
    public static String withQueryParam(String url, String name, String value) {
        URI uri = safeUri(url);
        if (uri == null) {
            return null;
        }
        List<String> params = new ArrayList<>();
        String raw = uri.getRawQuery();
        if (raw != null && !raw.isEmpty()) {
            for (String part : raw.split("&")) {
                if (part.isEmpty()) {
                    continue;
                }
                String key = part.contains("=") ? part.substring(0, part.indexOf('=')) : part;
                if (!key.equals(name)) {
                    params.add(part);
                }
            }
        }
        params.add(name + "=" + value);
        if (uri.getScheme() == null || uri.getRawAuthority() == null) {
            return null;
        }
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        return uri.getScheme() + "://" + uri.getRawAuthority() + path + "?" + String.join("&", params);
    }

    /**
     * Reads an integer query parameter, or {@code defaultValue} when missing or not numeric.
     */
    public static int intQueryParam(String url, String name, int defaultValue) {
        URI uri = safeUri(url);
        if (uri == null || uri.getRawQuery() == null) {
            return defaultValue;
        }
        for (String part : uri.getRawQuery().split("&")) {
            int eq = part.indexOf('=');
            if (eq > 0 && part.substring(0, eq).equals(name)) {
                try {
                    return Integer.parseInt(part.substring(eq + 1));
                } catch (NumberFormatException ignored) {
                    return defaultValue;
                }
            }
        }
        return defaultValue;
    }

    public static String hostOf(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static URI safeUri(String url) {
        try {
            return new URI(url);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static String sortedQuery(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        List<String> parts = new ArrayList<>();
        for (String part : rawQuery.split("&")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        parts.sort(null);
        return String.join("&", parts);
    }
}
