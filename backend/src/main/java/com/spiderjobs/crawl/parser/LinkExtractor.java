package com.spiderjobs.crawl.parser;

import com.spiderjobs.crawl.util.UrlNormalizer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

final class LinkExtractor {
    private LinkExtractor() {
    }

    /**
     * Absolute links matched by {@code selector} that stay on the page's host, in document order.
     */
    static List<String> sameHostLinks(Document document, String pageUrl, String selector) {
        String pageHost = UrlNormalizer.hostOf(pageUrl);
        Set<String> out = new LinkedHashSet<>();
        for (Element anchor : document.select(selector)) {
            String resolved = UrlNormalizer.resolve(pageUrl, anchor.attr("href"));
            if (resolved == null) {
                continue;
            }
            String host = UrlNormalizer.hostOf(resolved);
            if (host == null || !Objects.equals(host, pageHost)) {
                continue;
            }
            int hash = resolved.indexOf('#');
            out.add(hash >= 0 ? resolved.substring(0, hash) : resolved);
        }
        return new ArrayList<>(out);
    }
}
