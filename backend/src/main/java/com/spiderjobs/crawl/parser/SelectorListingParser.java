package com.spiderjobs.crawl.parser;

import com.spiderjobs.crawl.model.JobListing;
import com.spiderjobs.crawl.model.ParseResult;
import com.spiderjobs.crawl.model.RawPage;
import com.spiderjobs.crawl.model.SiteConfig;
import com.spiderjobs.crawl.service.SiteRegistry;
import com.spiderjobs.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jsoup.select.Selector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Listing cards located by CSS selectors from the site's {@code selectors} map.
 *
 * <p>Every field has a primary key and an optional {@code <key>.fallback} tried when the
 * primary matches nothing. Cards without a title or a link are skipped.
 */
@Component
public class SelectorListingParser implements ListingParser {
    private static final Logger log = LoggerFactory.getLogger(SelectorListingParser.class);
    public static final String ID = "selector";

    static final Map<String, String> DEFAULT_SELECTORS = Map.ofEntries(
        Map.entry("container", "div[data-search-id]"),
        Map.entry("container.fallback", ".job-item, .search-result-item, [class*=job-card]"),
        Map.entry("title", "h3 a, .job-title a, [class*=title] a"),
        Map.entry("title.fallback", "h3, .job-title, [class*=title]"),
        Map.entry("link", "h3 a[href], .job-title a[href], a[href]"),
        Map.entry("company", "[class*=company] a, .company-name a, .employer a"),
        Map.entry("company.fallback", "[class*=company], .company-name, .employer"),
        Map.entry("location", "[class*=location], .job-location, .location"),
        Map.entry("date", "[class*=date], .posted-date, .time, [class*=time]"),
        Map.entry("logo", "img[src*=logo], img[alt*=logo], .company-logo img, .logo img"),
        Map.entry("salary", "[class*=salary]"),
        Map.entry("skills", "[class*=skill], .skills a, .tag, [class*=tag]"),
        Map.entry("links", "a[href]")
    );

    private final SiteRegistry siteRegistry;

    public SelectorListingParser(SiteRegistry siteRegistry) {
        this.siteRegistry = siteRegistry;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ParseResult parse(String siteId, RawPage page) throws ParseException {
        String html = page.body();
        if (html == null || html.isBlank()) {
            throw new ParseException("empty page body for " + page.url());
        }
        Map<String, String> selectors = siteRegistry.find(siteId)
            .map(SiteConfig::selectors)
            .orElse(Map.of());
        Document document = Jsoup.parse(html, page.url());
        Instant fetchTime = page.fetchedAt() == null ? Instant.now() : page.fetchedAt();
        try {
            Elements containers = selectWithFallback(document, selectors, "container");
            if (containers.isEmpty()) {
                log.warn("No listing containers found on {}", page.url());
            }
            List<JobListing> listings = new ArrayList<>();
            for (Element container : containers) {
                JobListing listing = toListing(container, selectors, siteId, page.url(), fetchTime);
                if (listing != null) {
                    listings.add(listing);
                }
            }
            List<String> links = LinkExtractor.sameHostLinks(document, page.url(), selector(selectors, "links"));
            return new ParseResult(listings, links);
        } catch (Selector.SelectorParseException e) {
            throw new ParseException("invalid selector configured for site " + siteId + ": " + e.getMessage(), e);
        }
    }

    private JobListing toListing(
        Element container,
        Map<String, String> selectors,
        String siteId,
        String pageUrl,
        Instant fetchTime
    ) {
        String title = firstText(container, selectors, "title");
        String link = firstHref(container, selectors, pageUrl);
        if (title == null || link == null) {
            return null;
        }
        return new JobListing(
            title,
            link,
            firstText(container, selectors, "company"),
            firstText(container, selectors, "location"),
            firstText(container, selectors, "date"),
            firstText(container, selectors, "salary"),
            logoUrl(container, selectors),
            skills(container, selectors),
            siteId,
            fetchTime
        );
    }

    private String firstText(Element scope, Map<String, String> selectors, String key) {
        for (Element element : selectWithFallback(scope, selectors, key)) {
            String text = element.text().trim();
            if (!text.isEmpty()) {
                return text;
            }
        }
        return null;
    }

    private String firstHref(Element scope, Map<String, String> selectors, String pageUrl) {
        for (Element element : selectWithFallback(scope, selectors, "link")) {
            String resolved = UrlNormalizer.resolve(pageUrl, element.attr("href"));
            if (resolved != null) {
                return resolved;
            }
        }
        return null;
    }

    private String logoUrl(Element scope, Map<String, String> selectors) {
        for (Element element : selectWithFallback(scope, selectors, "logo")) {
            String src = element.absUrl("src");
            if (src.isEmpty()) {
                src = element.absUrl("data-src");
            }
            if (!src.isEmpty()) {
                return src;
            }
        }
        return null;
    }

    private List<String> skills(Element scope, Map<String, String> selectors) {
        LinkedHashSet<String> out = new LinkedHashSet<>();
        for (Element element : selectWithFallback(scope, selectors, "skills")) {
            String text = element.text().trim();
            if (!text.isEmpty() && text.length() < 50) {
                out.add(text);
            }
        }
        return new ArrayList<>(out);
    }

    private Elements selectWithFallback(Element scope, Map<String, String> selectors, String key) {
        Elements primary = scope.select(selector(selectors, key));
        if (!primary.isEmpty()) {
            return primary;
        }
        String fallback = selector(selectors, key + ".fallback");
        if (fallback == null) {
            return primary;
        }
        return scope.select(fallback);
    }

    private String selector(Map<String, String> selectors, String key) {
        String configured = selectors.get(key);
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        return DEFAULT_SELECTORS.get(key);
    }
}
