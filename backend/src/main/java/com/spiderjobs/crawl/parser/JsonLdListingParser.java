package com.spiderjobs.crawl.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.spiderjobs.crawl.model.JobListing;
import com.spiderjobs.crawl.model.ParseResult;
import com.spiderjobs.crawl.model.RawPage;
import com.spiderjobs.crawl.util.UrlNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reads schema.org {@code JobPosting} objects from {@code application/ld+json} script blocks.
 */
@Component
public class JsonLdListingParser implements ListingParser {
    public static final String ID = "json-ld";

    private final ObjectMapper objectMapper;

    public JsonLdListingParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
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

        Document document = Jsoup.parse(html, page.url());
        List<JsonNode> jobPostingNodes = new ArrayList<>();
        for (Element script : document.select("script[type=application/ld+json]")) {
            String payload = script.data();
            if (payload == null || payload.isBlank()) {
                payload = script.html();
            }
            if (payload == null || payload.isBlank()) {
                continue;
            }
            try {
                JsonNode root = objectMapper.readTree(payload);
                collectJobPostingNodes(root, jobPostingNodes);
            } catch (JsonProcessingException ignored) {
                // Ignore malformed JSON-LD blobs and continue extracting from others.
            }
        }

        Instant fetchTime = page.fetchedAt() == null ? Instant.now() : page.fetchedAt();
        List<JobListing> listings = new ArrayList<>();
        for (JsonNode node : jobPostingNodes) {
            JobListing listing = toListing(node, siteId, page.url(), fetchTime);
            if (listing.title() != null && listing.canonicalLink() != null) {
                listings.add(listing);
            }
        }
        return new ParseResult(listings, LinkExtractor.sameHostLinks(document, page.url(), "a[href]"));
    }

    private void collectJobPostingNodes(JsonNode node, List<JsonNode> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isObject()) {
            if (isJobPostingType(node.get("@type"))) {
                out.add(node);
            }
            node.fields().forEachRemaining(entry -> {
                JsonNode value = entry.getValue();
                if (value.isArray() || value.isObject()) {
                    collectJobPostingNodes(value, out);
                }
            });
            return;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                collectJobPostingNodes(child, out);
            }
        }
    }

    private boolean isJobPostingType(JsonNode typeNode) {
        if (typeNode == null || typeNode.isNull()) {
            return false;
        }
        if (typeNode.isTextual()) {
            return "jobposting".equalsIgnoreCase(typeNode.asText());
        }
        if (typeNode.isArray()) {
            for (JsonNode child : typeNode) {
                if (child.isTextual() && "jobposting".equalsIgnoreCase(child.asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    private JobListing toListing(JsonNode node, String siteId, String pageUrl, Instant fetchTime) {
        String title = firstNonBlank(text(node, "title"), text(node, "name"));
        JsonNode organization = node.path("hiringOrganization");
        String company = organization.isTextual() ? organization.asText().trim() : text(organization, "name");
        String link = UrlNormalizer.resolve(pageUrl, firstNonBlank(text(node, "url"), pageUrl));
        String logo = organization.isObject() ? logoUrl(organization.get("logo"), pageUrl) : null;
        return new JobListing(
            title,
            link,
            company,
            extractLocation(node.get("jobLocation")),
            dateOnly(text(node, "datePosted")),
            extractSalary(node.get("baseSalary")),
            logo,
            extractSkills(node.get("skills")),
            siteId,
            fetchTime
        );
    }

    private String logoUrl(JsonNode logoNode, String pageUrl) {
        if (logoNode == null || logoNode.isNull()) {
            return null;
        }
        String raw = logoNode.isTextual() ? logoNode.asText() : text(logoNode, "url");
        return UrlNormalizer.resolve(pageUrl, raw);
    }

    private String extractLocation(JsonNode jobLocation) {
        if (jobLocation == null || jobLocation.isNull()) {
            return null;
        }
        LinkedHashSet<String> locations = new LinkedHashSet<>();
        collectLocationStrings(jobLocation, locations);
        if (locations.isEmpty()) {
            return null;
        }
        return String.join(" | ", locations);
    }

    private void collectLocationStrings(JsonNode node, LinkedHashSet<String> out) {
        if (node == null || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collectLocationStrings(item, out);
            }
            return;
        }
        if (!node.isObject()) {
            if (node.isTextual()) {
                String val = node.asText().trim();
                if (!val.isEmpty()) {
                    out.add(val);
                }
            }
            return;
        }

        JsonNode address = node.has("address") ? node.get("address") : node;
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, text(address, "addressLocality"));
        addIfPresent(parts, text(address, "addressRegion"));
        addIfPresent(parts, text(address, "addressCountry"));

        if (!parts.isEmpty()) {
            out.add(String.join(", ", parts));
            return;
        }

        String fallback = firstNonBlank(
            text(node, "name"),
            text(address, "name")
        );
        if (fallback != null) {
            out.add(fallback);
        }
    }

    private String extractSalary(JsonNode salary) {
        if (salary == null || salary.isNull()) {
            return null;
        }
        if (salary.isTextual() || salary.isNumber()) {
            return salary.asText().trim();
        }
        String currency = text(salary, "currency");
        JsonNode value = salary.get("value");
        String amount;
        if (value != null && value.isObject()) {
            String min = text(value, "minValue");
            String max = text(value, "maxValue");
            String exact = text(value, "value");
            if (min != null && max != null) {
                amount = min + "-" + max;
            } else {
                amount = firstNonBlank(exact, min, max);
            }
            String unit = text(value, "unitText");
            if (amount != null && unit != null) {
                amount = amount + "/" + unit;
            }
        } else {
            amount = text(salary, "value");
        }
        if (amount == null) {
            return null;
        }
        return currency == null ? amount : currency + " " + amount;
    }

    private List<String> extractSkills(JsonNode skills) {
        if (skills == null || skills.isNull()) {
            return List.of();
        }
        LinkedHashSet<String> out = new LinkedHashSet<>();
        if (skills.isArray()) {
            for (JsonNode item : skills) {
                String value = item.isTextual() ? item.asText() : text(item, "name");
                addIfPresent(out, value);
            }
        } else if (skills.isTextual()) {
            for (String part : skills.asText().split(",")) {
                addIfPresent(out, part);
            }
        }
        return new ArrayList<>(out);
    }

    private String dateOnly(String rawDate) {
        if (rawDate == null || rawDate.isBlank()) {
            return null;
        }
        String candidate = rawDate.trim();
        return candidate.length() >= 10 ? candidate.substring(0, 10) : candidate;
    }

    private String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        return value.toString();
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private void addIfPresent(Collection<String> out, String value) {
        if (value != null && !value.isBlank()) {
            out.add(value.trim());
        }
    }
}
