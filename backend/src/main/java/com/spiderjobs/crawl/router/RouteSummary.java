package com.spiderjobs.crawl.router;

/**
 * What one parse result turned into.
 */
public record RouteSummary(int linksAdmitted, int pagesAdmitted, int listingsForwarded, int listingsDuplicate) {
}
