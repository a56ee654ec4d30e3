package com.spiderjobs.crawl.parser;

import com.spiderjobs.crawl.model.ParseResult;
import com.spiderjobs.crawl.model.RawPage;

/**
 * Turns a fetched page into listings and links to follow. Implementations must be pure
 * functions of the page content and safe to call from many workers at once.
 */
public interface ListingParser {

    /**
     * Identifier referenced by {@code parserId} in site configuration.
     */
    String id();

    ParseResult parse(String siteId, RawPage page) throws ParseException;
}
