package com.spiderjobs.crawl.log;

import com.spiderjobs.crawl.model.CrawlLogEntry;

/**
 * Receives every entry appended to the {@link CrawlLog}, on the appending thread.
 */
public interface CrawlLogListener {
    void onEntry(CrawlLogEntry entry);
}
