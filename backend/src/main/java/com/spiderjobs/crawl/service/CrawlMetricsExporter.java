package com.spiderjobs.crawl.service;

import com.spiderjobs.crawl.model.CrawlMetricsSnapshot;

/**
 * Receives a metrics snapshot at the end of every crawl run.
 */
public interface CrawlMetricsExporter {
    void export(CrawlMetricsSnapshot snapshot);
}
