package com.spiderjobs.crawl.sink;

import com.spiderjobs.crawl.model.JobListing;

/**
 * Destination for deduplicated listings.
 *
 * <p>Implementations must be safe for concurrent use. A write that returns normally is
 * acknowledged; writing a listing that is already stored is not an error.
 */
public interface ListingSink {

    void write(JobListing listing) throws SinkException;

    /**
     * Short label used in logs and metrics.
     */
    String name();
}
