package com.spiderjobs.crawl;

import com.spiderjobs.crawl.model.JobListing;
import com.spiderjobs.crawl.sink.ListingSink;
import com.spiderjobs.crawl.sink.SinkException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

public class InMemoryListingSink implements ListingSink {
    private final List<JobListing> written = new ArrayList<>();
    private final Predicate<JobListing> failWhen;

    public InMemoryListingSink() {
        this(listing -> false);
    }

    public InMemoryListingSink(Predicate<JobListing> failWhen) {
        this.failWhen = failWhen;
    }

    @Override
    public synchronized void write(JobListing listing) throws SinkException {
        if (failWhen.test(listing)) {
            throw new SinkException("rejected " + listing.canonicalLink());
        }
        written.add(listing);
    }

    @Override
    public String name() {
        return "memory";
    }

    public synchronized List<JobListing> written() {
        return new ArrayList<>(written);
    }
}
