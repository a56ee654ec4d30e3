package com.spiderjobs.crawl.sink;

import com.spiderjobs.crawl.model.JobListing;
import com.spiderjobs.crawl.persistence.JobListingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "crawler.sink", name = "type", havingValue = "jdbc", matchIfMissing = true)
public class JdbcListingSink implements ListingSink {
    private static final Logger log = LoggerFactory.getLogger(JdbcListingSink.class);

    private final JobListingRepository repository;

    public JdbcListingSink(JobListingRepository repository) {
        this.repository = repository;
    }

    @Override
    public void write(JobListing listing) throws SinkException {
        try {
            boolean inserted = repository.insertIfAbsent(listing);
            if (!inserted) {
                log.debug("Listing {} already stored", listing.canonicalLink());
            }
        } catch (DataAccessException e) {
            throw new SinkException("failed to store listing " + listing.canonicalLink(), e);
        }
    }

    @Override
    public String name() {
        return "jdbc";
    }
}
