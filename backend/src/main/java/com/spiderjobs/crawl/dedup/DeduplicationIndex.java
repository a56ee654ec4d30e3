package com.spiderjobs.crawl.dedup;

/**
 * Seen-URL and seen-content fingerprints shared by every worker.
 *
 * <p>Both mark operations are atomic check-and-set: for any fingerprint exactly one caller
 * observes {@code true}, no matter how many race.
 */
public interface DeduplicationIndex {

    /**
     * @return true if the fingerprint was not seen before and is now marked
     */
    boolean markSeenUrl(String fingerprint);

    /**
     * @return true if the fingerprint was not seen before and is now marked
     */
    boolean markSeenContent(String fingerprint);

    /**
     * Cheap probabilistic membership test. False means definitely unseen; true may be a false
     * positive and must not be used to drop data.
     */
    boolean mightContainUrl(String fingerprint);

    long seenUrlCount();

    long seenContentCount();
}
