package com.spiderjobs.crawl.dedup;

import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.primitives.Longs;
import com.spiderjobs.config.CrawlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bloom filter in front of a capped exact concurrent set, per tier.
 *
 * <p>Exact entries are 128-bit keys rather than the hex fingerprint strings, so each costs a
 * few dozen bytes. Past the URL cap, URL admission is answered by the Bloom filter alone: it may
 * reject a small fraction of new URLs but never admits one twice. Past the content cap, a
 * fingerprint the Bloom filter has never seen is admitted and only recorded there; a possible
 * repeat that is not in the exact tier is admitted as well and left to the sink's unique key,
 * so a false positive never skips a write.
 */
@Component
public class TwoTierDeduplicationIndex implements DeduplicationIndex {
    private static final Logger log = LoggerFactory.getLogger(TwoTierDeduplicationIndex.class);
    private static final HashFunction KEY_HASH = Hashing.murmur3_128();

    private final BloomFilter<CharSequence> urlFilter;
    private final BloomFilter<CharSequence> contentFilter;
    private final Set<Key> exactUrls = ConcurrentHashMap.newKeySet();
    private final Set<Key> exactContent = ConcurrentHashMap.newKeySet();
    private final int urlExactCapacity;
    private final int contentExactCapacity;
    private final Object urlLock = new Object();
    private final Object contentLock = new Object();
    private final AtomicLong approximateUrls = new AtomicLong();
    private final AtomicLong approximateContent = new AtomicLong();
    private final AtomicBoolean urlDegradedLogged = new AtomicBoolean(false);
    private final AtomicBoolean contentDegradedLogged = new AtomicBoolean(false);

    @Autowired
    public TwoTierDeduplicationIndex(CrawlerProperties properties) {
        this(
            properties.getDedup().getExpectedUrls(),
            properties.getDedup().getExpectedListings(),
            properties.getDedup().getFalsePositiveRate(),
            properties.getDedup().getUrlExactCapacity(),
            properties.getDedup().getContentExactCapacity()
        );
    }

    public TwoTierDeduplicationIndex(int expectedUrls, int expectedListings, double falsePositiveRate, int urlExactCapacity) {
        this(expectedUrls, expectedListings, falsePositiveRate, urlExactCapacity, Integer.MAX_VALUE);
    }

    public TwoTierDeduplicationIndex(
        int expectedUrls,
        int expectedListings,
        double falsePositiveRate,
        int urlExactCapacity,
        int contentExactCapacity
    ) {
        this.urlFilter = BloomFilter.create(Funnels.stringFunnel(StandardCharsets.UTF_8), expectedUrls, falsePositiveRate);
        this.contentFilter = BloomFilter.create(Funnels.stringFunnel(StandardCharsets.UTF_8), expectedListings, falsePositiveRate);
        this.urlExactCapacity = urlExactCapacity;
        this.contentExactCapacity = contentExactCapacity;
    }

    @Override
    public boolean markSeenUrl(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return false;
        }
        Key key = Key.of(fingerprint);
        if (exactUrls.contains(key)) {
            return false;
        }
        if (exactUrls.size() < urlExactCapacity) {
            boolean added = exactUrls.add(key);
            if (added) {
                urlFilter.put(fingerprint);
            }
            return added;
        }
        if (urlDegradedLogged.compareAndSet(false, true)) {
            log.warn("URL exact index reached capacity {}; admission is now approximate", urlExactCapacity);
        }
        synchronized (urlLock) {
            if (urlFilter.mightContain(fingerprint)) {
                return false;
            }
            urlFilter.put(fingerprint);
            approximateUrls.incrementAndGet();
            return true;
        }
    }

    @Override
    public boolean markSeenContent(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) {
            return false;
        }
        Key key = Key.of(fingerprint);
        if (contentFilter.mightContain(fingerprint) && exactContent.contains(key)) {
            return false;
        }
        if (exactContent.size() < contentExactCapacity) {
            boolean added = exactContent.add(key);
            if (added) {
                contentFilter.put(fingerprint);
            }
            return added;
        }
        if (contentDegradedLogged.compareAndSet(false, true)) {
            log.warn("Content exact index reached capacity {}; repeats are now settled by the sink", contentExactCapacity);
        }
        synchronized (contentLock) {
            if (!contentFilter.mightContain(fingerprint)) {
                contentFilter.put(fingerprint);
                approximateContent.incrementAndGet();
            }
            return true;
        }
    }

    @Override
    public boolean mightContainUrl(String fingerprint) {
        return fingerprint != null && urlFilter.mightContain(fingerprint);
    }

    @Override
    public long seenUrlCount() {
        return exactUrls.size() + approximateUrls.get();
    }

    @Override
    public long seenContentCount() {
        return exactContent.size() + approximateContent.get();
    }

    int exactUrlEntries() {
        return exactUrls.size();
    }

    int exactContentEntries() {
        return exactContent.size();
    }

    private record Key(long high, long low) {
        private static Key of(String fingerprint) {
            byte[] bytes = KEY_HASH.hashString(fingerprint, StandardCharsets.UTF_8).asBytes();
            return new Key(Longs.fromBytes(bytes[0], bytes[1], bytes[2], bytes[3], bytes[4], bytes[5], bytes[6], bytes[7]),
                Longs.fromBytes(bytes[8], bytes[9], bytes[10], bytes[11], bytes[12], bytes[13], bytes[14], bytes[15]));
        }
    }
}
