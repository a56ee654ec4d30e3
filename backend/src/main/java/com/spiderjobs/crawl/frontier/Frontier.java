package com.spiderjobs.crawl.frontier;

import com.spiderjobs.crawl.dedup.DeduplicationIndex;
import com.spiderjobs.crawl.model.EnqueueResult;
import com.spiderjobs.crawl.model.FetchTask;
import com.spiderjobs.crawl.model.FrontierStats;
import com.spiderjobs.crawl.model.SiteConfig;
import com.spiderjobs.crawl.service.SiteRegistry;
import com.spiderjobs.crawl.util.HashUtils;
import com.spiderjobs.crawl.util.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pending fetch tasks, partitioned per site.
 *
 * <p>Each partition has a ready queue ordered by depth, then priority, then arrival, and a
 * delayed queue ordered by {@link FetchTask#notBefore()} holding tasks waiting on a retry
 * backoff. Every partition operation runs under that partition's monitor, so a task is handed
 * to at most one caller of {@link #dequeue(String)}.
 */
@Component
public class Frontier {
    private static final Logger log = LoggerFactory.getLogger(Frontier.class);

    private static final Comparator<Entry> READY_ORDER = Comparator
        .comparingInt((Entry e) -> e.task().depth())
        .thenComparingInt(e -> e.task().priority())
        .thenComparingLong(Entry::sequence);

    private static final Comparator<Entry> DELAYED_ORDER = Comparator
        .comparing((Entry e) -> e.task().notBefore())
        .thenComparingLong(Entry::sequence);

    private final SiteRegistry siteRegistry;
    private final DeduplicationIndex deduplicationIndex;
    private final Clock clock;
    private final Map<String, Partition> partitions = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public Frontier(SiteRegistry siteRegistry, DeduplicationIndex deduplicationIndex, Clock clock) {
        this.siteRegistry = siteRegistry;
        this.deduplicationIndex = deduplicationIndex;
        this.clock = clock;
    }

    public EnqueueResult enqueue(FetchTask task) {
        return enqueue(task, false);
    }

    /**
     * Admits a task unless its URL was already seen. {@code force} re-admits a seen URL (explicit
     * re-crawl) as long as it is not currently queued or in flight.
     */
    public EnqueueResult enqueue(FetchTask task, boolean force) {
        if (task == null) {
            return EnqueueResult.INVALID_URL;
        }
        SiteConfig site = siteRegistry.find(task.siteId()).orElse(null);
        if (site == null) {
            log.debug("Rejecting {} for unknown site {}", task.url(), task.siteId());
            return EnqueueResult.UNKNOWN_SITE;
        }
        if (task.depth() > site.maxDepth()) {
            return EnqueueResult.DEPTH_EXCEEDED;
        }
        String fingerprint = fingerprintOf(task.url());
        if (fingerprint == null) {
            log.debug("Rejecting malformed url {}", task.url());
            return EnqueueResult.INVALID_URL;
        }
        boolean fresh = deduplicationIndex.markSeenUrl(fingerprint);
        if (!fresh && !force) {
            return EnqueueResult.DUPLICATE;
        }
        Partition partition = partition(site.siteId());
        synchronized (partition) {
            if (partition.pending.contains(fingerprint) || partition.inFlight.containsKey(fingerprint)) {
                return EnqueueResult.DUPLICATE;
            }
            partition.add(new Entry(task, fingerprint, sequence.incrementAndGet()), clock.instant());
        }
        return EnqueueResult.ADMITTED;
    }

    /**
     * Returns the next eligible task for the site and marks it in flight. Never blocks.
     */
    public Optional<FetchTask> dequeue(String siteId) {
        Partition partition = partitions.get(siteId);
        if (partition == null) {
            return Optional.empty();
        }
        synchronized (partition) {
            partition.promoteDue(clock.instant());
            Entry next = partition.ready.poll();
            if (next == null) {
                return Optional.empty();
            }
            partition.pending.remove(next.fingerprint());
            partition.inFlight.put(next.fingerprint(), next.task());
            return Optional.of(next.task());
        }
    }

    public void reschedule(FetchTask task, Duration delay) {
        reschedule(task.deferredUntil(clock.instant().plus(delay)));
    }

    /**
     * Puts an in-flight task back, eligible again at {@code updated.notBefore()}. Bypasses
     * deduplication since the URL was admitted already.
     */
    public void reschedule(FetchTask updated) {
        String fingerprint = fingerprintOf(updated.url());
        Partition partition = partitions.get(updated.siteId());
        if (fingerprint == null || partition == null) {
            log.warn("Cannot reschedule {} for site {}", updated.url(), updated.siteId());
            return;
        }
        synchronized (partition) {
            if (partition.inFlight.remove(fingerprint) == null) {
                log.warn("Reschedule of {} which is not in flight; ignoring", updated.url());
                return;
            }
            partition.add(new Entry(updated, fingerprint, sequence.incrementAndGet()), clock.instant());
        }
    }

    /**
     * Clears the in-flight record of a task that reached a terminal state.
     */
    public void complete(FetchTask task) {
        String fingerprint = fingerprintOf(task.url());
        Partition partition = partitions.get(task.siteId());
        if (fingerprint == null || partition == null) {
            return;
        }
        synchronized (partition) {
            partition.inFlight.remove(fingerprint);
        }
    }

    public boolean hasEligible(String siteId) {
        Partition partition = partitions.get(siteId);
        if (partition == null) {
            return false;
        }
        synchronized (partition) {
            partition.promoteDue(clock.instant());
            return !partition.ready.isEmpty();
        }
    }

    /**
     * Earliest time a delayed task of the site becomes eligible, if any.
     */
    public Optional<Instant> nextEligibleAt(String siteId) {
        Partition partition = partitions.get(siteId);
        if (partition == null) {
            return Optional.empty();
        }
        synchronized (partition) {
            if (!partition.ready.isEmpty()) {
                return Optional.of(clock.instant());
            }
            Entry head = partition.delayed.peek();
            return head == null ? Optional.empty() : Optional.of(head.task().notBefore());
        }
    }

    /**
     * True when no task is queued, delayed or in flight for any site.
     */
    public boolean isDrained() {
        for (Partition partition : partitions.values()) {
            synchronized (partition) {
                if (!partition.ready.isEmpty() || !partition.delayed.isEmpty() || !partition.inFlight.isEmpty()) {
                    return false;
                }
            }
        }
        return true;
    }

    public int inFlightCount() {
        int total = 0;
        for (Partition partition : partitions.values()) {
            synchronized (partition) {
                total += partition.inFlight.size();
            }
        }
        return total;
    }

    public int pendingCount() {
        int total = 0;
        for (Partition partition : partitions.values()) {
            synchronized (partition) {
                total += partition.ready.size() + partition.delayed.size();
            }
        }
        return total;
    }

    public FrontierStats stats(String siteId) {
        Partition partition = partitions.get(siteId);
        if (partition == null) {
            return new FrontierStats(siteId, 0, 0, 0);
        }
        synchronized (partition) {
            return new FrontierStats(siteId, partition.ready.size(), partition.delayed.size(), partition.inFlight.size());
        }
    }

    public List<FrontierStats> stats() {
        List<FrontierStats> out = new ArrayList<>();
        for (String siteId : siteRegistry.siteIds()) {
            out.add(stats(siteId));
        }
        return out;
    }

    /**
     * Removes and returns every queued or delayed task so it can be persisted. In-flight tasks
     * are left alone.
     */
    public List<FetchTask> drainPending() {
        List<FetchTask> out = new ArrayList<>();
        for (Partition partition : partitions.values()) {
            synchronized (partition) {
                for (Entry entry : partition.ready) {
                    out.add(entry.task());
                }
                for (Entry entry : partition.delayed) {
                    out.add(entry.task());
                }
                partition.ready.clear();
                partition.delayed.clear();
                partition.pending.clear();
            }
        }
        return out;
    }

    /**
     * Re-queues tasks from a previous run. Their URLs are marked seen again.
     *
     * @return number of tasks queued
     */
    public int restore(List<FetchTask> tasks) {
        int restored = 0;
        for (FetchTask task : tasks) {
            if (siteRegistry.find(task.siteId()).isEmpty()) {
                log.warn("Skipping restored task {} for unknown site {}", task.url(), task.siteId());
                continue;
            }
            if (enqueue(task, true) == EnqueueResult.ADMITTED) {
                restored++;
            }
        }
        return restored;
    }

    public static String fingerprintOf(String url) {
        String normalized = UrlNormalizer.normalize(url);
        return normalized == null ? null : HashUtils.urlFingerprint(normalized);
    }

    private Partition partition(String siteId) {
        return partitions.computeIfAbsent(siteId, ignored -> new Partition());
    }

    private record Entry(FetchTask task, String fingerprint, long sequence) {
    }

    private static final class Partition {
        private final PriorityQueue<Entry> ready = new PriorityQueue<>(READY_ORDER);
        private final PriorityQueue<Entry> delayed = new PriorityQueue<>(DELAYED_ORDER);
        private final Set<String> pending = new HashSet<>();
        private final Map<String, FetchTask> inFlight = new HashMap<>();

        private void add(Entry entry, Instant now) {
            Instant notBefore = entry.task().notBefore();
            if (notBefore == null || !notBefore.isAfter(now)) {
                ready.add(entry);
            } else {
                delayed.add(entry);
            }
            pending.add(entry.fingerprint());
        }

        private void promoteDue(Instant now) {
            while (!delayed.isEmpty() && !delayed.peek().task().notBefore().isAfter(now)) {
                ready.add(delayed.poll());
            }
        }
    }
}
