package com.spiderjobs.crawl.governor;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.breaker.CircuitBreaker;
import com.spiderjobs.crawl.breaker.CircuitBreakerRegistry;
import com.spiderjobs.crawl.log.CrawlLogListener;
import com.spiderjobs.crawl.model.BreakerState;
import com.spiderjobs.crawl.model.CrawlLogEntry;
import com.spiderjobs.crawl.model.FetchOutcome;
import com.spiderjobs.crawl.model.SiteConfig;
import com.spiderjobs.crawl.service.SiteRegistry;
import com.spiderjobs.crawl.service.UnknownSiteException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-site dispatch gate.
 *
 * <p>A site gets at most {@code rateLimit.requests} grants in any window of
 * {@code rateLimit.interval * backoffMultiplier}, and at most {@code maxConcurrency} permits
 * outstanding. Blocked responses raise the multiplier; a streak of successes lowers it again.
 * Never blocks the caller.
 */
@Component
public class PolitenessGovernor implements CrawlLogListener {
    private static final Logger log = LoggerFactory.getLogger(PolitenessGovernor.class);
    private static final Duration CONCURRENCY_WAIT = Duration.ofMillis(50);
    private static final Duration PAUSED_WAIT = Duration.ofSeconds(1);

    private final SiteRegistry siteRegistry;
    private final CircuitBreakerRegistry breakers;
    private final Clock clock;
    private final double backoffFactor;
    private final double maxBackoffMultiplier;
    private final int recoverySuccesses;
    private final Map<String, SiteState> states = new ConcurrentHashMap<>();

    public PolitenessGovernor(
        SiteRegistry siteRegistry,
        CircuitBreakerRegistry breakers,
        CrawlerProperties properties,
        Clock clock
    ) {
        this.siteRegistry = siteRegistry;
        this.breakers = breakers;
        this.clock = clock;
        this.backoffFactor = properties.getGovernor().getBackoffFactor();
        this.maxBackoffMultiplier = properties.getGovernor().getMaxBackoffMultiplier();
        this.recoverySuccesses = properties.getGovernor().getRecoverySuccesses();
    }

    public GovernorDecision acquire(String siteId) {
        SiteState state = state(siteId);
        if (state == null) {
            return GovernorDecision.denied(GovernorDecision.DenialReason.UNKNOWN_SITE, PAUSED_WAIT);
        }
        if (state.paused) {
            return GovernorDecision.denied(GovernorDecision.DenialReason.PAUSED, PAUSED_WAIT);
        }
        if (breakers.state(siteId) == BreakerState.OPEN) {
            Duration remaining = breakers.remainingOpen(siteId);
            if (!remaining.isZero()) {
                return GovernorDecision.denied(GovernorDecision.DenialReason.CIRCUIT_OPEN, remaining);
            }
        }
        synchronized (state) {
            Instant now = clock.instant();
            if (state.inFlight >= state.site.maxConcurrency()) {
                return GovernorDecision.denied(GovernorDecision.DenialReason.CONCURRENCY, CONCURRENCY_WAIT);
            }
            Duration interval = state.effectiveInterval();
            evictExpired(state, now, interval);
            if (state.grants.size() >= state.site.rateLimit().requests()) {
                Instant nextAt = state.grants.peekFirst().plus(interval);
                return GovernorDecision.denied(GovernorDecision.DenialReason.RATE_LIMITED, Duration.between(now, nextAt));
            }
            CircuitBreaker.Admission admission = breakers.admit(siteId);
            if (admission == CircuitBreaker.Admission.REJECTED) {
                Duration remaining = breakers.remainingOpen(siteId);
                Duration wait = remaining.compareTo(CONCURRENCY_WAIT) > 0 ? remaining : CONCURRENCY_WAIT;
                return GovernorDecision.denied(GovernorDecision.DenialReason.CIRCUIT_OPEN, wait);
            }
            state.grants.addLast(now);
            state.inFlight++;
            return GovernorDecision.granted(new Permit(this, siteId, now, admission == CircuitBreaker.Admission.PROBE));
        }
    }

    void onRelease(Permit permit) {
        SiteState state = states.get(permit.siteId());
        if (state == null) {
            return;
        }
        synchronized (state) {
            state.inFlight = Math.max(0, state.inFlight - 1);
        }
    }

    void onCancel(Permit permit) {
        SiteState state = states.get(permit.siteId());
        if (state == null) {
            return;
        }
        synchronized (state) {
            state.inFlight = Math.max(0, state.inFlight - 1);
            state.grants.removeLastOccurrence(permit.grantedAt());
        }
        if (permit.isProbe()) {
            breakers.cancelProbe(permit.siteId());
        }
    }

    @Override
    public void onEntry(CrawlLogEntry entry) {
        SiteState state = state(entry.siteId());
        if (state == null) {
            return;
        }
        synchronized (state) {
            if (entry.outcome() == FetchOutcome.BLOCKED) {
                double previous = state.multiplier;
                state.multiplier = Math.min(maxBackoffMultiplier, state.multiplier * backoffFactor);
                state.successStreak = 0;
                if (state.multiplier != previous) {
                    log.info("Backing off site {}: interval multiplier {} -> {}", entry.siteId(), previous, state.multiplier);
                }
            } else if (entry.outcome() == FetchOutcome.SUCCESS) {
                state.successStreak++;
                if (state.successStreak >= recoverySuccesses && state.multiplier > 1.0) {
                    double previous = state.multiplier;
                    state.multiplier = Math.max(1.0, state.multiplier / backoffFactor);
                    state.successStreak = 0;
                    log.info("Recovering site {}: interval multiplier {} -> {}", entry.siteId(), previous, state.multiplier);
                }
            } else if (entry.outcome() != FetchOutcome.CANCELLED) {
                state.successStreak = 0;
            }
        }
    }

    public void pause(String siteId) {
        SiteState state = requireState(siteId);
        state.paused = true;
        log.info("Paused dispatch for site {}", siteId);
    }

    public void resume(String siteId) {
        SiteState state = requireState(siteId);
        state.paused = false;
        log.info("Resumed dispatch for site {}", siteId);
    }

    public boolean isPaused(String siteId) {
        SiteState state = state(siteId);
        return state != null && state.paused;
    }

    public List<String> pausedSites() {
        List<String> out = new ArrayList<>();
        for (String siteId : siteRegistry.siteIds()) {
            if (isPaused(siteId)) {
                out.add(siteId);
            }
        }
        return out;
    }

    public double backoffMultiplier(String siteId) {
        SiteState state = state(siteId);
        if (state == null) {
            return 1.0;
        }
        synchronized (state) {
            return state.multiplier;
        }
    }

    public Duration effectiveInterval(String siteId) {
        SiteState state = requireState(siteId);
        synchronized (state) {
            return state.effectiveInterval();
        }
    }

    private void evictExpired(SiteState state, Instant now, Duration interval) {
        while (!state.grants.isEmpty() && !state.grants.peekFirst().plus(interval).isAfter(now)) {
            state.grants.removeFirst();
        }
    }

    private SiteState requireState(String siteId) {
        SiteState state = state(siteId);
        if (state == null) {
            throw new UnknownSiteException(siteId);
        }
        return state;
    }

    private SiteState state(String siteId) {
        SiteConfig site = siteRegistry.find(siteId).orElse(null);
        if (site == null) {
            return null;
        }
        return states.computeIfAbsent(siteId, ignored -> new SiteState(site));
    }

    private static final class SiteState {
        private final SiteConfig site;
        private final Deque<Instant> grants = new ArrayDeque<>();
        private volatile boolean paused;
        private int inFlight;
        private double multiplier = 1.0;
        private int successStreak;

        private SiteState(SiteConfig site) {
            this.site = site;
        }

        private Duration effectiveInterval() {
            long base = site.rateLimit().interval().toMillis();
            return Duration.ofMillis(Math.round(base * multiplier));
        }
    }
}
