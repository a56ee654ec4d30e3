package com.spiderjobs.crawl.breaker;

import com.spiderjobs.crawl.model.BreakerState;
import com.spiderjobs.crawl.model.FetchOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-site breaker.
 *
 * <pre>
 * CLOSED    --error rate over window above threshold--> OPEN
 * OPEN      --open duration elapsed, next request-----> HALF_OPEN
 * HALF_OPEN --probe succeeded-------------------------> CLOSED
 * HALF_OPEN --probe failed----------------------------> OPEN
 * </pre>
 *
 * Time is always passed in so the state machine can be driven without a clock.
 */
public class CircuitBreaker {

    public enum Admission {
        REJECTED,
        ALLOWED,
        PROBE
    }

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String siteId;
    private final Duration window;
    private final int minimumRequests;
    private final double errorRateThreshold;
    private final Duration openDuration;
    private final int halfOpenProbes;

    private final Deque<Sample> samples = new ArrayDeque<>();
    private BreakerState state = BreakerState.CLOSED;
    private Instant openedAt;
    private int probesIssued;
    private int errorsInWindow;

    public CircuitBreaker(
        String siteId,
        Duration window,
        int minimumRequests,
        double errorRateThreshold,
        Duration openDuration,
        int halfOpenProbes
    ) {
        this.siteId = siteId;
        this.window = window;
        this.minimumRequests = Math.max(1, minimumRequests);
        this.errorRateThreshold = errorRateThreshold;
        this.openDuration = openDuration;
        this.halfOpenProbes = Math.max(1, halfOpenProbes);
    }

    /**
     * Whether a request may be dispatched now. In HALF_OPEN an admission is a {@code PROBE} and
     * consumes a probe slot, to be given back through {@link #cancelProbe()} if the request is
     * never made. Only outcomes reported as probes move a half-open breaker.
     */
    public synchronized Admission admit(Instant now) {
        if (state == BreakerState.OPEN) {
            if (now.isBefore(openedAt.plus(openDuration))) {
                return Admission.REJECTED;
            }
            transition(BreakerState.HALF_OPEN);
            probesIssued = 0;
        }
        if (state == BreakerState.HALF_OPEN) {
            if (probesIssued >= halfOpenProbes) {
                return Admission.REJECTED;
            }
            probesIssued++;
            return Admission.PROBE;
        }
        return Admission.ALLOWED;
    }

    public boolean allowRequest(Instant now) {
        return admit(now) != Admission.REJECTED;
    }

    public synchronized void cancelProbe() {
        if (state == BreakerState.HALF_OPEN && probesIssued > 0) {
            probesIssued--;
        }
    }

    public BreakerState onOutcome(FetchOutcome outcome, Instant now) {
        return onOutcome(outcome, now, false);
    }

    public synchronized BreakerState onOutcome(FetchOutcome outcome, Instant now, boolean probe) {
        if (outcome == FetchOutcome.CANCELLED) {
            if (probe) {
                cancelProbe();
            }
            return state;
        }
        boolean error = outcome.countsAsSiteError();
        switch (state) {
            case CLOSED -> {
                samples.addLast(new Sample(now, error));
                if (error) {
                    errorsInWindow++;
                }
                evictBefore(now.minus(window));
                if (samples.size() >= minimumRequests
                    && (double) errorsInWindow / samples.size() > errorRateThreshold) {
                    trip(now);
                }
            }
            case HALF_OPEN -> {
                if (!probe) {
                    return state;
                }
                if (error) {
                    trip(now);
                } else {
                    samples.clear();
                    errorsInWindow = 0;
                    transition(BreakerState.CLOSED);
                }
            }
            case OPEN -> {
                // requests dispatched before the trip do not move an open breaker
            }
        }
        return state;
    }

    public synchronized BreakerState state() {
        return state;
    }

    /**
     * Time left before an OPEN breaker admits a probe; zero in any other state.
     */
    public synchronized Duration remainingOpen(Instant now) {
        if (state != BreakerState.OPEN) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(now, openedAt.plus(openDuration));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public synchronized void reset() {
        samples.clear();
        errorsInWindow = 0;
        probesIssued = 0;
        transition(BreakerState.CLOSED);
    }

    private void trip(Instant now) {
        openedAt = now;
        probesIssued = 0;
        samples.clear();
        errorsInWindow = 0;
        transition(BreakerState.OPEN);
    }

    private void evictBefore(Instant cutoff) {
        while (!samples.isEmpty() && samples.peekFirst().at().isBefore(cutoff)) {
            if (samples.removeFirst().error()) {
                errorsInWindow--;
            }
        }
    }

    private void transition(BreakerState next) {
        if (state != next) {
            log.info("Circuit breaker for site {} {} -> {}", siteId, state, next);
            state = next;
        }
    }

    private record Sample(Instant at, boolean error) {
    }
}
