package com.spiderjobs.crawl.governor;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Permission to issue one request to a site. Exactly one of {@link #release()} (request made)
 * or {@link #cancel()} (request not made) takes effect; later calls are ignored.
 */
public final class Permit {
    private final PolitenessGovernor governor;
    private final String siteId;
    private final Instant grantedAt;
    private final boolean probe;
    private final AtomicBoolean settled = new AtomicBoolean(false);

    Permit(PolitenessGovernor governor, String siteId, Instant grantedAt, boolean probe) {
        this.governor = governor;
        this.siteId = siteId;
        this.grantedAt = grantedAt;
        this.probe = probe;
    }

    public String siteId() {
        return siteId;
    }

    public Instant grantedAt() {
        return grantedAt;
    }

    /**
     * Whether this permit was admitted as a half-open breaker probe.
     */
    public boolean isProbe() {
        return probe;
    }

    public void release() {
        if (settled.compareAndSet(false, true)) {
            governor.onRelease(this);
        }
    }

    public void cancel() {
        if (settled.compareAndSet(false, true)) {
            governor.onCancel(this);
        }
    }
}
