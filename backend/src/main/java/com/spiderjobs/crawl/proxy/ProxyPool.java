package com.spiderjobs.crawl.proxy;

import com.spiderjobs.config.CrawlerProperties;
import com.spiderjobs.crawl.model.FetchOutcome;
import com.spiderjobs.crawl.model.ProxyHealthSnapshot;
import com.spiderjobs.crawl.model.ProxyIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rotating egress identities. Selection is random, weighted by health, among identities not
 * cooling down.
 */
@Component
public class ProxyPool {
    private static final Logger log = LoggerFactory.getLogger(ProxyPool.class);
    static final String DIRECT_IDENTITY_ID = "direct";

    private final Map<String, ProxyRecord> records = new LinkedHashMap<>();
    private final Clock clock;
    private final int maxConsecutiveFailures;
    private final Duration cooldown;

    @Autowired
    public ProxyPool(CrawlerProperties properties, Clock clock) {
        this(
            identitiesFrom(properties),
            properties.getProxy().getMaxConsecutiveFailures(),
            Duration.ofMillis(properties.getProxy().getCooldownMs()),
            clock
        );
    }

    public ProxyPool(List<ProxyIdentity> identities, int maxConsecutiveFailures, Duration cooldown, Clock clock) {
        if (identities.isEmpty()) {
            throw new IllegalArgumentException("at least one identity is required");
        }
        for (ProxyIdentity identity : identities) {
            if (records.putIfAbsent(identity.id(), new ProxyRecord(identity)) != null) {
                throw new IllegalArgumentException("duplicate identity id: " + identity.id());
            }
        }
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.cooldown = cooldown;
        this.clock = clock;
    }

    public ProxyIdentity select(String siteId) {
        return select(siteId, null);
    }

    /**
     * Like {@link #select(String)} but skips {@code avoidIdentityId} while any other identity is
     * eligible.
     */
    public ProxyIdentity select(String siteId, String avoidIdentityId) {
        Instant now = clock.instant();
        List<ProxyRecord> eligible = new ArrayList<>();
        Instant earliest = null;
        for (ProxyRecord record : records.values()) {
            if (record.isEligible(now)) {
                eligible.add(record);
            } else {
                Instant until = record.cooldownUntil();
                if (earliest == null || until.isBefore(earliest)) {
                    earliest = until;
                }
            }
        }
        if (eligible.isEmpty()) {
            throw new PoolExhaustedException("No eligible identity for site " + siteId, earliest);
        }
        if (avoidIdentityId != null && eligible.size() > 1) {
            eligible.removeIf(record -> record.identity().id().equals(avoidIdentityId));
        }
        double totalWeight = 0.0;
        for (ProxyRecord record : eligible) {
            totalWeight += record.healthScore();
        }
        ProxyRecord chosen = eligible.get(eligible.size() - 1);
        double pick = ThreadLocalRandom.current().nextDouble() * totalWeight;
        for (ProxyRecord record : eligible) {
            pick -= record.healthScore();
            if (pick < 0) {
                chosen = record;
                break;
            }
        }
        chosen.markUsed(now);
        return chosen.identity();
    }

    public void reportOutcome(ProxyIdentity identity, FetchOutcome outcome) {
        ProxyRecord record = records.get(identity.id());
        if (record == null) {
            log.warn("Outcome reported for unknown identity {}", identity.id());
            return;
        }
        Instant now = clock.instant();
        boolean cooled = switch (outcome) {
            case SUCCESS -> {
                record.recordSuccess();
                yield false;
            }
            case BLOCKED -> record.recordBlocked(now, maxConsecutiveFailures, cooldown);
            case TIMEOUT, NETWORK_ERROR -> record.recordFailure(now, maxConsecutiveFailures, cooldown);
            default -> false;
        };
        if (cooled) {
            log.warn("Identity {} placed in cooldown until {} after {} consecutive failures",
                identity.id(), record.cooldownUntil(), maxConsecutiveFailures);
        }
    }

    public boolean isExhausted() {
        Instant now = clock.instant();
        for (ProxyRecord record : records.values()) {
            if (record.isEligible(now)) {
                return false;
            }
        }
        return true;
    }

    public List<ProxyHealthSnapshot> snapshot() {
        Instant now = clock.instant();
        List<ProxyHealthSnapshot> out = new ArrayList<>();
        for (ProxyRecord record : records.values()) {
            out.add(record.snapshot(now));
        }
        return out;
    }

    public List<ProxyIdentity> identities() {
        List<ProxyIdentity> out = new ArrayList<>();
        for (ProxyRecord record : records.values()) {
            out.add(record.identity());
        }
        return out;
    }

    static List<ProxyIdentity> identitiesFrom(CrawlerProperties properties) {
        List<ProxyIdentity> out = new ArrayList<>();
        for (CrawlerProperties.Identity identity : properties.getProxy().getIdentities()) {
            Map<String, String> headers = defaultHeaders(properties.getUserAgent());
            headers.putAll(identity.getHeaders());
            String id = identity.getId();
            if (id == null || id.isBlank()) {
                id = identity.getHost() == null ? DIRECT_IDENTITY_ID + "-" + out.size() : identity.getHost() + ":" + identity.getPort();
            }
            out.add(new ProxyIdentity(id, identity.getHost(), identity.getPort(), headers));
        }
        if (out.isEmpty()) {
            out.add(new ProxyIdentity(DIRECT_IDENTITY_ID, null, null, defaultHeaders(properties.getUserAgent())));
        }
        return out;
    }

    private static Map<String, String> defaultHeaders(String userAgent) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", userAgent);
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8");
        headers.put("Accept-Language", "en-US,en;q=0.5");
        headers.put("Upgrade-Insecure-Requests", "1");
        return headers;
    }
}
