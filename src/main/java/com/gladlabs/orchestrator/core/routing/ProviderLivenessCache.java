package com.gladlabs.orchestrator.core.routing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caches provider probe results for a TTL.
 * <p>
 * Entries are immutable and replaced atomically. A provider that fails or times out is
 * marked down for the TTL so the next selection falls through to the next provider.
 * Such entries remember that they came from a failed call rather than a probe, which lets
 * the router check them again once nothing else in a chain is live.
 */
public class ProviderLivenessCache {

    private static final Logger log = LoggerFactory.getLogger(ProviderLivenessCache.class);

    /**
     * One liveness outcome.
     *
     * @param callFailure true when the provider was marked down after a failed or timed-out call
     */
    public record Entry(boolean live, Instant checkedAt, String reason, boolean callFailure) {}

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ProviderLivenessCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Returns the cached liveness of the provider, probing it when there is no fresh entry.
     */
    public boolean isLive(GenerationProvider provider) {
        Instant now = clock.instant();
        Entry cached = entries.get(provider.id());
        if (cached != null && !isExpired(cached, now)) {
            return cached.live();
        }
        Entry probed = probe(provider, now);
        entries.put(provider.id(), probed);
        return probed.live();
    }

    public void markDown(String providerId, String reason) {
        log.info("Marking provider {} down for {}s: {}", providerId, ttl.toSeconds(), reason);
        entries.put(providerId, new Entry(false, clock.instant(), reason, true));
    }

    public void markUp(String providerId) {
        entries.put(providerId, new Entry(true, clock.instant(), null, false));
    }

    /**
     * True when the provider's current entry is a fresh mark-down left by a failed call.
     */
    public boolean isDownAfterFailure(String providerId) {
        Entry cached = entries.get(providerId);
        return cached != null && !cached.live() && cached.callFailure() && !isExpired(cached, clock.instant());
    }

    /**
     * Probes the provider now, replacing whatever entry is cached.
     */
    public boolean recheck(GenerationProvider provider) {
        Entry probed = probe(provider, clock.instant());
        entries.put(provider.id(), probed);
        return probed.live();
    }

    public void invalidate(String providerId) {
        entries.remove(providerId);
    }

    public Map<String, Entry> snapshot() {
        return Map.copyOf(entries);
    }

    private boolean isExpired(Entry entry, Instant now) {
        return !entry.checkedAt().plus(ttl).isAfter(now);
    }

    private Entry probe(GenerationProvider provider, Instant now) {
        try {
            boolean live = provider.probe();
            log.debug("Probed provider {}: {}", provider.id(), live ? "live" : "down");
            return new Entry(live, now, live ? null : "probe reported unavailable", false);
        } catch (Exception e) {
            log.warn("Probe of provider {} failed: {}", provider.id(), e.getMessage());
            return new Entry(false, now, "probe failed: " + e.getMessage(), false);
        }
    }
}
