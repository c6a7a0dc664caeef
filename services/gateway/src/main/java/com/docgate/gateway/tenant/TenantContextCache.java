package com.docgate.gateway.tenant;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.time.Duration;
import java.util.Optional;

/**
 * Subject to active-tenant cache in front of the bootstrap lookup.
 *
 * <p>An entry can be stale for at most the TTL after the user switches tenant elsewhere. Writes
 * made through the gateway update or invalidate the affected entries directly. Decisions that must
 * not be stale, such as tenant deletion, read the store instead.
 */
public final class TenantContextCache {

    private final Cache<String, String> cache;

    public TenantContextCache(Duration ttl, long maxSize) {
        this(ttl, maxSize, Ticker.systemTicker());
    }

    public TenantContextCache(Duration ttl, long maxSize, Ticker ticker) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive");
        }
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker)
                .recordStats()
                .build();
    }

    /** Cached active tenant of a subject; empty when absent or expired. */
    public Optional<String> get(String subject) {
        return Optional.ofNullable(cache.getIfPresent(subject));
    }

    /** Records the active tenant of a subject, restarting its TTL. */
    public void put(String subject, String tenantId) {
        cache.put(subject, tenantId);
    }

    /** Forgets a subject, so the next lookup goes to the store. */
    public void invalidate(String subject) {
        cache.invalidate(subject);
    }

    /** Drops every subject currently resolved to {@code tenantId}. */
    public void invalidateTenant(String tenantId) {
        cache.asMap().values().removeIf(tenantId::equals);
    }

    /** Approximate number of cached subjects. */
    public long size() {
        return cache.estimatedSize();
    }

    /** Hit and miss counters since the cache was built. */
    public CacheStats stats() {
        return cache.stats();
    }
}
