package com.hierarchy.federation.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.hierarchy.federation.metrics.MetricsService;
import com.hierarchy.federation.metrics.NoOpMetricsService;
import com.hierarchy.federation.view.View;
import com.hierarchy.federation.view.ViewName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Caffeine-backed view cache.
 *
 * <p>Views of a version older than the last retained one are computed but
 * never stored; readers still holding a superseded index get a correct view
 * without pinning it in the cache.</p>
 */
public class CaffeineViewCache implements ViewCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineViewCache.class);

    private final Cache<CacheKey, View> cache;
    private final MetricsService metricsService;
    private final AtomicLong retainedVersion = new AtomicLong(Long.MIN_VALUE);

    public CaffeineViewCache(CacheConfig config) {
        this(config, new NoOpMetricsService());
    }

    public CaffeineViewCache(CacheConfig config, MetricsService metricsService) {
        this.metricsService = Objects.requireNonNull(metricsService, "metricsService");
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineViewCache initialized: maxSize={}, ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public View get(long indexVersion, ViewName name, Supplier<View> loader) {
        if (indexVersion < retainedVersion.get()) {
            metricsService.recordViewCacheMiss();
            log.debug("Serving superseded view uncached: version={} name={}", indexVersion, name);
            return loader.get();
        }
        CacheKey cacheKey = new CacheKey(indexVersion, name);
        AtomicBoolean computed = new AtomicBoolean(false);
        View view = cache.get(cacheKey, key -> {
            computed.set(true);
            return loader.get();
        });
        if (indexVersion < retainedVersion.get()) {
            // Raced with retainVersion
            cache.invalidate(cacheKey);
        }
        if (computed.get()) {
            metricsService.recordViewCacheMiss();
        } else {
            metricsService.recordViewCacheHit();
        }
        return view;
    }

    @Override
    public void retainVersion(long indexVersion) {
        long retained = retainedVersion.accumulateAndGet(indexVersion, Math::max);
        int before = cache.asMap().size();
        cache.asMap().keySet().removeIf(key -> key.indexVersion() < retained);
        log.debug("Evicted {} cached views older than version {}", before - cache.asMap().size(), retained);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all cached views");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    record CacheKey(long indexVersion, ViewName name) {}
}
