package com.hierarchy.federation.cache;

import com.hierarchy.federation.view.View;
import com.hierarchy.federation.view.ViewName;

import java.util.function.Supplier;

/**
 * Cache that always recomputes. Used when caching is disabled.
 */
public class NoOpViewCache implements ViewCache {

    @Override
    public View get(long indexVersion, ViewName name, Supplier<View> loader) {
        return loader.get();
    }

    @Override
    public void retainVersion(long indexVersion) {
    }

    @Override
    public void invalidateAll() {
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
