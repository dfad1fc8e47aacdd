package com.hierarchy.federation.cache;

import com.hierarchy.federation.view.View;
import com.hierarchy.federation.view.ViewName;

import java.util.function.Supplier;

/**
 * Cache of materialized views keyed by index version and view name.
 * An entry computed for one index version is never returned for another.
 */
public interface ViewCache {

    /**
     * Returns the cached view for this version and name, computing and caching it when absent.
     */
    View get(long indexVersion, ViewName name, Supplier<View> loader);

    /**
     * Drops every entry that was not computed for the given version.
     * Called once a new index version is published.
     */
    void retainVersion(long indexVersion);

    void invalidateAll();

    CacheStats getStats();
}
