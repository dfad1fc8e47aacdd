package com.hierarchy.federation.view;

/**
 * Read-only projection of one index version.
 */
public interface View {

    ViewName name();

    /**
     * Version of the index the view was computed from.
     */
    long indexVersion();
}
