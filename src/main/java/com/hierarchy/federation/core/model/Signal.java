package com.hierarchy.federation.core.model;

/**
 * Signals that can contribute to a pairwise match score.
 */
public enum Signal {
    /**
     * Token-set similarity of the normalized names (or aliases).
     */
    NAME,

    /**
     * Synonym-aware title similarity combined with classified-role overlap.
     */
    TITLE,

    /**
     * Department compatibility between the two records.
     */
    STRUCTURE
}
