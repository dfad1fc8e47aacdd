package com.hierarchy.federation.view;

import java.util.Locale;
import java.util.Objects;

/**
 * Address of a materializable view.
 *
 * <p>Textual forms: {@code source:<system>}, {@code organizational},
 * {@code department}, {@code leadership}, {@code managers} and
 * {@code contributors}. Names are case-insensitive except for the source
 * system tag.</p>
 */
public record ViewName(Kind kind, String sourceSystem) {

    private static final String SOURCE_PREFIX = "source:";

    public enum Kind {
        SOURCE,
        ORGANIZATIONAL,
        DEPARTMENT,
        LEADERSHIP,
        MANAGERS,
        CONTRIBUTORS
    }

    public static final ViewName ORGANIZATIONAL = new ViewName(Kind.ORGANIZATIONAL, null);
    public static final ViewName DEPARTMENT = new ViewName(Kind.DEPARTMENT, null);
    public static final ViewName LEADERSHIP = new ViewName(Kind.LEADERSHIP, null);
    public static final ViewName MANAGERS = new ViewName(Kind.MANAGERS, null);
    public static final ViewName CONTRIBUTORS = new ViewName(Kind.CONTRIBUTORS, null);

    public ViewName {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.SOURCE) {
            if (sourceSystem == null || sourceSystem.isBlank()) {
                throw new IllegalArgumentException("A source view needs a source system");
            }
        } else if (sourceSystem != null) {
            throw new IllegalArgumentException("Only source views carry a source system");
        }
    }

    public static ViewName source(String sourceSystem) {
        return new ViewName(Kind.SOURCE, sourceSystem);
    }

    /**
     * Parses a textual view name.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static ViewName parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("View name is required");
        }
        String trimmed = name.trim();
        if (trimmed.regionMatches(true, 0, SOURCE_PREFIX, 0, SOURCE_PREFIX.length())) {
            return source(trimmed.substring(SOURCE_PREFIX.length()).trim());
        }
        switch (trimmed.toLowerCase(Locale.ROOT)) {
            case "organizational":
                return ORGANIZATIONAL;
            case "department":
                return DEPARTMENT;
            case "leadership":
                return LEADERSHIP;
            case "managers":
                return MANAGERS;
            case "contributors":
                return CONTRIBUTORS;
            default:
                throw new IllegalArgumentException("Unknown view: '" + name + "'");
        }
    }

    /**
     * Whether the view may be served from the per-version view cache.
     * Department views are always recomputed.
     */
    public boolean isCacheable() {
        return kind == Kind.SOURCE || kind == Kind.ORGANIZATIONAL;
    }

    @Override
    public String toString() {
        return kind == Kind.SOURCE ? SOURCE_PREFIX + sourceSystem : kind.name().toLowerCase(Locale.ROOT);
    }
}
