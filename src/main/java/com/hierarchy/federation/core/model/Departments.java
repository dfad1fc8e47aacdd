package com.hierarchy.federation.core.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Department labels compare case-insensitively with whitespace collapsed.
 */
public final class Departments {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Departments() {
        // Utility class
    }

    /**
     * Lookup key of a department label; empty string for a missing label.
     */
    public static String key(String department) {
        if (department == null || department.isBlank()) {
            return "";
        }
        return WHITESPACE.matcher(department.trim().toLowerCase(Locale.ROOT)).replaceAll(" ");
    }

    public static String key(Optional<String> department) {
        return key(department.orElse(null));
    }
}
