package com.hierarchy.federation.similarity;

import java.util.Objects;

/**
 * Candidate group of a record: the first character of its name key plus its
 * department key. An empty department makes the key a wildcard that is
 * compared against every block sharing the same prefix.
 */
public record BlockingKey(String prefix, String department) {

    public BlockingKey {
        Objects.requireNonNull(prefix, "prefix is required");
        Objects.requireNonNull(department, "department is required");
        if (prefix.isEmpty()) {
            throw new IllegalArgumentException("prefix must not be empty");
        }
    }

    public boolean isWildcard() {
        return department.isEmpty();
    }

    @Override
    public String toString() {
        return prefix + "|" + department;
    }
}
