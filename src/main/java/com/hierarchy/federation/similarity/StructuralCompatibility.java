package com.hierarchy.federation.similarity;

import com.hierarchy.federation.core.model.Departments;
import com.hierarchy.federation.core.model.PersonRecord;

/**
 * Department compatibility of two records:
 * 1.0 when both name the same department, 0.5 when at least one has none,
 * 0.0 when both name different departments.
 */
public final class StructuralCompatibility {

    public static final double SAME_DEPARTMENT = 1.0;
    public static final double UNKNOWN_DEPARTMENT = 0.5;
    public static final double DIFFERENT_DEPARTMENT = 0.0;

    private StructuralCompatibility() {
        // Utility class
    }

    public static double compute(PersonRecord a, PersonRecord b) {
        String left = Departments.key(a.getDepartment());
        String right = Departments.key(b.getDepartment());
        if (left.isEmpty() || right.isEmpty()) {
            return UNKNOWN_DEPARTMENT;
        }
        return left.equals(right) ? SAME_DEPARTMENT : DIFFERENT_DEPARTMENT;
    }
}
