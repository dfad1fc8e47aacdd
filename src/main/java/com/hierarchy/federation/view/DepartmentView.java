package com.hierarchy.federation.view;

import com.hierarchy.federation.core.model.PersonRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Records grouped by department, keyed by the label under which each
 * department was first seen. Records without a department are listed
 * separately.
 */
public final class DepartmentView implements View {

    private final long indexVersion;
    private final Map<String, List<PersonRecord>> departments;
    private final List<PersonRecord> unassigned;

    DepartmentView(long indexVersion, Map<String, List<PersonRecord>> departments, List<PersonRecord> unassigned) {
        this.indexVersion = indexVersion;
        Map<String, List<PersonRecord>> copy = new LinkedHashMap<>();
        departments.forEach((label, members) -> copy.put(label, List.copyOf(members)));
        this.departments = Collections.unmodifiableMap(copy);
        this.unassigned = List.copyOf(unassigned);
    }

    @Override
    public ViewName name() {
        return ViewName.DEPARTMENT;
    }

    @Override
    public long indexVersion() {
        return indexVersion;
    }

    public Map<String, List<PersonRecord>> departments() {
        return departments;
    }

    public List<PersonRecord> unassigned() {
        return unassigned;
    }
}
