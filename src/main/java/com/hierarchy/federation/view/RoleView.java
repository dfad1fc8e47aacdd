package com.hierarchy.federation.view;

import com.hierarchy.federation.core.model.PersonRecord;

import java.util.List;
import java.util.Objects;

/**
 * Leadership, manager or contributor subset of the index.
 */
public final class RoleView implements View {

    private final ViewName name;
    private final long indexVersion;
    private final List<PersonRecord> records;

    RoleView(ViewName name, long indexVersion, List<PersonRecord> records) {
        this.name = Objects.requireNonNull(name, "name");
        this.indexVersion = indexVersion;
        this.records = List.copyOf(records);
    }

    @Override
    public ViewName name() {
        return name;
    }

    @Override
    public long indexVersion() {
        return indexVersion;
    }

    public List<PersonRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }
}
