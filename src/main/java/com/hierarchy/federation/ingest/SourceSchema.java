package com.hierarchy.federation.ingest;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Field-name aliases of one source's native record shape.
 * The first alias present in a raw record wins.
 */
public final class SourceSchema {

    public enum Field {
        ID,
        NAME,
        TITLE,
        DEPARTMENT,
        LEVEL,
        REPORTS_TO,
        ALIASES
    }

    private static final SourceSchema DEFAULTS = builder().build();

    private final Map<Field, List<String>> aliases;

    private SourceSchema(Map<Field, List<String>> aliases) {
        this.aliases = Collections.unmodifiableMap(new EnumMap<>(aliases));
    }

    public List<String> aliasesOf(Field field) {
        return aliases.getOrDefault(field, List.of());
    }

    public static SourceSchema defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "SourceSchema" + aliases;
    }

    public static class Builder {
        private final Map<Field, List<String>> aliases = new EnumMap<>(Field.class);

        private Builder() {
            aliases.put(Field.ID, List.of("id", "sourceId", "agentId", "employeeId"));
            aliases.put(Field.NAME, List.of("name", "fullName", "displayName"));
            aliases.put(Field.TITLE, List.of("title", "role", "position"));
            aliases.put(Field.DEPARTMENT, List.of("department", "dept"));
            aliases.put(Field.LEVEL, List.of("level", "tier"));
            aliases.put(Field.REPORTS_TO, List.of("reportsTo", "parentId", "managerId"));
            aliases.put(Field.ALIASES, List.of("aliases"));
        }

        /**
         * Replaces the aliases of one field.
         */
        public Builder field(Field field, String... names) {
            Objects.requireNonNull(field, "field");
            if (names == null || names.length == 0) {
                throw new IllegalArgumentException("At least one field name is required for " + field);
            }
            aliases.put(field, List.copyOf(Arrays.asList(names)));
            return this;
        }

        public SourceSchema build() {
            return new SourceSchema(aliases);
        }
    }
}
