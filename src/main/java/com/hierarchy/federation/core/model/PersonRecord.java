package com.hierarchy.federation.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical, immutable representation of one person as reported by one source system.
 *
 * <p>Records are produced by the normalizer only. {@code reportsTo} is a
 * {@link RecordKey} that must be looked up against an index, never a reference
 * to another record, because each source refreshes independently.</p>
 *
 * <p>{@code rawSource} is kept for traceability and is never interpreted
 * downstream.</p>
 */
public final class PersonRecord {
    private final RecordKey key;
    private final String canonicalName;
    private final String normalizedNameKey;
    private final String title;
    private final String department;
    private final Integer level;
    private final RecordKey reportsTo;
    private final boolean leadership;
    private final boolean manager;
    private final List<String> aliases;
    private final List<String> normalizedAliasKeys;
    private final JsonNode rawSource;

    private PersonRecord(Builder builder) {
        this.key = RecordKey.of(builder.sourceSystem, builder.sourceId);
        this.canonicalName = builder.canonicalName;
        this.normalizedNameKey = builder.normalizedNameKey != null ? builder.normalizedNameKey : "";
        this.title = builder.title != null ? builder.title : "";
        this.department = builder.department;
        this.level = builder.level;
        this.reportsTo = builder.reportsTo;
        this.leadership = builder.leadership;
        this.manager = builder.manager;
        this.aliases = builder.aliases != null ? List.copyOf(builder.aliases) : List.of();
        this.normalizedAliasKeys = builder.normalizedAliasKeys != null
                ? List.copyOf(builder.normalizedAliasKeys) : List.of();
        this.rawSource = builder.rawSource != null ? builder.rawSource.deepCopy() : null;
    }

    public RecordKey getKey() {
        return key;
    }

    public String getSourceSystem() {
        return key.sourceSystem();
    }

    public String getSourceId() {
        return key.sourceId();
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public String getNormalizedNameKey() {
        return normalizedNameKey;
    }

    public String getTitle() {
        return title;
    }

    public Optional<String> getDepartment() {
        return Optional.ofNullable(department);
    }

    public Optional<Integer> getLevel() {
        return Optional.ofNullable(level);
    }

    public Optional<RecordKey> getReportsTo() {
        return Optional.ofNullable(reportsTo);
    }

    public boolean isLeadership() {
        return leadership;
    }

    public boolean isManager() {
        return manager;
    }

    /**
     * A contributor is neither classified as leadership nor as a manager.
     */
    public boolean isContributor() {
        return !leadership && !manager;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public List<String> getNormalizedAliasKeys() {
        return normalizedAliasKeys;
    }

    /**
     * Returns a copy of the raw source record, or null when none was retained.
     */
    public JsonNode getRawSource() {
        return rawSource != null ? rawSource.deepCopy() : null;
    }

    public boolean hasNameKey() {
        return !normalizedNameKey.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PersonRecord that = (PersonRecord) o;
        return leadership == that.leadership
                && manager == that.manager
                && key.equals(that.key)
                && Objects.equals(canonicalName, that.canonicalName)
                && normalizedNameKey.equals(that.normalizedNameKey)
                && title.equals(that.title)
                && Objects.equals(department, that.department)
                && Objects.equals(level, that.level)
                && Objects.equals(reportsTo, that.reportsTo)
                && aliases.equals(that.aliases)
                && Objects.equals(rawSource, that.rawSource);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, canonicalName, normalizedNameKey, title, department, level, reportsTo);
    }

    @Override
    public String toString() {
        return "PersonRecord{" +
                "key=" + key +
                ", canonicalName='" + canonicalName + '\'' +
                ", title='" + title + '\'' +
                ", department=" + department +
                ", level=" + level +
                ", reportsTo=" + reportsTo +
                ", leadership=" + leadership +
                ", manager=" + manager +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceSystem;
        private String sourceId;
        private String canonicalName;
        private String normalizedNameKey;
        private String title;
        private String department;
        private Integer level;
        private RecordKey reportsTo;
        private boolean leadership;
        private boolean manager;
        private List<String> aliases;
        private List<String> normalizedAliasKeys;
        private JsonNode rawSource;

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder canonicalName(String canonicalName) {
            this.canonicalName = canonicalName;
            return this;
        }

        public Builder normalizedNameKey(String normalizedNameKey) {
            this.normalizedNameKey = normalizedNameKey;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder department(String department) {
            this.department = department;
            return this;
        }

        public Builder level(Integer level) {
            this.level = level;
            return this;
        }

        public Builder reportsTo(RecordKey reportsTo) {
            this.reportsTo = reportsTo;
            return this;
        }

        public Builder leadership(boolean leadership) {
            this.leadership = leadership;
            return this;
        }

        public Builder manager(boolean manager) {
            this.manager = manager;
            return this;
        }

        public Builder aliases(List<String> aliases) {
            this.aliases = aliases;
            return this;
        }

        public Builder normalizedAliasKeys(List<String> normalizedAliasKeys) {
            this.normalizedAliasKeys = normalizedAliasKeys;
            return this;
        }

        public Builder rawSource(JsonNode rawSource) {
            this.rawSource = rawSource;
            return this;
        }

        public PersonRecord build() {
            Objects.requireNonNull(sourceSystem, "sourceSystem is required");
            Objects.requireNonNull(sourceId, "sourceId is required");
            Objects.requireNonNull(canonicalName, "canonicalName is required");
            if (canonicalName.isBlank()) {
                throw new IllegalArgumentException("canonicalName must not be blank");
            }
            return new PersonRecord(this);
        }
    }
}
