package com.hierarchy.federation.query;

import java.util.Locale;
import java.util.Optional;

/**
 * Conjunction of optional record predicates. An unset predicate does not filter.
 *
 * <pre>
 * PersonQuery query = PersonQuery.builder()
 *     .department("Marketing")
 *     .manager(true)
 *     .build();
 * </pre>
 */
public final class PersonQuery {

    private static final PersonQuery ALL = builder().build();

    private final String department;
    private final String sourceSystem;
    private final Boolean leadership;
    private final Boolean manager;
    private final String nameContains;
    private final Boolean hasDirectReports;

    private PersonQuery(Builder builder) {
        this.department = builder.department;
        this.sourceSystem = builder.sourceSystem;
        this.leadership = builder.leadership;
        this.manager = builder.manager;
        this.nameContains = builder.nameContains;
        this.hasDirectReports = builder.hasDirectReports;
    }

    /**
     * Query without predicates; matches every record.
     */
    public static PersonQuery all() {
        return ALL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> department() {
        return Optional.ofNullable(department);
    }

    public Optional<String> sourceSystem() {
        return Optional.ofNullable(sourceSystem);
    }

    public Optional<Boolean> leadership() {
        return Optional.ofNullable(leadership);
    }

    public Optional<Boolean> manager() {
        return Optional.ofNullable(manager);
    }

    /**
     * Lower-cased substring the canonical name must contain.
     */
    public Optional<String> nameContains() {
        return Optional.ofNullable(nameContains);
    }

    public Optional<Boolean> hasDirectReports() {
        return Optional.ofNullable(hasDirectReports);
    }

    public boolean isUnfiltered() {
        return department == null && sourceSystem == null && leadership == null
                && manager == null && nameContains == null && hasDirectReports == null;
    }

    public static class Builder {
        private String department;
        private String sourceSystem;
        private Boolean leadership;
        private Boolean manager;
        private String nameContains;
        private Boolean hasDirectReports;

        public Builder department(String department) {
            this.department = department;
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
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

        public Builder nameContains(String fragment) {
            this.nameContains = fragment != null ? fragment.toLowerCase(Locale.ROOT) : null;
            return this;
        }

        public Builder hasDirectReports(boolean hasDirectReports) {
            this.hasDirectReports = hasDirectReports;
            return this;
        }

        public PersonQuery build() {
            if (nameContains != null && nameContains.isEmpty()) {
                throw new IllegalArgumentException("nameContains must not be empty");
            }
            return new PersonQuery(this);
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PersonQuery{");
        department().ifPresent(v -> sb.append("department=").append(v).append(", "));
        sourceSystem().ifPresent(v -> sb.append("sourceSystem=").append(v).append(", "));
        leadership().ifPresent(v -> sb.append("leadership=").append(v).append(", "));
        manager().ifPresent(v -> sb.append("manager=").append(v).append(", "));
        nameContains().ifPresent(v -> sb.append("nameContains=").append(v).append(", "));
        hasDirectReports().ifPresent(v -> sb.append("hasDirectReports=").append(v).append(", "));
        if (sb.charAt(sb.length() - 1) == ' ') {
            sb.setLength(sb.length() - 2);
        }
        return sb.append('}').toString();
    }
}
