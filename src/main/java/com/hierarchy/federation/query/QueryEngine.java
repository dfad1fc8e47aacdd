package com.hierarchy.federation.query;

import com.hierarchy.federation.core.model.Departments;
import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.index.Index;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Stateless, thread-safe filtering over an {@link Index}.
 *
 * <p>Starts from the narrowest indexed list among the supplied predicates
 * (department, source system, leadership, manager) and applies the
 * remaining predicates to it. Results keep index insertion order.</p>
 */
public class QueryEngine {
    private static final Logger log = LoggerFactory.getLogger(QueryEngine.class);

    public List<PersonRecord> query(Index index, PersonQuery query) {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(query, "query");

        List<PersonRecord> candidates = candidates(index, query);
        Predicate<PersonRecord> predicate = predicate(index, query);

        List<PersonRecord> result = new ArrayList<>();
        for (PersonRecord record : candidates) {
            if (predicate.test(record)) {
                result.add(record);
            }
        }
        log.debug("query.executed version={} query={} candidates={} results={}",
                index.version(), query, candidates.size(), result.size());
        return Collections.unmodifiableList(result);
    }

    private List<PersonRecord> candidates(Index index, PersonQuery query) {
        List<PersonRecord> narrowest = index.records();
        if (query.department().isPresent()) {
            narrowest = smaller(narrowest, index.byDepartment(query.department().get()));
        }
        if (query.sourceSystem().isPresent()) {
            narrowest = smaller(narrowest, index.bySourceSystem(query.sourceSystem().get()));
        }
        if (query.leadership().orElse(false)) {
            narrowest = smaller(narrowest, index.leadership());
        }
        if (query.manager().orElse(false)) {
            narrowest = smaller(narrowest, index.managers());
        }
        return narrowest;
    }

    private static List<PersonRecord> smaller(List<PersonRecord> a, List<PersonRecord> b) {
        return b.size() < a.size() ? b : a;
    }

    private static Predicate<PersonRecord> predicate(Index index, PersonQuery query) {
        Predicate<PersonRecord> predicate = record -> true;
        if (query.department().isPresent()) {
            String key = Departments.key(query.department().get());
            predicate = predicate.and(record -> Departments.key(record.getDepartment()).equals(key));
        }
        if (query.sourceSystem().isPresent()) {
            String system = query.sourceSystem().get();
            predicate = predicate.and(record -> record.getSourceSystem().equals(system));
        }
        if (query.leadership().isPresent()) {
            boolean expected = query.leadership().get();
            predicate = predicate.and(record -> record.isLeadership() == expected);
        }
        if (query.manager().isPresent()) {
            boolean expected = query.manager().get();
            predicate = predicate.and(record -> record.isManager() == expected);
        }
        if (query.nameContains().isPresent()) {
            String fragment = query.nameContains().get();
            predicate = predicate.and(record ->
                    record.getCanonicalName().toLowerCase(Locale.ROOT).contains(fragment));
        }
        if (query.hasDirectReports().isPresent()) {
            boolean expected = query.hasDirectReports().get();
            predicate = predicate.and(record -> index.hasDirectReports(record.getKey()) == expected);
        }
        return predicate;
    }
}
