package com.hierarchy.federation.view;

import com.hierarchy.federation.cache.NoOpViewCache;
import com.hierarchy.federation.cache.ViewCache;
import com.hierarchy.federation.core.model.Departments;
import com.hierarchy.federation.core.model.LadderLevel;
import com.hierarchy.federation.core.model.PersonRecord;
import com.hierarchy.federation.core.model.RecordKey;
import com.hierarchy.federation.core.model.SourceSystems;
import com.hierarchy.federation.index.Index;
import com.hierarchy.federation.query.PersonQuery;
import com.hierarchy.federation.query.QueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes named views from an index. Views never modify the index.
 *
 * <p>Source and organizational views go through the {@link ViewCache}, keyed
 * by index version; department views are recomputed on every call.</p>
 */
public class ViewMaterializer {
    private static final Logger log = LoggerFactory.getLogger(ViewMaterializer.class);

    private static final PersonQuery LEADERSHIP = PersonQuery.builder().leadership(true).build();
    private static final PersonQuery MANAGERS = PersonQuery.builder().manager(true).build();
    private static final PersonQuery CONTRIBUTORS = PersonQuery.builder().leadership(false).manager(false).build();

    private final QueryEngine queryEngine;
    private final ViewCache cache;

    public ViewMaterializer() {
        this(new QueryEngine(), new NoOpViewCache());
    }

    public ViewMaterializer(QueryEngine queryEngine, ViewCache cache) {
        this.queryEngine = Objects.requireNonNull(queryEngine, "queryEngine");
        this.cache = Objects.requireNonNull(cache, "cache");
    }

    /**
     * @throws IllegalArgumentException for an unknown view name
     */
    public View materialize(Index index, String name) {
        return materialize(index, ViewName.parse(name));
    }

    public View materialize(Index index, ViewName name) {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(name, "name");
        if (name.isCacheable()) {
            return cache.get(index.version(), name, () -> compute(index, name));
        }
        return compute(index, name);
    }

    private View compute(Index index, ViewName name) {
        View view;
        switch (name.kind()) {
            case SOURCE:
                view = sourceView(index, name.sourceSystem());
                break;
            case ORGANIZATIONAL:
                view = organizationalView(index);
                break;
            case DEPARTMENT:
                view = departmentView(index);
                break;
            case LEADERSHIP:
                view = new RoleView(name, index.version(), queryEngine.query(index, LEADERSHIP));
                break;
            case MANAGERS:
                view = new RoleView(name, index.version(), queryEngine.query(index, MANAGERS));
                break;
            case CONTRIBUTORS:
                view = new RoleView(name, index.version(), queryEngine.query(index, CONTRIBUTORS));
                break;
            default:
                throw new IllegalArgumentException("Unsupported view: " + name);
        }
        log.debug("view.materialized name={} version={}", name, index.version());
        return view;
    }

    SourceView sourceView(Index index, String sourceSystem) {
        List<PersonRecord> records = index.bySourceSystem(sourceSystem);
        Map<Integer, List<PersonRecord>> levels = new LinkedHashMap<>();
        if (SourceSystems.isLadder(sourceSystem)) {
            for (int level = LadderLevel.MIN; level <= LadderLevel.MAX; level++) {
                levels.put(level, new ArrayList<>());
            }
            for (PersonRecord record : records) {
                record.getLevel()
                        .filter(levels::containsKey)
                        .ifPresent(level -> levels.get(level).add(record));
            }
        }
        return new SourceView(index.version(), sourceSystem, records, levels);
    }

    OrganizationalView organizationalView(Index index) {
        List<PersonRecord> records = index.bySourceSystem(SourceSystems.ORGCHART);
        Map<RecordKey, TreeNode> nodes = new LinkedHashMap<>();
        for (PersonRecord record : records) {
            nodes.put(record.getKey(), new TreeNode(record));
        }

        List<ViewDiagnostic> diagnostics = new ArrayList<>();
        List<TreeNode> roots = new ArrayList<>();
        Map<RecordKey, List<TreeNode>> children = new LinkedHashMap<>();
        for (TreeNode node : nodes.values()) {
            RecordKey key = node.record().getKey();
            RecordKey manager = node.record().getReportsTo().orElse(null);
            if (manager == null) {
                roots.add(node);
            } else if (!nodes.containsKey(manager)) {
                diagnostics.add(ViewDiagnostic.dangling(key, manager));
                roots.add(node);
            } else {
                children.computeIfAbsent(manager, k -> new ArrayList<>()).add(node);
            }
        }

        Set<RecordKey> visited = new HashSet<>();
        for (TreeNode root : roots) {
            attach(root, children, visited, diagnostics);
        }

        // Whatever the roots did not reach hangs off a reporting cycle
        List<TreeNode> detached = new ArrayList<>();
        for (TreeNode node : nodes.values()) {
            if (visited.contains(node.record().getKey())) {
                continue;
            }
            TreeNode entry = cycleEntry(node, nodes);
            attach(entry, children, visited, diagnostics);
            detached.add(entry);
        }

        if (!diagnostics.isEmpty()) {
            log.warn("view.organizational.diagnostics version={} count={}", index.version(), diagnostics.size());
        }
        return new OrganizationalView(index.version(), roots, detached, diagnostics, visited.size());
    }

    /**
     * Breadth-first walk below {@code start}; a child that was already placed closes a cycle.
     */
    private static void attach(TreeNode start, Map<RecordKey, List<TreeNode>> children,
                               Set<RecordKey> visited, List<ViewDiagnostic> diagnostics) {
        Deque<TreeNode> pending = new ArrayDeque<>();
        visited.add(start.record().getKey());
        pending.add(start);
        while (!pending.isEmpty()) {
            TreeNode parent = pending.poll();
            RecordKey parentKey = parent.record().getKey();
            for (TreeNode child : children.getOrDefault(parentKey, List.of())) {
                RecordKey childKey = child.record().getKey();
                if (visited.add(childKey)) {
                    parent.addChild(child);
                    pending.add(child);
                } else {
                    diagnostics.add(ViewDiagnostic.cycle(childKey, parentKey));
                }
            }
        }
    }

    /**
     * Follows managers upwards until a record repeats; that record is on the cycle.
     */
    private static TreeNode cycleEntry(TreeNode start, Map<RecordKey, TreeNode> nodes) {
        Set<RecordKey> path = new LinkedHashSet<>();
        TreeNode current = start;
        while (path.add(current.record().getKey())) {
            current = nodes.get(current.record().getReportsTo().orElseThrow());
        }
        return current;
    }

    DepartmentView departmentView(Index index) {
        Map<String, List<PersonRecord>> departments = new LinkedHashMap<>();
        index.departments().forEach((key, label) -> departments.put(label, index.byDepartment(key)));

        List<PersonRecord> unassigned = new ArrayList<>();
        for (PersonRecord record : index.records()) {
            if (Departments.key(record.getDepartment()).isEmpty()) {
                unassigned.add(record);
            }
        }
        return new DepartmentView(index.version(), departments, unassigned);
    }
}
