package com.hierarchy.federation.view;

import java.util.List;

/**
 * Reporting forest of the orgchart source.
 *
 * <p>{@link #roots()} holds records without a manager, including those whose
 * manager is not indexed. Records that can only be reached through a
 * reporting cycle are listed under {@link #detached()}, each subtree starting
 * at the cycle member where the walk entered it. Every problem found is in
 * {@link #diagnostics()}.</p>
 */
public final class OrganizationalView implements View {

    private final long indexVersion;
    private final List<TreeNode> roots;
    private final List<TreeNode> detached;
    private final List<ViewDiagnostic> diagnostics;
    private final int size;

    OrganizationalView(long indexVersion, List<TreeNode> roots, List<TreeNode> detached,
                       List<ViewDiagnostic> diagnostics, int size) {
        this.indexVersion = indexVersion;
        this.roots = List.copyOf(roots);
        this.detached = List.copyOf(detached);
        this.diagnostics = List.copyOf(diagnostics);
        this.size = size;
    }

    @Override
    public ViewName name() {
        return ViewName.ORGANIZATIONAL;
    }

    @Override
    public long indexVersion() {
        return indexVersion;
    }

    public List<TreeNode> roots() {
        return roots;
    }

    public List<TreeNode> detached() {
        return detached;
    }

    public List<ViewDiagnostic> diagnostics() {
        return diagnostics;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    /**
     * Number of records placed in the view, roots and detached subtrees together.
     */
    public int size() {
        return size;
    }
}
