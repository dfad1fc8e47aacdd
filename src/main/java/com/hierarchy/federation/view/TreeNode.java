package com.hierarchy.federation.view;

import com.hierarchy.federation.core.model.PersonRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * One record of the organizational tree with its direct reports.
 */
public final class TreeNode {

    private final PersonRecord record;
    private final List<TreeNode> children = new ArrayList<>();
    private final List<TreeNode> readOnlyChildren = Collections.unmodifiableList(children);

    TreeNode(PersonRecord record) {
        this.record = record;
    }

    void addChild(TreeNode child) {
        children.add(child);
    }

    public PersonRecord record() {
        return record;
    }

    public List<TreeNode> children() {
        return readOnlyChildren;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Number of nodes in this subtree, including this one.
     */
    public int subtreeSize() {
        int count = 0;
        Deque<TreeNode> pending = new ArrayDeque<>();
        pending.push(this);
        while (!pending.isEmpty()) {
            TreeNode node = pending.pop();
            count++;
            node.children.forEach(pending::push);
        }
        return count;
    }

    @Override
    public String toString() {
        return "TreeNode{" + record.getKey() + ", children=" + children.size() + '}';
    }
}
