package com.hierarchy.federation.resolve;

/**
 * Disjoint sets over {@code 0..size-1} with path halving and union by size.
 * The smaller element always becomes the root on ties, which keeps roots
 * stable for a given sequence of unions. Not thread-safe.
 */
final class UnionFind {

    private final int[] parent;
    private final int[] size;

    UnionFind(int elements) {
        parent = new int[elements];
        size = new int[elements];
        for (int i = 0; i < elements; i++) {
            parent[i] = i;
            size[i] = 1;
        }
    }

    int find(int element) {
        int current = element;
        while (parent[current] != current) {
            parent[current] = parent[parent[current]];
            current = parent[current];
        }
        return current;
    }

    /**
     * Merges the sets of both elements. Returns false when they were already joined.
     */
    boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (size[rootA] < size[rootB] || (size[rootA] == size[rootB] && rootB < rootA)) {
            int swap = rootA;
            rootA = rootB;
            rootB = swap;
        }
        parent[rootB] = rootA;
        size[rootA] += size[rootB];
        return true;
    }

    boolean connected(int a, int b) {
        return find(a) == find(b);
    }
}
