package com.business.deduplication.api;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Union-find over batch positions. Matches are transitive: if A matches B and B
 * matches C, all three end up in one group.
 *
 * <p>The root of every set is its smallest position, so the result does not depend
 * on the order in which unions are applied. Not thread-safe.</p>
 */
public class DuplicateClusterer {

    private final int[] parent;

    public DuplicateClusterer(int size) {
        this.parent = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    public int find(int position) {
        int root = position;
        while (parent[root] != root) {
            root = parent[root];
        }
        // path compression
        int current = position;
        while (parent[current] != root) {
            int next = parent[current];
            parent[current] = root;
            current = next;
        }
        return root;
    }

    /**
     * @return true if the two positions were in different groups
     */
    public boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (rootA < rootB) {
            parent[rootB] = rootA;
        } else {
            parent[rootA] = rootB;
        }
        return true;
    }

    /**
     * Groups of positions, each in ascending order, ordered by their first position.
     */
    public List<List<Integer>> groups() {
        Map<Integer, List<Integer>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < parent.length; i++) {
            byRoot.computeIfAbsent(find(i), r -> new ArrayList<>()).add(i);
        }
        return new ArrayList<>(byRoot.values());
    }
}
