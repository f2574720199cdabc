package com.supplier.matching.cluster;

/**
 * Union-find over the indices {@code 0..size-1}, with path compression and union by rank.
 * The final partition does not depend on the order of {@link #union} calls.
 * Not thread-safe.
 */
public class DisjointSet {

    private final int[] parent;
    private final int[] rank;
    private int setCount;

    public DisjointSet(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        this.parent = new int[size];
        this.rank = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
        this.setCount = size;
    }

    public int find(int x) {
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        // Path compression
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }

    /**
     * Merges the sets containing {@code x} and {@code y}.
     *
     * @return true if two distinct sets were merged
     */
    public boolean union(int x, int y) {
        int rootX = find(x);
        int rootY = find(y);
        if (rootX == rootY) {
            return false;
        }
        if (rank[rootX] < rank[rootY]) {
            parent[rootX] = rootY;
        } else if (rank[rootX] > rank[rootY]) {
            parent[rootY] = rootX;
        } else {
            parent[rootY] = rootX;
            rank[rootX]++;
        }
        setCount--;
        return true;
    }

    public boolean connected(int x, int y) {
        return find(x) == find(y);
    }

    public int size() {
        return parent.length;
    }

    public int setCount() {
        return setCount;
    }
}
