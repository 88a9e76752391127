package nl.bytesoflife.deltakicad.connectivity;

import java.util.Arrays;

/**
 * Disjoint sets over dense integer ids with path halving and union by size.
 */
class UnionFind {

    private int[] parent = new int[16];
    private int[] size = new int[16];
    private int count;

    void ensure(int id) {
        if (id >= parent.length) {
            int capacity = Math.max(parent.length * 2, id + 1);
            parent = Arrays.copyOf(parent, capacity);
            size = Arrays.copyOf(size, capacity);
        }
        while (count <= id) {
            parent[count] = count;
            size[count] = 1;
            count++;
        }
    }

    int find(int id) {
        ensure(id);
        while (parent[id] != id) {
            parent[id] = parent[parent[id]];
            id = parent[id];
        }
        return id;
    }

    void union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) return;
        if (size[ra] < size[rb]) {
            int t = ra;
            ra = rb;
            rb = t;
        }
        parent[rb] = ra;
        size[ra] += size[rb];
    }
}
