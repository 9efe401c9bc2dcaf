package TableFill.Partition;

/**
 * Disjoint sets over 0..size-1 with path compression and union by size.
 */
public final class UnionFind {
    private final int[] parent;
    private final int[] setSize;
    private int count;

    public UnionFind(int size) {
        this.parent = new int[size];
        this.setSize = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
            setSize[i] = 1;
        }
        this.count = size;
    }

    public int find(int x) {
        if (parent[x] != x) {
            parent[x] = find(parent[x]);
        }
        return parent[x];
    }

    /**
     * @return true if x and y were in different sets
     */
    public boolean union(int x, int y) {
        int rootX = find(x);
        int rootY = find(y);
        if (rootX == rootY) {
            return false;
        }
        if (setSize[rootX] < setSize[rootY]) {
            int tmp = rootX;
            rootX = rootY;
            rootY = tmp;
        }
        parent[rootY] = rootX;
        setSize[rootX] += setSize[rootY];
        count--;
        return true;
    }

    boolean connected(int x, int y) {
        return find(x) == find(y);
    }

    /**
     * Number of disjoint sets.
     */
    public int count() {
        return count;
    }

    public int size() {
        return parent.length;
    }
}
