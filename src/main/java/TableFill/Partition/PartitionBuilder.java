package TableFill.Partition;

import TableFill.Model.Automaton;
import TableFill.Table.DistinguishabilityTable;

import java.util.Arrays;

/**
 * Turns a saturated distinguishability table into equivalence classes: two states share a class iff their
 * pair is unmarked.
 */
public final class PartitionBuilder {
    private PartitionBuilder() {}

    /**
     * @param table - saturated table over the states of {@code automaton}
     * @param automaton - automaton the table was computed for
     * @return classes ordered by smallest member
     */
    public static Partition partition(DistinguishabilityTable table, Automaton automaton) {
        final int n = automaton.size();
        if (table.size() != n) {
            throw new IllegalArgumentException(
                "Table over " + table.size() + " states does not match automaton with " + n + " states");
        }

        final UnionFind uf = new UnionFind(n);
        for (int p = 0; p < n; p++) {
            for (int q = p + 1; q < n; q++) {
                if (!table.isMarked(p, q)) {
                    uf.union(p, q);
                }
            }
        }

        // number classes in order of their smallest member
        final int[] classOfRoot = new int[n];
        Arrays.fill(classOfRoot, -1);
        final int[] classOf = new int[n];
        final int[] classSize = new int[uf.count()];
        int numClasses = 0;
        for (int q = 0; q < n; q++) {
            int root = uf.find(q);
            if (classOfRoot[root] < 0) {
                classOfRoot[root] = numClasses++;
            }
            classOf[q] = classOfRoot[root];
            classSize[classOf[q]]++;
        }

        final int[][] members = new int[numClasses][];
        final int[] fill = new int[numClasses];
        for (int c = 0; c < numClasses; c++) {
            members[c] = new int[classSize[c]];
        }
        for (int q = 0; q < n; q++) {
            int c = classOf[q];
            members[c][fill[c]++] = q;
        }
        return new Partition(automaton, classOf, members);
    }
}
