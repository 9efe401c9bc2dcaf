package TableFill.Table;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.io.Serial;
import java.util.concurrent.RecursiveTask;

/**
 * One closure pass over the rows [p1, p2) of the pair table, split in halves across a fork/join pool.
 * Shards only read the table; the (p, q, symbol) triples they find are concatenated in row order.
 */
public final class ParMarkTask extends RecursiveTask<IntArrayList> {
  private final int p1, p2;
  private final int[][] succ;
  private final DistinguishabilityTable table;

  // Minimum number of rows to justify more splitting
  private static final int MIN_SUBPROBLEM_SIZE = 20;

  // Factor for subdividing
  private static final int SUBDIVISION_FACTOR = 16;
  @Serial
  private static final long serialVersionUID = 4711L;

  // Threshold for subdividing tasks in fork-join
  private static int thresholdForkJoin(int nStates) {
    return Math.max(MIN_SUBPROBLEM_SIZE, nStates / SUBDIVISION_FACTOR);
  }

  ParMarkTask(int p1, int p2, int[][] succ, DistinguishabilityTable table) {
    this.p1 = p1;
    this.p2 = p2;
    this.succ = succ;
    this.table = table;
  }

  @Override
  protected IntArrayList compute() {
    if (p2 - p1 <= thresholdForkJoin(table.size())) {
      return TableFilling.scanRows(p1, p2, succ, table);
    }

    // Row p holds n-p-1 pairs, so the split point leans towards the low rows to balance the halves.
    int pMid = balancedMidpoint(p1, p2, table.size());
    if (pMid <= p1 || pMid >= p2) {
      return TableFilling.scanRows(p1, p2, succ, table);
    }

    ParMarkTask right = new ParMarkTask(pMid, p2, succ, table);
    right.fork();
    IntArrayList found = new ParMarkTask(p1, pMid, succ, table).compute();
    found.addAll(right.join());
    return found;
  }

  // Row index splitting the pairs of rows [lo, hi) roughly in half
  static int balancedMidpoint(int lo, int hi, int n) {
    long total = 0;
    for (int p = lo; p < hi; p++) {
      total += n - p - 1;
    }
    long half = total / 2;
    long acc = 0;
    for (int p = lo; p < hi; p++) {
      acc += n - p - 1;
      if (acc >= half) {
        return p + 1;
      }
    }
    return lo + (hi - lo) / 2;
  }
}
