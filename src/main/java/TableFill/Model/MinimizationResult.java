package TableFill.Model;

import TableFill.Partition.Partition;
import TableFill.Table.DistinguishabilityTable;

import java.util.List;

/**
 * Output of one minimization run.
 * @param minimized - the minimal automaton, the only part independent of the run's working state
 * @param reachable - input automaton restricted to its reachable states
 * @param table - saturated distinguishability table over the states of {@code reachable}
 * @param classes - equivalence classes over the states of {@code reachable}
 * @param trace - marking phases in order; empty when tracing was off
 * @param passes - closure passes (or worklist rounds) until the fixpoint
 * @param markedPairs - distinguishable pairs of reachable states
 * @param totalPairs - all pairs of distinct reachable states
 */
public record MinimizationResult(Automaton minimized, Automaton reachable,
                                 DistinguishabilityTable table, Partition classes,
                                 List<MarkingPhase> trace, int passes, int markedPairs, int totalPairs) {

  public MinimizationResult {
    trace = List.copyOf(trace);
  }

  /**
   * Reachable states that were folded into another state.
   */
  public int mergedStates() {
    return reachable.size() - minimized.size();
  }
}
