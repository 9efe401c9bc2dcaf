package TableFill;

import TableFill.Model.Automaton;
import TableFill.Model.MarkingTrace;
import TableFill.Model.MinimizationException;
import TableFill.Model.MinimizationResult;
import TableFill.Model.MinimizerConfig;
import TableFill.Partition.Partition;
import TableFill.Partition.PartitionBuilder;
import TableFill.Reducer.AutomatonReducer;
import TableFill.Table.DistinguishabilityTable;
import TableFill.Table.TableFilling;

import java.util.Objects;

/**
 * Minimal equivalent DFA by the table-filling algorithm:
 * unreachable-state removal, pair marking to a fixpoint, class extraction, quotient construction.
 * <p>
 * Each stage consumes only the previous stage's output. A run owns all of its working state, so concurrent
 * calls do not interfere.
 */
public class DFAMinimizer {
    private DFAMinimizer() {}

    public static MinimizationResult minimize(Automaton automaton) {
        return minimize(automaton, MinimizerConfig.DEFAULT);
    }

    /**
     * @param automaton - input DFA, left untouched
     * @param config - strategy, naming and tracing options
     * @return minimized automaton with the data of the run
     * @throws MinimizationException if the classes cannot be named apart or the partition is inconsistent
     */
    public static MinimizationResult minimize(Automaton automaton, MinimizerConfig config) {
        Objects.requireNonNull(automaton, "automaton");
        Objects.requireNonNull(config, "config");

        final Automaton reachable = Reachability.reduce(automaton);
        final MarkingTrace trace = config.trace() ? MarkingTrace.recording() : MarkingTrace.noop();
        final DistinguishabilityTable table = TableFilling.computeMarking(reachable, config.strategy(), trace);
        final Partition classes = PartitionBuilder.partition(table, reachable);
        final Automaton minimized = AutomatonReducer.build(classes, config.naming());

        return new MinimizationResult(minimized, reachable, table, classes, trace.getPhases(),
            table.getPasses(), table.markedCount(), table.pairCount());
    }
}
