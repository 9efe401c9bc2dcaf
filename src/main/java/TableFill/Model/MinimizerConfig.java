package TableFill.Model;

import TableFill.Reducer.ClassNaming;
import TableFill.Table.MarkingStrategy;

import java.util.Objects;

/**
 * Options of a minimization run.
 * @param strategy - how the marking fixpoint is computed
 * @param naming - how the states of the minimized automaton are named
 * @param trace - whether to record the marking trace
 */
public record MinimizerConfig(MarkingStrategy strategy, ClassNaming naming, boolean trace) {
    public static final MinimizerConfig DEFAULT = new MinimizerConfig(MarkingStrategy.PASSES, ClassNaming.braces(), true);

    public MinimizerConfig {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(naming, "naming");
    }

    public MinimizerConfig withStrategy(MarkingStrategy strategy) {
        return new MinimizerConfig(strategy, naming, trace);
    }

    public MinimizerConfig withNaming(ClassNaming naming) {
        return new MinimizerConfig(strategy, naming, trace);
    }

    public MinimizerConfig withTrace(boolean trace) {
        return new MinimizerConfig(strategy, naming, trace);
    }
}
