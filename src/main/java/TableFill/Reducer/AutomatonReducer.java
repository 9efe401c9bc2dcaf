package TableFill.Reducer;

import TableFill.Model.Automaton;
import TableFill.Model.InvariantViolationException;
import TableFill.Model.NameCollisionException;
import TableFill.Partition.Partition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the quotient automaton of a partition: one state per class.
 * <p>
 * For each class and symbol, the target is taken from the first member (in state order) that has a move on the
 * symbol. Every other member with a move must reach the same class; if one does not, the partition is not a
 * congruence and the build fails instead of picking an arbitrary target.
 */
public final class AutomatonReducer {
    private AutomatonReducer() {}

    public static Automaton build(Partition partition) {
        return build(partition, ClassNaming.braces());
    }

    /**
     * @param partition - classes of the states of {@code partition.getAutomaton()}
     * @param naming - naming scheme for the new states
     * @return minimized automaton; states in class order, alphabet unchanged
     * @throws NameCollisionException if two classes get the same name
     * @throws InvariantViolationException if a class mixes accepting and rejecting states, or its members
     *         disagree on a target class
     */
    public static Automaton build(Partition partition, ClassNaming naming) {
        final Automaton automaton = partition.getAutomaton();
        final int numClasses = partition.size();

        final List<String> names = nameClasses(partition, naming);

        final List<String> accepting = new ArrayList<>();
        for (int c = 0; c < numClasses; c++) {
            if (isAcceptingClass(partition, c, automaton)) {
                accepting.add(names.get(c));
            }
        }

        final Map<String, Map<String, String>> transitions = new LinkedHashMap<>();
        for (int c = 0; c < numClasses; c++) {
            final Map<String, String> row = new LinkedHashMap<>();
            for (int a = 0; a < automaton.numSymbols(); a++) {
                int target = targetClass(partition, c, a, automaton);
                if (target >= 0) {
                    row.put(automaton.getSymbol(a), names.get(target));
                }
            }
            transitions.put(names.get(c), row);
        }

        final String start = names.get(partition.classOf(automaton.getIntInitialState()));
        return new Automaton(names, automaton.getAlphabet(), start, accepting, transitions);
    }

    private static List<String> nameClasses(Partition partition, ClassNaming naming) {
        final List<String> names = new ArrayList<>(partition.size());
        final Map<String, Integer> owner = new HashMap<>();
        for (int c = 0; c < partition.size(); c++) {
            final String name = naming.name(c, partition.memberNames(c));
            final Integer previous = owner.putIfAbsent(name, c);
            if (previous != null) {
                throw new NameCollisionException(name, partition.memberNames(previous), partition.memberNames(c));
            }
            names.add(name);
        }
        return names;
    }

    private static boolean isAcceptingClass(Partition partition, int c, Automaton automaton) {
        final int[] members = partition.members(c);
        final boolean accepting = automaton.isAccepting(partition.representative(c));
        for (int q : members) {
            if (automaton.isAccepting(q) != accepting) {
                throw new InvariantViolationException("Class " + partition.memberNames(c)
                    + " mixes accepting and non-accepting states");
            }
        }
        return accepting;
    }

    /**
     * @return target class of class {@code c} on symbol {@code a}, or -1 if no member has a move
     */
    private static int targetClass(Partition partition, int c, int a, Automaton automaton) {
        int target = -1;
        int witness = -1;
        for (int q : partition.members(c)) {
            final int succ = automaton.getSuccessor(q, a);
            if (succ == Automaton.NO_MOVE) {
                continue;
            }
            final int succClass = partition.classOf(succ);
            if (target < 0) {
                target = succClass;
                witness = q;
            } else if (succClass != target) {
                throw new InvariantViolationException("Class " + partition.memberNames(c) + " is inconsistent on '"
                    + automaton.getSymbol(a) + "': " + automaton.getStateName(witness) + " moves to class "
                    + partition.memberNames(target) + " but " + automaton.getStateName(q) + " moves to class "
                    + partition.memberNames(succClass));
            }
        }
        return target;
    }
}
