package TableFill;

import TableFill.Model.Automaton;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Restricts an automaton to the states reachable from its start state.
 */
public class Reachability {
    private Reachability() {}

    /**
     * Breadth-first search from the start state over every defined move.
     * @return ids of the reachable states; always contains the start state
     */
    public static BitSet reachableStates(Automaton automaton) {
        final BitSet visited = new BitSet(automaton.size());
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        final int init = automaton.getIntInitialState();
        visited.set(init);
        queue.enqueue(init);
        while (!queue.isEmpty()) {
            int curr = queue.dequeueInt();
            for (int a = 0; a < automaton.numSymbols(); a++) {
                int succ = automaton.getSuccessor(curr, a);
                if (succ != Automaton.NO_MOVE && !visited.get(succ)) {
                    visited.set(succ);
                    queue.enqueue(succ);
                }
            }
        }
        return visited;
    }

    /**
     * States that cannot be reached, in state order.
     */
    public static List<String> unreachableStates(Automaton automaton) {
        final BitSet visited = reachableStates(automaton);
        final List<String> result = new ArrayList<>();
        for (int q = visited.nextClearBit(0); q < automaton.size(); q = visited.nextClearBit(q + 1)) {
            result.add(automaton.getStateName(q));
        }
        return result;
    }

    /**
     * Project the automaton onto its reachable states. State order is kept; accepting states and transitions
     * of unreachable states are dropped. Returns the input itself if every state is reachable.
     */
    public static Automaton reduce(Automaton automaton) {
        final BitSet visited = reachableStates(automaton);
        if (visited.cardinality() == automaton.size()) {
            return automaton;
        }

        final List<String> states = new ArrayList<>(visited.cardinality());
        final List<String> accepting = new ArrayList<>();
        final Map<String, Map<String, String>> transitions = new LinkedHashMap<>();
        for (int q = visited.nextSetBit(0); q >= 0; q = visited.nextSetBit(q + 1)) {
            final String name = automaton.getStateName(q);
            states.add(name);
            if (automaton.isAccepting(q)) {
                accepting.add(name);
            }
            // successors of a visited state are visited, so no transition leaves the kept states
            transitions.put(name, automaton.getTransitions(name));
        }
        return new Automaton(states, automaton.getAlphabet(), automaton.getStart(), accepting, transitions);
    }
}
