package TableFill.Model;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable deterministic finite automaton over string-named states and symbols.
 * <p>
 * The order of {@code states} is significant: it fixes the dense state ids used by the minimizer and the
 * canonical order of state pairs. The transition function may be partial; a missing entry means there is no
 * move, it does not stand for an implicit rejecting sink.
 * <p>
 * Every transformation (pruning, minimizing) yields a new instance.
 */
public final class Automaton {
    /** Successor id returned when a (state, symbol) has no move. */
    public static final int NO_MOVE = -1;

    private final List<String> states;
    private final List<String> alphabet;
    private final String start;
    private final Set<String> accepting;

    private final Object2IntMap<String> stateIds;
    private final Object2IntMap<String> symbolIds;
    private final BitSet acceptingIds;
    // successors[state * numSymbols + symbol], NO_MOVE where undefined
    private final int[] successors;

    /**
     * @param states - distinct state names, in canonical order
     * @param alphabet - distinct input symbols
     * @param start - start state, must be one of {@code states}
     * @param accepting - accepting states, each must be one of {@code states}
     * @param transitions - source state to (symbol to destination state); sources, symbols and destinations
     *                    must all be known
     * @throws MalformedAutomatonException if any of the above does not hold
     */
    public Automaton(List<String> states, List<String> alphabet, String start, Collection<String> accepting,
                     Map<String, ? extends Map<String, String>> transitions) {
        Objects.requireNonNull(states, "states");
        Objects.requireNonNull(alphabet, "alphabet");
        Objects.requireNonNull(accepting, "accepting");
        Objects.requireNonNull(transitions, "transitions");

        this.stateIds = index(states, "state");
        this.symbolIds = index(alphabet, "symbol");
        this.states = List.copyOf(states);
        this.alphabet = List.copyOf(alphabet);

        if (start == null || !stateIds.containsKey(start)) {
            throw new MalformedAutomatonException("Start state '" + start + "' is not one of the states " + states);
        }
        this.start = start;

        this.acceptingIds = new BitSet(this.states.size());
        for (String f : accepting) {
            int id = stateIds.getInt(f);
            if (id < 0) {
                throw new MalformedAutomatonException("Accepting state '" + f + "' is not one of the states " + states);
            }
            acceptingIds.set(id);
        }
        Set<String> acc = new LinkedHashSet<>();
        for (int q = acceptingIds.nextSetBit(0); q >= 0; q = acceptingIds.nextSetBit(q + 1)) {
            acc.add(this.states.get(q));
        }
        this.accepting = Collections.unmodifiableSet(acc);

        final int numSymbols = this.alphabet.size();
        this.successors = new int[this.states.size() * numSymbols];
        Arrays.fill(successors, NO_MOVE);
        for (Map.Entry<String, ? extends Map<String, String>> row : transitions.entrySet()) {
            int src = stateIds.getInt(row.getKey());
            if (src < 0) {
                throw new MalformedAutomatonException("Transition source '" + row.getKey() + "' is not a state");
            }
            if (row.getValue() == null) {
                continue;
            }
            for (Map.Entry<String, String> move : row.getValue().entrySet()) {
                int sym = symbolIds.getInt(move.getKey());
                if (sym < 0) {
                    throw new MalformedAutomatonException("Transition " + row.getKey() + " --" + move.getKey()
                        + "--> uses a symbol outside the alphabet " + alphabet);
                }
                int dst = stateIds.getInt(move.getValue());
                if (dst < 0) {
                    throw new MalformedAutomatonException("Transition " + row.getKey() + " --" + move.getKey()
                        + "--> '" + move.getValue() + "' leads to an unknown state");
                }
                successors[src * numSymbols + sym] = dst;
            }
        }
    }

    private static Object2IntMap<String> index(List<String> names, String kind) {
        final Object2IntOpenHashMap<String> ids = new Object2IntOpenHashMap<>(names.size());
        ids.defaultReturnValue(-1);
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            if (name == null) {
                throw new MalformedAutomatonException("Null " + kind + " at position " + i);
            }
            if (ids.put(name, i) != -1) {
                throw new MalformedAutomatonException("Duplicate " + kind + " '" + name + "'");
            }
        }
        return ids;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getStates() {
        return states;
    }

    public List<String> getAlphabet() {
        return alphabet;
    }

    public String getStart() {
        return start;
    }

    /**
     * @return accepting states, in state order
     */
    public Set<String> getAccepting() {
        return accepting;
    }

    public int size() {
        return states.size();
    }

    public int numSymbols() {
        return alphabet.size();
    }

    public boolean containsState(String state) {
        return stateIds.containsKey(state);
    }

    public boolean isAccepting(String state) {
        int id = stateIds.getInt(state);
        return id >= 0 && acceptingIds.get(id);
    }

    /**
     * @return successor state, or null if there is no move (or the state/symbol is unknown)
     */
    public String getSuccessor(String state, String symbol) {
        int q = stateIds.getInt(state);
        int a = symbolIds.getInt(symbol);
        if (q < 0 || a < 0) {
            return null;
        }
        int succ = getSuccessor(q, a);
        return succ == NO_MOVE ? null : states.get(succ);
    }

    /**
     * Defined moves of one state, in alphabet order.
     */
    public Map<String, String> getTransitions(String state) {
        int q = stateIds.getInt(state);
        if (q < 0) {
            return Map.of();
        }
        final Map<String, String> row = new LinkedHashMap<>();
        for (int a = 0; a < alphabet.size(); a++) {
            int succ = getSuccessor(q, a);
            if (succ != NO_MOVE) {
                row.put(alphabet.get(a), states.get(succ));
            }
        }
        return Collections.unmodifiableMap(row);
    }

    /**
     * Full transition function, sources in state order. States without any move map to an empty row.
     */
    public Map<String, Map<String, String>> getTransitionMap() {
        final Map<String, Map<String, String>> all = new LinkedHashMap<>();
        for (String q : states) {
            all.put(q, getTransitions(q));
        }
        return Collections.unmodifiableMap(all);
    }

    // Dense id view, used by the minimization stages

    public int getStateId(String state) {
        return stateIds.getInt(state);
    }

    public String getStateName(int id) {
        return states.get(id);
    }

    public int getSymbolId(String symbol) {
        return symbolIds.getInt(symbol);
    }

    public String getSymbol(int id) {
        return alphabet.get(id);
    }

    public int getIntInitialState() {
        return stateIds.getInt(start);
    }

    public boolean isAccepting(int state) {
        return acceptingIds.get(state);
    }

    public int getSuccessor(int state, int symbol) {
        return successors[state * alphabet.size() + symbol];
    }

    /**
     * Run a word from the start state.
     * @return reached state, or null if some move along the way is undefined
     * @throws IllegalArgumentException if the word contains a symbol outside the alphabet
     */
    public String run(List<String> word) {
        int q = getIntInitialState();
        for (String symbol : word) {
            int a = symbolIds.getInt(symbol);
            if (a < 0) {
                throw new IllegalArgumentException("Symbol '" + symbol + "' is not in the alphabet " + alphabet);
            }
            q = getSuccessor(q, a);
            if (q == NO_MOVE) {
                return null;
            }
        }
        return states.get(q);
    }

    public boolean accepts(List<String> word) {
        String reached = run(word);
        return reached != null && isAccepting(reached);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Automaton)) {
            return false;
        }
        Automaton other = (Automaton) o;
        return states.equals(other.states)
            && alphabet.equals(other.alphabet)
            && start.equals(other.start)
            && acceptingIds.equals(other.acceptingIds)
            && Arrays.equals(successors, other.successors);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, alphabet, start, acceptingIds, Arrays.hashCode(successors));
    }

    @Override
    public String toString() {
        return "Automaton{states=" + states + ", alphabet=" + alphabet + ", start=" + start
            + ", accepting=" + accepting + ", transitions=" + getTransitionMap() + "}";
    }

    /**
     * Collects the parts of an automaton; validation happens in {@link #build()}.
     */
    public static final class Builder {
        private final List<String> states = new ArrayList<>();
        private final List<String> alphabet = new ArrayList<>();
        private final List<String> accepting = new ArrayList<>();
        private final Map<String, Map<String, String>> transitions = new LinkedHashMap<>();
        private String start;

        private Builder() {}

        public Builder states(String... names) {
            states.addAll(Arrays.asList(names));
            return this;
        }

        public Builder alphabet(String... symbols) {
            alphabet.addAll(Arrays.asList(symbols));
            return this;
        }

        public Builder start(String state) {
            this.start = state;
            return this;
        }

        public Builder accepting(String... names) {
            accepting.addAll(Arrays.asList(names));
            return this;
        }

        public Builder transition(String from, String symbol, String to) {
            transitions.computeIfAbsent(from, k -> new LinkedHashMap<>()).put(symbol, to);
            return this;
        }

        public Automaton build() {
            return new Automaton(states, alphabet, start, accepting, transitions);
        }
    }
}
