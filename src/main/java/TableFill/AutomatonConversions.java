package TableFill;

import TableFill.Model.Automaton;
import TableFill.Model.MalformedAutomatonException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bridges between {@link Automaton} and AutomataLib's DFA types.
 */
public class AutomatonConversions {
    private AutomatonConversions() {}

    /**
     * State i of the result is the i-th state of {@code automaton}; undefined moves stay undefined.
     */
    public static CompactDFA<String> toCompactDFA(Automaton automaton) {
        final Alphabet<String> alphabet = Alphabets.fromList(automaton.getAlphabet());
        final CompactDFA<String> dfa = new CompactDFA<>(alphabet, automaton.size());
        for (int q = 0; q < automaton.size(); q++) {
            dfa.addState(automaton.isAccepting(q));
        }
        dfa.setInitialState(automaton.getIntInitialState());
        for (int q = 0; q < automaton.size(); q++) {
            for (int a = 0; a < automaton.numSymbols(); a++) {
                int succ = automaton.getSuccessor(q, a);
                if (succ != Automaton.NO_MOVE) {
                    dfa.setTransition(q, a, succ);
                }
            }
        }
        return dfa;
    }

    /**
     * States are named q0, q1, ... in the order of {@code dfa.getStates()}, symbols by their string form.
     * @throws MalformedAutomatonException if the DFA has no initial state
     */
    public static <S, I> Automaton fromDFA(DFA<S, I> dfa, Alphabet<I> alphabet) {
        final S init = dfa.getInitialState();
        if (init == null) {
            throw new MalformedAutomatonException("DFA has no initial state");
        }

        final Map<S, String> names = new HashMap<>();
        final List<String> states = new ArrayList<>(dfa.size());
        final List<String> accepting = new ArrayList<>();
        for (S s : dfa.getStates()) {
            String name = "q" + names.size();
            names.put(s, name);
            states.add(name);
            if (dfa.isAccepting(s)) {
                accepting.add(name);
            }
        }

        final List<String> symbols = new ArrayList<>(alphabet.size());
        for (I i : alphabet) {
            symbols.add(String.valueOf(i));
        }

        final Map<String, Map<String, String>> transitions = new LinkedHashMap<>();
        for (S s : dfa.getStates()) {
            final Map<String, String> row = new LinkedHashMap<>();
            for (I i : alphabet) {
                S succ = dfa.getSuccessor(s, i);
                if (succ != null) {
                    row.put(String.valueOf(i), names.get(succ));
                }
            }
            transitions.put(names.get(s), row);
        }
        return new Automaton(states, symbols, names.get(init), accepting, transitions);
    }
}
