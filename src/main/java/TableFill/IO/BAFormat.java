package TableFill.IO;

import TableFill.AutomatonConversions;
import TableFill.Model.Automaton;
import TableFill.Model.MalformedAutomatonException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import net.automatalib.exception.FormatException;
import net.automatalib.serialization.ba.BAParsers;
import net.automatalib.serialization.ba.BAWriter;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * BA format (https://languageinclusion.org/doku.php?id=tools) through AutomataLib's parser and writer.
 * The parser yields an NFA; only deterministic ones with a single initial state are accepted.
 */
public class BAFormat {
    private BAFormat() {}

    /**
     * States are named q0, q1, ... by parsed state id.
     * @throws MalformedAutomatonException if the file cannot be parsed or the automaton is not deterministic
     */
    public static Automaton read(InputStream is) throws IOException {
        final CompactNFA<String> nfa;
        try {
            nfa = BAParsers.nfa().readModel(is).model;
        } catch (FormatException e) {
            throw new MalformedAutomatonException("Invalid BA file: " + e.getMessage(), e);
        }
        return fromNFA(nfa);
    }

    public static Automaton read(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        }
    }

    static Automaton fromNFA(CompactNFA<String> nfa) {
        final Set<Integer> initialStates = nfa.getInitialStates();
        if (initialStates.size() != 1) {
            throw new MalformedAutomatonException(
                "A DFA needs exactly one initial state, found " + initialStates.size());
        }
        final Alphabet<String> alphabet = nfa.getInputAlphabet();
        final int states = nfa.size();

        final List<String> names = new ArrayList<>(states);
        final List<String> accepting = new ArrayList<>();
        for (int i = 0; i < states; i++) {
            names.add("q" + i);
            if (nfa.isAccepting(i)) {
                accepting.add("q" + i);
            }
        }

        final Map<String, Map<String, String>> transitions = new LinkedHashMap<>();
        for (int i = 0; i < states; i++) {
            final Map<String, String> row = new LinkedHashMap<>();
            for (String a : alphabet) {
                final Collection<Integer> succs = nfa.getTransitions(i, a);
                if (succs.size() > 1) {
                    throw new MalformedAutomatonException(
                        "State q" + i + " has " + succs.size() + " successors on '" + a + "'");
                }
                for (int t : succs) {
                    row.put(a, "q" + t);
                }
            }
            transitions.put("q" + i, row);
        }
        return new Automaton(names, new ArrayList<>(alphabet), "q" + initialStates.iterator().next(),
            accepting, transitions);
    }

    public static void write(Automaton automaton, OutputStream os) throws IOException {
        final CompactDFA<String> dfa = AutomatonConversions.toCompactDFA(automaton);
        BAWriter<String> baWriter = new BAWriter<>();
        baWriter.writeModel(os, dfa, dfa.getInputAlphabet());
    }

    public static void write(Automaton automaton, Path path) throws IOException {
        try (OutputStream os = Files.newOutputStream(path)) {
            write(automaton, os);
        }
    }
}
