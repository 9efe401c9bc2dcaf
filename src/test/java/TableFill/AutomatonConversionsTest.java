package TableFill;

import TableFill.Model.Automaton;
import TableFill.Model.MalformedAutomatonException;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class AutomatonConversionsTest {
  @Test
  void testToCompactDFA() {
    Automaton a = SampleAutomata.unreachableState();
    CompactDFA<String> dfa = AutomatonConversions.toCompactDFA(a);
    Assertions.assertEquals(4, dfa.size());
    Assertions.assertEquals(0, dfa.getInitialState());
    Assertions.assertTrue(dfa.isAccepting(2));
    Assertions.assertEquals(Integer.valueOf(2), dfa.getSuccessor(Integer.valueOf(1), "a"));
    Assertions.assertTrue(dfa.accepts(List.of("a", "a", "b")));
    Assertions.assertFalse(dfa.accepts(List.of("a", "b")));
  }

  @Test
  void testPartialStaysPartial() {
    CompactDFA<String> dfa = AutomatonConversions.toCompactDFA(SampleAutomata.partialMerge());
    Assertions.assertNull(dfa.getSuccessor(Integer.valueOf(1), "a"));
    Assertions.assertFalse(dfa.accepts(List.of("a", "a")));
  }

  @Test
  void testFromDFA() {
    Alphabet<Integer> alphabet = Alphabets.integers(0, 1);
    CompactDFA<Integer> dfa = new CompactDFA<>(alphabet);
    int s0 = dfa.addInitialState(false);
    int s1 = dfa.addState(true);
    dfa.setTransition(s0, 1, s1);
    dfa.setTransition(s1, 0, s0);

    Automaton a = AutomatonConversions.fromDFA(dfa, alphabet);
    Assertions.assertEquals(List.of("q0", "q1"), a.getStates());
    Assertions.assertEquals(List.of("0", "1"), a.getAlphabet());
    Assertions.assertEquals("q0", a.getStart());
    Assertions.assertEquals("q1", a.getSuccessor("q0", "1"));
    Assertions.assertNull(a.getSuccessor("q0", "0"));
    Assertions.assertTrue(a.accepts(List.of("1", "0", "1")));
  }

  @Test
  void testFromDFAWithoutInitial() {
    Alphabet<Integer> alphabet = Alphabets.integers(0, 1);
    CompactDFA<Integer> dfa = new CompactDFA<>(alphabet);
    dfa.addState(true);
    Assertions.assertThrows(MalformedAutomatonException.class, () -> AutomatonConversions.fromDFA(dfa, alphabet));
  }
}
