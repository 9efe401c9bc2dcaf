package TableFill.Model;

import TableFill.SampleAutomata;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class AutomatonTest {
  @Test
  void testQueries() {
    Automaton a = SampleAutomata.unreachableState();
    Assertions.assertEquals(4, a.size());
    Assertions.assertEquals(2, a.numSymbols());
    Assertions.assertEquals(List.of("q0", "q1", "q2", "q3"), a.getStates());
    Assertions.assertEquals("q0", a.getStart());
    Assertions.assertEquals(0, a.getIntInitialState());
    Assertions.assertTrue(a.isAccepting("q2"));
    Assertions.assertFalse(a.isAccepting("q1"));
    Assertions.assertFalse(a.isAccepting("nope"));
    Assertions.assertTrue(a.isAccepting(2));

    Assertions.assertEquals("q1", a.getSuccessor("q0", "a"));
    Assertions.assertNull(a.getSuccessor("q0", "z"));
    Assertions.assertEquals(1, a.getSuccessor(0, a.getSymbolId("a")));
    Assertions.assertEquals(2, a.getStateId("q2"));
    Assertions.assertEquals(-1, a.getStateId("q9"));
    Assertions.assertEquals("b", a.getSymbol(1));
    Assertions.assertEquals(Map.of("a", "q1", "b", "q0"), a.getTransitions("q0"));
    Assertions.assertTrue(a.getTransitions("q9").isEmpty());
  }

  @Test
  void testMissingMoves() {
    Automaton a = SampleAutomata.partialMerge();
    Assertions.assertNull(a.getSuccessor("q", "a"));
    Assertions.assertEquals(Automaton.NO_MOVE, a.getSuccessor(a.getStateId("q"), a.getSymbolId("a")));
    Assertions.assertTrue(a.getTransitions("q").isEmpty());
    // every state gets a row, possibly empty
    Assertions.assertEquals(List.of("p", "q", "r"), new ArrayList<>(a.getTransitionMap().keySet()));
  }

  @Test
  void testRun() {
    Automaton a = SampleAutomata.endsWith01();
    Assertions.assertTrue(a.accepts(List.of("0", "1")));
    Assertions.assertTrue(a.accepts(List.of("1", "1", "0", "0", "1")));
    Assertions.assertFalse(a.accepts(List.of("1", "0")));
    Assertions.assertFalse(a.accepts(List.of()));
    Assertions.assertEquals("q0", a.run(List.of()));

    Automaton partial = SampleAutomata.partialMerge();
    Assertions.assertNull(partial.run(List.of("a", "a")));
    Assertions.assertFalse(partial.accepts(List.of("a", "a")));
    Assertions.assertTrue(partial.accepts(List.of("b", "a", "a")));

    Assertions.assertThrows(IllegalArgumentException.class, () -> a.accepts(List.of("2")));
  }

  @Test
  void testAcceptingInStateOrder() {
    Automaton a = Automaton.builder()
        .states("x", "y", "z")
        .alphabet("a")
        .start("x")
        .accepting("z", "x", "z")
        .build();
    Assertions.assertEquals(List.of("x", "z"), new ArrayList<>(a.getAccepting()));
  }

  @Test
  void testEquality() {
    Assertions.assertEquals(SampleAutomata.unreachableState(), SampleAutomata.unreachableState());
    Assertions.assertEquals(SampleAutomata.unreachableState().hashCode(), SampleAutomata.unreachableState().hashCode());
    Assertions.assertNotEquals(SampleAutomata.unreachableState(), SampleAutomata.endsWith01());
    Assertions.assertTrue(SampleAutomata.unreachableState().toString().contains("start=q0"));
  }

  @Test
  void testUnknownTransitionTarget() {
    // a transition into an undeclared state
    MalformedAutomatonException e = Assertions.assertThrows(MalformedAutomatonException.class, () ->
        Automaton.builder()
            .states("X")
            .alphabet("a")
            .start("X")
            .transition("X", "a", "Y")
            .build());
    Assertions.assertTrue(e.getMessage().contains("'Y'"));
  }

  @Test
  void testMalformed() {
    Assertions.assertThrows(MalformedAutomatonException.class, () ->
        Automaton.builder().states("X").alphabet("a").start("Z").build());
    Assertions.assertThrows(MalformedAutomatonException.class, () ->
        Automaton.builder().states("X").alphabet("a").build());
    Assertions.assertThrows(MalformedAutomatonException.class, () ->
        Automaton.builder().states("X").alphabet("a").start("X").accepting("W").build());
    Assertions.assertThrows(MalformedAutomatonException.class, () ->
        Automaton.builder().states("X", "X").alphabet("a").start("X").build());
    Assertions.assertThrows(MalformedAutomatonException.class, () ->
        Automaton.builder().states("X").alphabet("a", "a").start("X").build());
    Assertions.assertThrows(MalformedAutomatonException.class, () ->
        Automaton.builder().states("X").alphabet("a").start("X").transition("W", "a", "X").build());
    Assertions.assertThrows(MalformedAutomatonException.class, () ->
        Automaton.builder().states("X").alphabet("a").start("X").transition("X", "b", "X").build());
    Assertions.assertThrows(MalformedAutomatonException.class, () ->
        new Automaton(Arrays.asList("X", null), List.of("a"), "X", List.of(), Map.of()));

    // all of them are minimization failures
    Assertions.assertTrue(MinimizationException.class.isAssignableFrom(MalformedAutomatonException.class));
  }

  @Test
  void testEmptyAlphabet() {
    Automaton a = Automaton.builder().states("X", "Y").start("X").accepting("Y").build();
    Assertions.assertEquals(0, a.numSymbols());
    Assertions.assertFalse(a.accepts(List.of()));
  }

  @Test
  void testImmutableViews() {
    Automaton a = SampleAutomata.unreachableState();
    Assertions.assertThrows(UnsupportedOperationException.class, () -> a.getStates().add("q9"));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> a.getAccepting().add("q0"));
    Assertions.assertThrows(UnsupportedOperationException.class, () -> a.getTransitions("q0").put("a", "q0"));
  }
}
