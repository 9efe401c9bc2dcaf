package TableFill.Partition;

import TableFill.Model.Automaton;
import TableFill.RandomDFA;
import TableFill.Reachability;
import TableFill.SampleAutomata;
import TableFill.Table.DistinguishabilityTable;
import TableFill.Table.TableFilling;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.Set;

public class PartitionBuilderTest {
  private static Partition partitionOf(Automaton a) {
    DistinguishabilityTable table = TableFilling.computeMarking(a);
    return PartitionBuilder.partition(table, a);
  }

  @Test
  void testEndsWith01Classes() {
    Automaton a = SampleAutomata.endsWith01();
    Partition partition = partitionOf(a);
    Assertions.assertEquals(3, partition.size());
    Assertions.assertEquals(List.of(Set.of("q0", "q2"), Set.of("q1", "q3"), Set.of("q4")), partition.getClasses());
    Assertions.assertEquals(0, partition.classOf("q2"));
    Assertions.assertEquals(1, partition.classOf(3));
    Assertions.assertArrayEquals(new int[] {1, 3}, partition.members(1));
    Assertions.assertEquals(1, partition.representative(1));
    Assertions.assertEquals(List.of("q1", "q3"), partition.memberNames(1));
    Assertions.assertSame(a, partition.getAutomaton());
    Assertions.assertThrows(IllegalArgumentException.class, () -> partition.classOf("q9"));
  }

  @Test
  void testMembersAreCopies() {
    Partition partition = partitionOf(SampleAutomata.endsWith01());
    partition.members(0)[0] = 42;
    Assertions.assertEquals(0, partition.representative(0));
  }

  @Test
  void testSingleClass() {
    Partition partition = partitionOf(SampleAutomata.twoAcceptingLoops());
    Assertions.assertEquals(1, partition.size());
    Assertions.assertEquals(List.of("A", "B"), partition.memberNames(0));
  }

  @Test
  void testSizeMismatch() {
    Automaton a = SampleAutomata.unreachableState();
    DistinguishabilityTable table = TableFilling.computeMarking(Reachability.reduce(a));
    Assertions.assertThrows(IllegalArgumentException.class, () -> PartitionBuilder.partition(table, a));
  }

  @Test
  void testWellFormed() {
    Random r = new Random(5);
    for (int i = 0; i < 100; i++) {
      int size = 1 + r.nextInt(30);
      Automaton a = RandomDFA.generateTotal(r, size, 2, r.nextInt(size + 1));
      DistinguishabilityTable table = TableFilling.computeMarking(a);
      Partition partition = PartitionBuilder.partition(table, a);

      // every state in exactly one class, classes ordered by smallest member
      int[] seen = new int[size];
      int lastRep = -1;
      for (int c = 0; c < partition.size(); c++) {
        int[] members = partition.members(c);
        Assertions.assertTrue(members.length > 0);
        Assertions.assertTrue(members[0] > lastRep);
        lastRep = members[0];
        for (int q : members) {
          seen[q]++;
          Assertions.assertEquals(c, partition.classOf(q));
          // total automaton: the unmarked relation is an equivalence
          for (int other : members) {
            Assertions.assertFalse(table.isMarked(q, other));
          }
        }
      }
      int[] ones = new int[size];
      Arrays.fill(ones, 1);
      Assertions.assertArrayEquals(ones, seen);
    }
  }
}
