package TableFill.Partition;

import TableFill.Model.Automaton;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Equivalence classes of the states of one automaton.
 * <p>
 * Classes are numbered by their smallest member state id, and members are listed in state order, so the same
 * automaton and table always give the same numbering.
 */
public final class Partition {
    private final Automaton automaton;
    private final int[] classOf;
    private final int[][] members;

    Partition(Automaton automaton, int[] classOf, int[][] members) {
        this.automaton = automaton;
        this.classOf = classOf;
        this.members = members;
    }

    /**
     * Number of classes.
     */
    public int size() {
        return members.length;
    }

    public int classOf(int state) {
        return classOf[state];
    }

    public int classOf(String state) {
        int id = automaton.getStateId(state);
        if (id < 0) {
            throw new IllegalArgumentException("Unknown state: " + state);
        }
        return classOf[id];
    }

    /**
     * Member state ids of a class, ascending.
     */
    public int[] members(int cls) {
        return members[cls].clone();
    }

    /**
     * Smallest member state id.
     */
    public int representative(int cls) {
        return members[cls][0];
    }

    public List<String> memberNames(int cls) {
        final List<String> names = new ArrayList<>(members[cls].length);
        for (int q : members[cls]) {
            names.add(automaton.getStateName(q));
        }
        return names;
    }

    /**
     * All classes as state-name sets, in class order.
     */
    public List<Set<String>> getClasses() {
        final List<Set<String>> classes = new ArrayList<>(members.length);
        for (int c = 0; c < members.length; c++) {
            classes.add(Collections.unmodifiableSet(new LinkedHashSet<>(memberNames(c))));
        }
        return Collections.unmodifiableList(classes);
    }

    public Automaton getAutomaton() {
        return automaton;
    }

    @Override
    public String toString() {
        return getClasses().toString();
    }
}
