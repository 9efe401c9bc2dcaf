package TableFill.Reducer;

import java.util.ArrayList;
import java.util.List;

/**
 * Names the states of a minimized automaton after the equivalence classes they stand for.
 * A scheme must be a deterministic function of its arguments.
 */
public interface ClassNaming {

    /**
     * @param index - class index, classes ordered by smallest member
     * @param members - member state names, in state order
     * @return name of the new state
     */
    String name(int index, List<String> members);

    String getName();

    /**
     * braces(): member names sorted lexicographically inside braces, e.g. {q0,q1}.
     * Not injective for every state alphabet: a state literally named "q0,q1" collides with the class {q0, q1}.
     */
    static ClassNaming braces() {
        return new ClassNaming() {
            @Override
            public String name(int index, List<String> members) {
                List<String> sorted = new ArrayList<>(members);
                sorted.sort(null);
                return "{" + String.join(",", sorted) + "}";
            }

            @Override
            public String getName() {
                return "braces";
            }
        };
    }

    /**
     * representative(): name of the first member. Classes are disjoint, so names never collide.
     */
    static ClassNaming representative() {
        return new ClassNaming() {
            @Override
            public String name(int index, List<String> members) {
                return members.get(0);
            }

            @Override
            public String getName() {
                return "representative";
            }
        };
    }

    /**
     * indexed(prefix): prefix followed by the class index.
     */
    static ClassNaming indexed(String prefix) {
        return new ClassNaming() {
            @Override
            public String name(int index, List<String> members) {
                return prefix + index;
            }

            @Override
            public String getName() {
                return "indexed";
            }
        };
    }

    static ClassNaming fromName(String name) {
        return switch (name.toLowerCase()) {
            case "braces" -> braces();
            case "representative" -> representative();
            case "indexed" -> indexed("C");
            default -> throw new IllegalArgumentException("Unexpected naming scheme: " + name);
        };
    }
}
