package TableFill.Table;

/**
 * How the fixpoint closure of the marking is computed. All strategies reach the same marked set;
 * they differ in cost and in how marks are grouped into trace phases.
 */
public enum MarkingStrategy {
    /**
     * Repeated full scans over the unmarked pairs until a pass marks nothing. A mark is visible to the rest of
     * the pass that made it.
     */
    PASSES,
    /**
     * Propagates marks backwards along predecessor lists, starting from the base-case marks.
     */
    WORKLIST,
    /**
     * Full scans sharded over a fork/join pool. Every pass reads the marks of the previous pass only; its own
     * marks are applied after all shards finished.
     */
    PARALLEL;

    public static MarkingStrategy fromName(String name) {
        for (MarkingStrategy s : values()) {
            if (s.name().equalsIgnoreCase(name)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unexpected marking strategy: " + name);
    }
}
