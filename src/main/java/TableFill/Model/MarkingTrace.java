package TableFill.Model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Receives the phases of a marking run. The marking engine only builds phase data when {@link #isEnabled()}.
 */
public interface MarkingTrace {

    boolean isEnabled();

    void record(MarkingPhase phase);

    List<MarkingPhase> getPhases();

    /**
     * recording(): keeps every phase in the order it was recorded.
     */
    static MarkingTrace recording() {
        return new MarkingTrace() {
            final List<MarkingPhase> phases = new ArrayList<>();

            @Override
            public boolean isEnabled() {
                return true;
            }

            @Override
            public void record(MarkingPhase phase) {
                phases.add(phase);
            }

            @Override
            public List<MarkingPhase> getPhases() {
                return Collections.unmodifiableList(phases);
            }

            @Override
            public String toString() {
                return "recording" + phases;
            }
        };
    }

    static MarkingTrace noop() {
        return new MarkingTrace() {
            @Override
            public boolean isEnabled() {
                return false;
            }

            @Override
            public void record(MarkingPhase phase) {
            }

            @Override
            public List<MarkingPhase> getPhases() {
                return List.of();
            }

            @Override
            public String toString() {
                return "noop";
            }
        };
    }
}
