package TableFill.IO;

import TableFill.Model.Automaton;
import TableFill.Model.MarkedPair;
import TableFill.Model.MarkingPhase;
import TableFill.Partition.Partition;
import TableFill.Table.DistinguishabilityTable;

import java.util.List;

/**
 * Text views of a marking run, for console narration.
 */
public class TableRenderer {
    public static final String LEGEND = "Legend: X = distinguishable, - = equivalent";

    private TableRenderer() {}

    /**
     * Lower-triangular table: header with states 0..n-2, one row per state 1..n-1.
     */
    public static String renderTable(DistinguishabilityTable table, Automaton automaton) {
        final List<String> states = automaton.getStates();
        final int n = states.size();
        int width = 0;
        for (String s : states) {
            width = Math.max(width, s.length());
        }
        width += 2;

        final StringBuilder sb = new StringBuilder();
        final StringBuilder header = new StringBuilder(" ".repeat(width)).append('|');
        for (int i = 0; i < n - 1; i++) {
            header.append(' ').append(center(states.get(i), width)).append(" |");
        }
        sb.append(header).append('\n');
        sb.append("-".repeat(header.length())).append('\n');

        for (int i = 1; i < n; i++) {
            sb.append(' ').append(padRight(states.get(i), width)).append('|');
            for (int j = 0; j < i; j++) {
                final String cell = table.isMarked(i, j) ? "X" : "-";
                sb.append(' ').append(center(cell, width)).append(" |");
            }
            sb.append('\n');
        }
        sb.append(LEGEND).append('\n');
        return sb.toString();
    }

    public static String renderTrace(List<MarkingPhase> phases) {
        final StringBuilder sb = new StringBuilder();
        for (MarkingPhase phase : phases) {
            sb.append(phase.label()).append(": ").append(phase.description()).append('\n');
            for (MarkedPair marked : phase.marked()) {
                sb.append("   ").append(marked).append('\n');
            }
        }
        return sb.toString();
    }

    public static String renderClasses(Partition partition) {
        final StringBuilder sb = new StringBuilder();
        for (int c = 0; c < partition.size(); c++) {
            sb.append("Class ").append(c + 1).append(": {")
                .append(String.join(", ", partition.memberNames(c))).append("}\n");
        }
        return sb.toString();
    }

    static String center(String s, int width) {
        if (s.length() >= width) {
            return s;
        }
        int left = (width - s.length()) / 2;
        int right = width - s.length() - left;
        return " ".repeat(left) + s + " ".repeat(right);
    }

    static String padRight(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }
}
