package TableFill.IO;

import TableFill.Model.Automaton;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Graphviz DOT source for an {@link Automaton}.
 */
public class DotFormat {
  private DotFormat() {}

  /**
   * Render a full Dot graph.
   *
   * @param automaton automaton to draw
   * @param title graph label, or null for none
   * @return source code for the graph
   */
  public static String toDot(Automaton automaton, String title) {
    final StringBuilder builder = new StringBuilder();
    builder.append("digraph ").append(escapeId(title == null ? "automaton" : title)).append(" {\n");
    builder.append("  rankdir = LR;\n");
    if (title != null) {
      builder.append("  label = ").append(escapeId(title)).append(";\n");
    }

    // Vertices
    final String startId = escapeId(startMarkerId(automaton));
    builder.append("  ").append(startId).append(" [shape = none, width = 0, height = 0, label = \"\"];\n");
    for (String state : automaton.getStates()) {
      final String shape = automaton.isAccepting(state) ? "doublecircle" : "circle";
      builder.append("  ").append(escapeId(state)).append(" [shape = ").append(shape).append("];\n");
    }

    // Edges
    builder.append("  ").append(startId).append(" -> ").append(escapeId(automaton.getStart())).append(";\n");
    for (String state : automaton.getStates()) {
      // one edge per destination, labelled with every symbol leading there
      final Map<String, List<String>> byTarget = new LinkedHashMap<>();
      for (Map.Entry<String, String> move : automaton.getTransitions(state).entrySet()) {
        byTarget.computeIfAbsent(move.getValue(), k -> new ArrayList<>()).add(move.getKey());
      }
      for (Map.Entry<String, List<String>> edge : byTarget.entrySet()) {
        final List<String> symbols = edge.getValue();
        symbols.sort(null);
        builder.append("  ").append(escapeId(state)).append(" -> ").append(escapeId(edge.getKey()))
            .append(" [label = ").append(escapeId(String.join(",", symbols))).append("];\n");
      }
    }

    builder.append("}\n");
    return builder.toString();
  }

  /**
   * Id of the invisible node the start arrow comes from: {@code _start}, or {@code _start<n>} if a state already
   * has that name.
   */
  static String startMarkerId(Automaton automaton) {
    String id = "_start";
    for (int i = 1; automaton.getStateId(id) >= 0; i++) {
      id = "_start" + i;
    }
    return id;
  }

  /**
   * Turn a string into a Dot ID.
   *
   * As per the docs, an ID can be "any double-quoted string ("...") possibly
   * containing escaped quotes (\")".
   */
  static String escapeId(String str) {
    return "\"" + str.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
  }
}
