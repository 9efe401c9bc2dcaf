package TableFill.Model;

import java.util.List;

/**
 * One step of the marking process, in the order the pairs were marked.
 */
public record MarkingPhase(String label, String description, List<MarkedPair> marked) {

  public MarkingPhase {
    marked = List.copyOf(marked);
  }

  @Override
  public String toString() {
    return label + " (" + marked.size() + " marked)";
  }
}
