package TableFill.Model;

/**
 * Canonical pair of two distinct states; {@code first} precedes {@code second} in the automaton's state order.
 */
public record StatePair(String first, String second) {

  @Override
  public String toString() {
    return "(" + first + ", " + second + ")";
  }
}
