package TableFill.Model;

/**
 * A pair that got marked distinguishable, with the evidence for it.
 * @param pair - the marked pair
 * @param symbol - distinguishing symbol, or null if the pair was marked in the base case
 * @param successors - successor pair on {@code symbol} that was already marked, or null in the base case
 */
public record MarkedPair(StatePair pair, String symbol, StatePair successors) {

  public static MarkedPair baseCase(StatePair pair) {
    return new MarkedPair(pair, null, null);
  }

  public boolean isBaseCase() {
    return symbol == null;
  }

  public String reason() {
    if (isBaseCase()) {
      return "one state is accepting, the other is not";
    }
    return "symbol '" + symbol + "' leads to " + successors + ", which is distinguishable";
  }

  @Override
  public String toString() {
    return pair + ": " + reason();
  }
}
