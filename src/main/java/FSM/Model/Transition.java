package FSM.Model;

/**
 * A (source, symbol, target) triple. A {@code null} symbol marks an epsilon move.
 */
public record Transition<S, I>(S source, I symbol, S target) {

  public boolean isEpsilon() {
    return symbol == null;
  }

  @Override
  public String toString() {
    return "(" + source + ", " + (isEpsilon() ? "ε" : symbol) + ", " + target + ")";
  }
}
