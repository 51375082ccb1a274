package io.lacuna.regular;

/**
 * Thrown when a deterministic automaton is given a second transition for a {@code (state, symbol)} pair.
 */
public class DuplicateTransitionException extends AutomatonException {

  private final StateId state;
  private final char symbol;

  public DuplicateTransitionException(StateId state, char symbol) {
    super("transition for (" + state + ", " + symbol + ") is already defined");
    this.state = state;
    this.symbol = symbol;
  }

  public StateId state() {
    return state;
  }

  public char symbol() {
    return symbol;
  }
}
