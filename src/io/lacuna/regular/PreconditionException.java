package io.lacuna.regular;

/**
 * Thrown when an operation is handed an automaton of the wrong kind, e.g. a partial DFA passed to
 * {@link Operations#complement(Automaton)}.
 */
public class PreconditionException extends AutomatonException {

  public PreconditionException(String message) {
    super(message);
  }
}
