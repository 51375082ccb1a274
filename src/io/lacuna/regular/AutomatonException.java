package io.lacuna.regular;

/**
 * The root of every failure raised while building or transforming an automaton.
 */
public class AutomatonException extends RuntimeException {

  public AutomatonException(String message) {
    super(message);
  }
}
