package io.lacuna.regular.text;

import io.lacuna.regular.AutomatonException;

/**
 * Thrown when grammar text can't be read at all, as opposed to a single malformed production.
 */
public class GrammarFormatException extends AutomatonException {

  private final int line;

  public GrammarFormatException(String message, int line) {
    super(line > 0 ? "line " + line + ": " + message : message);
    this.line = line;
  }

  public int line() {
    return line;
  }
}
