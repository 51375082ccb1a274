package io.lacuna.regular;

/**
 * Describes a production which isn't one of {@code A -> aB}, {@code A -> B}, {@code A -> a}, or {@code A -> ε} over
 * the grammar's declared symbols.  These are reported and skipped rather than thrown, so that the rest of the grammar
 * can still be converted.
 */
public class GrammarShapeException extends AutomatonException {

  private final String production;
  private final int line;

  public GrammarShapeException(String production, String reason) {
    this(production, reason, -1);
  }

  public GrammarShapeException(String production, String reason, int line) {
    super((line > 0 ? "line " + line + ": " : "") + "'" + production + "' " + reason);
    this.production = production;
    this.line = line;
  }

  public String production() {
    return production;
  }

  /**
   * @return the 1-based source line, or -1 if the production didn't come from text
   */
  public int line() {
    return line;
  }
}
