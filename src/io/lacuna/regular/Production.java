package io.lacuna.regular;

import java.util.Objects;

/**
 * A right-linear production {@code left -> terminal right}, where either side of the right-hand side may be absent.
 * The four shapes this describes are {@code A -> aB}, {@code A -> B}, {@code A -> a}, and {@code A -> ε}.
 */
public final class Production {

  public enum Shape {
    TERMINAL_NONTERMINAL,
    NONTERMINAL,
    TERMINAL,
    EMPTY
  }

  public final String left;
  public final String terminal;
  public final String right;

  /**
   * @param left the nonterminal being rewritten
   * @param terminal the terminal, or {@code null}/empty if there isn't one
   * @param right the trailing nonterminal, or {@code null}/empty if there isn't one
   */
  public Production(String left, String terminal, String right) {
    this.left = left;
    this.terminal = terminal == null || terminal.isEmpty() ? null : terminal;
    this.right = right == null || right.isEmpty() ? null : right;
  }

  public static Production of(String left, char terminal, String right) {
    return new Production(left, String.valueOf(terminal), right);
  }

  public static Production of(String left, char terminal) {
    return new Production(left, String.valueOf(terminal), null);
  }

  public static Production unit(String left, String right) {
    return new Production(left, null, right);
  }

  public static Production empty(String left) {
    return new Production(left, null, null);
  }

  public Shape shape() {
    if (terminal != null) {
      return right != null ? Shape.TERMINAL_NONTERMINAL : Shape.TERMINAL;
    }
    return right != null ? Shape.NONTERMINAL : Shape.EMPTY;
  }

  @Override
  public int hashCode() {
    return Objects.hash(left, terminal, right);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Production)) {
      return false;
    }
    Production p = (Production) obj;
    return Objects.equals(left, p.left) && Objects.equals(terminal, p.terminal) && Objects.equals(right, p.right);
  }

  @Override
  public String toString() {
    String rhs = (terminal == null ? "" : terminal) + (right == null ? "" : right);
    return left + " -> " + (rhs.isEmpty() ? String.valueOf(Automaton.EPSILON) : rhs);
  }
}
