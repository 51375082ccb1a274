package io.lacuna.regular;

import java.util.Objects;

/**
 * A single edge {@code origin --symbol--> target}, where a {@code null} symbol denotes an epsilon move.
 */
public final class Transition implements Comparable<Transition> {

  public final StateId origin;
  public final Character symbol;
  public final StateId target;

  public Transition(StateId origin, Character symbol, StateId target) {
    this.origin = Objects.requireNonNull(origin);
    this.symbol = symbol;
    this.target = Objects.requireNonNull(target);
  }

  public static Transition epsilon(StateId origin, StateId target) {
    return new Transition(origin, null, target);
  }

  public boolean isEpsilon() {
    return symbol == null;
  }

  /**
   * @return the same edge, pointing the other way
   */
  public Transition reversed() {
    return new Transition(target, symbol, origin);
  }

  // epsilon moves sort after every real symbol leaving the same state
  @Override
  public int compareTo(Transition o) {
    int cmp = origin.compareTo(o.origin);
    if (cmp != 0) {
      return cmp;
    }

    if (isEpsilon() != o.isEpsilon()) {
      return isEpsilon() ? 1 : -1;
    }

    cmp = isEpsilon() ? 0 : symbol.compareTo(o.symbol);
    return cmp != 0 ? cmp : target.compareTo(o.target);
  }

  @Override
  public int hashCode() {
    return Objects.hash(origin, symbol, target);
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Transition)) {
      return false;
    }
    Transition t = (Transition) obj;
    return origin.equals(t.origin) && Objects.equals(symbol, t.symbol) && target.equals(t.target);
  }

  @Override
  public String toString() {
    return origin + ", " + (isEpsilon() ? Automaton.EPSILON : symbol) + " -> " + target;
  }
}
