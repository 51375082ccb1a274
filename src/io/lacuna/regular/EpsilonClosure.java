package io.lacuna.regular;

import io.lacuna.bifurcan.*;

/**
 * The epsilon-closure of a set of states: everything reachable from them using only epsilon moves.  Both subset
 * construction and nondeterministic simulation go through here.
 */
public final class EpsilonClosure {

  private EpsilonClosure() {
  }

  /**
   * @return the smallest superset of {@code states} which is closed under the epsilon moves of {@code automaton}
   */
  public static ISet<StateId> of(Automaton automaton, Iterable<StateId> states) {
    LinearSet<StateId> accumulator = new LinearSet<>();
    LinearList<StateId> stack = new LinearList<>();

    for (StateId s : states) {
      if (!accumulator.contains(s)) {
        accumulator.add(s);
        stack.addLast(s);
      }
    }

    // the accumulator doubles as the visited set, so epsilon cycles terminate
    while (stack.size() > 0) {
      StateId s = stack.popLast();
      for (StateId t : automaton.epsilonTransitions(s)) {
        if (!accumulator.contains(t)) {
          accumulator.add(t);
          stack.addLast(t);
        }
      }
    }

    return accumulator.forked();
  }

  public static ISet<StateId> of(Automaton automaton, StateId state) {
    return of(automaton, LinearSet.of(state));
  }
}
