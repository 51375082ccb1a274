package io.lacuna.regular;

import io.lacuna.bifurcan.*;

/**
 * Relabels an automaton's states as {@code q0, q1, ...} in breadth-first order from the start state, visiting signals
 * in sorted order.  States which aren't reachable are numbered last, in sorted order.
 */
public final class StateRenamer {

  public static final String PREFIX = "q";

  private StateRenamer() {
  }

  public static Automaton rename(Automaton automaton) {
    IMap<StateId, StateId> names = names(automaton);

    Automaton.Builder builder = new Automaton.Builder(automaton.isDeterministic())
            .setStart(names.get(automaton.start(), null));
    automaton.alphabet().forEach(builder::addSymbol);

    for (StateId s : Utils.sorted(automaton.states())) {
      builder.addState(names.get(s, null));
    }
    for (StateId s : automaton.finals()) {
      builder.addFinal(names.get(s, null));
    }
    for (Transition t : automaton.transitions()) {
      builder.add(new Transition(names.get(t.origin, null), t.symbol, names.get(t.target, null)));
    }

    return builder.build();
  }

  /**
   * @return the mapping from each state of {@code automaton} onto its new label
   */
  public static IMap<StateId, StateId> names(Automaton automaton) {
    LinearMap<StateId, StateId> names = new LinearMap<>();
    LinearList<StateId> queue = LinearList.of(automaton.start());
    names.put(automaton.start(), label(0));

    while (queue.size() > 0) {
      StateId s = queue.popFirst();
      for (Transition t : successors(automaton, s)) {
        if (!names.contains(t.target)) {
          names.put(t.target, label(names.size()));
          queue.addLast(t.target);
        }
      }
    }

    for (StateId s : Utils.sorted(automaton.states())) {
      if (!names.contains(s)) {
        names.put(s, label(names.size()));
      }
    }

    return names.forked();
  }

  private static IList<Transition> successors(Automaton automaton, StateId state) {
    LinearList<Transition> result = new LinearList<>();
    for (char c : Utils.sorted(automaton.alphabet())) {
      for (StateId t : Utils.sorted(automaton.transitions(state, c))) {
        result.addLast(new Transition(state, c, t));
      }
    }
    for (StateId t : Utils.sorted(automaton.epsilonTransitions(state))) {
      result.addLast(Transition.epsilon(state, t));
    }
    return result;
  }

  private static StateId label(long n) {
    return StateId.of(PREFIX + n);
  }
}
