package io.lacuna.regular;

import io.lacuna.bifurcan.*;

import java.util.Objects;

/**
 * An immutable finite automaton over {@code char} signals.  Epsilon moves are kept apart from signal transitions, so the
 * epsilon marker is never a member of the alphabet.
 * <p>
 * Instances are created through {@link Builder}, and every operation over them returns a new automaton.
 */
public class Automaton {

  public static final char EPSILON = 'ε';

  private static final ISet<StateId> NONE = new LinearSet<StateId>().forked();

  private final ISet<StateId> states;
  private final ISet<Character> alphabet;
  private final IMap<StateId, IMap<Character, ISet<StateId>>> transitions;
  private final IMap<StateId, ISet<StateId>> epsilonTransitions;
  private final StateId start;
  private final ISet<StateId> finals;
  private final boolean deterministic;

  private Automaton(
          ISet<StateId> states,
          ISet<Character> alphabet,
          IMap<StateId, IMap<Character, ISet<StateId>>> transitions,
          IMap<StateId, ISet<StateId>> epsilonTransitions,
          StateId start,
          ISet<StateId> finals,
          boolean deterministic) {
    this.states = states;
    this.alphabet = alphabet;
    this.transitions = transitions;
    this.epsilonTransitions = epsilonTransitions;
    this.start = start;
    this.finals = finals;
    this.deterministic = deterministic;
  }

  public ISet<StateId> states() {
    return states;
  }

  public ISet<Character> alphabet() {
    return alphabet;
  }

  public StateId start() {
    return start;
  }

  public ISet<StateId> finals() {
    return finals;
  }

  public boolean isFinal(StateId state) {
    return finals.contains(state);
  }

  public boolean isDeterministic() {
    return deterministic;
  }

  /**
   * @return the states reachable from {@code state} by consuming {@code signal}, which may be empty
   */
  public ISet<StateId> transitions(StateId state, char signal) {
    IMap<Character, ISet<StateId>> m = transitions.get(state, null);
    return m == null ? NONE : m.get(signal, NONE);
  }

  /**
   * @return the single state reachable from {@code state} by consuming {@code signal}, or {@code null} if there's none
   */
  public StateId transition(StateId state, char signal) {
    ISet<StateId> s = transitions(state, signal);
    if (s.size() > 1) {
      throw new IllegalStateException("(" + state + ", " + signal + ") has " + s.size() + " destinations");
    }
    return s.size() == 0 ? null : s.iterator().next();
  }

  public ISet<StateId> epsilonTransitions(StateId state) {
    return epsilonTransitions.get(state, NONE);
  }

  /**
   * @return the signals which have a transition out of {@code state}
   */
  public ISet<Character> signals(StateId state) {
    IMap<Character, ISet<StateId>> m = transitions.get(state, null);
    return m == null ? new LinearSet<Character>().forked() : m.keys();
  }

  /**
   * @return the signals in the alphabet which have no transition out of {@code state}
   */
  public ISet<Character> missingSignals(StateId state) {
    ISet<Character> defined = signals(state);
    LinearSet<Character> missing = new LinearSet<>();
    for (Character c : alphabet) {
      if (!defined.contains(c)) {
        missing.add(c);
      }
    }
    return missing.forked();
  }

  /**
   * @return true if every state has a transition for every signal in the alphabet
   */
  public boolean isTotal() {
    for (StateId s : states) {
      if (missingSignals(s).size() > 0) {
        return false;
      }
    }
    return true;
  }

  /**
   * @return every transition, epsilon moves included, ordered by origin and then signal
   */
  public IList<Transition> transitions() {
    LinearList<Transition> result = new LinearList<>();
    for (StateId origin : Utils.sorted(states)) {
      IMap<Character, ISet<StateId>> m = transitions.get(origin, null);
      if (m != null) {
        for (Character c : Utils.sorted(m.keys())) {
          for (StateId target : Utils.sorted(m.get(c, NONE))) {
            result.addLast(new Transition(origin, c, target));
          }
        }
      }
      for (StateId target : Utils.sorted(epsilonTransitions(origin))) {
        result.addLast(Transition.epsilon(origin, target));
      }
    }
    return result.forked();
  }

  public long transitionCount() {
    return transitions().size();
  }

  @Override
  public String toString() {
    return (deterministic ? "dfa" : "nfa") + "[states=" + states.size() + ", alphabet=" + alphabet.size()
            + ", transitions=" + transitionCount() + "]";
  }

  ///

  /**
   * Accumulates states, signals and transitions, and freezes them into an {@link Automaton}.  States and signals
   * referenced by a transition are added implicitly.
   */
  public static class Builder {

    private final boolean deterministic;
    private final LinearSet<StateId> states = new LinearSet<>();
    private final LinearSet<Character> alphabet = new LinearSet<>();
    private final LinearMap<StateId, LinearMap<Character, LinearSet<StateId>>> transitions = new LinearMap<>();
    private final LinearMap<StateId, LinearSet<StateId>> epsilonTransitions = new LinearMap<>();
    private final LinearSet<StateId> finals = new LinearSet<>();
    private StateId start;

    public Builder(boolean deterministic) {
      this.deterministic = deterministic;
    }

    public static Builder nfa() {
      return new Builder(false);
    }

    public static Builder dfa() {
      return new Builder(true);
    }

    /**
     * @return a builder which contains everything in {@code automaton}, with the given determinism
     */
    public static Builder from(Automaton automaton, boolean deterministic) {
      Builder b = new Builder(deterministic);
      automaton.states.forEach(b::addState);
      automaton.alphabet.forEach(b::addSymbol);
      automaton.transitions().forEach(b::add);
      automaton.finals.forEach(b::addFinal);
      b.setStart(automaton.start);
      return b;
    }

    public static Builder from(Automaton automaton) {
      return from(automaton, automaton.deterministic);
    }

    public Builder addState(StateId state) {
      states.add(Objects.requireNonNull(state));
      return this;
    }

    public Builder addSymbol(char symbol) {
      if (symbol == EPSILON) {
        throw new IllegalArgumentException("epsilon cannot be part of the alphabet");
      }
      alphabet.add(symbol);
      return this;
    }

    public Builder setStart(StateId state) {
      addState(state);
      start = state;
      return this;
    }

    public Builder addFinal(StateId state) {
      addState(state);
      finals.add(state);
      return this;
    }

    public Builder addTransition(StateId from, char symbol, StateId to) {
      addState(from).addState(to).addSymbol(symbol);

      LinearMap<Character, LinearSet<StateId>> m = transitions.get(from, null);
      if (m == null) {
        m = new LinearMap<>();
        transitions.put(from, m);
      }

      LinearSet<StateId> targets = m.get(symbol, null);
      if (targets == null) {
        targets = new LinearSet<>();
        m.put(symbol, targets);
      } else if (deterministic) {
        throw new DuplicateTransitionException(from, symbol);
      }

      targets.add(to);
      return this;
    }

    public Builder addEpsilon(StateId from, StateId to) {
      if (deterministic) {
        throw new IllegalStateException("a deterministic automaton cannot have epsilon transitions");
      }
      addState(from).addState(to);

      LinearSet<StateId> targets = epsilonTransitions.get(from, null);
      if (targets == null) {
        targets = new LinearSet<>();
        epsilonTransitions.put(from, targets);
      }
      targets.add(to);
      return this;
    }

    public Builder add(Transition t) {
      return t.isEpsilon() ? addEpsilon(t.origin, t.target) : addTransition(t.origin, t.symbol, t.target);
    }

    public Automaton build() {
      if (start == null) {
        throw new IllegalStateException("no start state has been set");
      }

      LinearMap<StateId, IMap<Character, ISet<StateId>>> t = new LinearMap<>();
      for (StateId s : transitions.keys()) {
        LinearMap<Character, LinearSet<StateId>> m = transitions.get(s, null);
        LinearMap<Character, ISet<StateId>> frozen = new LinearMap<>();
        for (Character c : m.keys()) {
          frozen.put(c, m.get(c, null).clone().forked());
        }
        t.put(s, frozen.forked());
      }

      LinearMap<StateId, ISet<StateId>> e = new LinearMap<>();
      for (StateId s : epsilonTransitions.keys()) {
        e.put(s, epsilonTransitions.get(s, null).clone().forked());
      }

      return new Automaton(
              states.clone().forked(),
              alphabet.clone().forked(),
              t.forked(),
              e.forked(),
              start,
              finals.clone().forked(),
              deterministic);
    }
  }
}
