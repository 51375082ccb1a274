package io.lacuna.regular;

import io.lacuna.bifurcan.*;

/**
 * Runs input strings through automata.  A string being rejected, for whatever reason, is a normal result rather than an
 * exception.
 */
public final class Simulator {

  private Simulator() {
  }

  /**
   * @return the result of running {@code input} through {@code automaton}, using a deterministic walk if possible
   */
  public static Simulation simulate(Automaton automaton, String input) {
    return automaton.isDeterministic() ? deterministic(automaton, input) : nondeterministic(automaton, input);
  }

  /**
   * @throws PreconditionException if {@code dfa} isn't deterministic
   */
  public static Simulation deterministic(Automaton dfa, String input) {
    if (!dfa.isDeterministic()) {
      throw new PreconditionException("deterministic simulation requires a deterministic automaton");
    }

    StateId current = dfa.start();
    LinearList<Simulation.Step> trace = LinearList.of(step(LinearSet.of(current), null));

    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      if (!dfa.alphabet().contains(c)) {
        return rejected(trace, i, c, Simulation.Reason.SYMBOL_NOT_IN_ALPHABET);
      }

      StateId next = dfa.transition(current, c);
      if (next == null) {
        return rejected(trace, i, c, Simulation.Reason.UNDEFINED_TRANSITION);
      }

      current = next;
      trace.addLast(step(LinearSet.of(current), c));
    }

    return new Simulation(dfa.isFinal(current), trace.forked(), null);
  }

  /**
   * Tracks the epsilon-closed set of active states, which works for any automaton.
   */
  public static Simulation nondeterministic(Automaton automaton, String input) {
    ISet<StateId> active = EpsilonClosure.of(automaton, automaton.start());
    LinearList<Simulation.Step> trace = LinearList.of(step(active, null));

    for (int i = 0; i < input.length(); i++) {
      char c = input.charAt(i);
      if (!automaton.alphabet().contains(c)) {
        return rejected(trace, i, c, Simulation.Reason.SYMBOL_NOT_IN_ALPHABET);
      }

      LinearSet<StateId> next = new LinearSet<>();
      for (StateId s : active) {
        Utils.union(next, automaton.transitions(s, c));
      }

      active = EpsilonClosure.of(automaton, next);
      trace.addLast(step(active, c));

      if (active.size() == 0) {
        return rejected(trace, i, c, Simulation.Reason.DEAD_END);
      }
    }

    return new Simulation(Utils.containsAny(automaton.finals(), active), trace.forked(), null);
  }

  private static Simulation.Step step(ISet<StateId> states, Character symbol) {
    return new Simulation.Step(states.forked(), symbol);
  }

  private static Simulation rejected(LinearList<Simulation.Step> trace, int position, char c, Simulation.Reason reason) {
    return new Simulation(false, trace.forked(), new Simulation.Failure(position, c, reason));
  }
}
