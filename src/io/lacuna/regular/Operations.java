package io.lacuna.regular;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closure operations over automata.  None of these mutate their input.
 */
public final class Operations {

  private static final Logger LOG = LoggerFactory.getLogger(Operations.class);

  private Operations() {
  }

  /// completion and complement

  /**
   * @return {@code dfa}, if it's already total, otherwise a copy where every undefined transition leads to a new,
   * non-accepting sink state
   */
  public static Automaton complete(Automaton dfa) {
    requireDeterministic(dfa, "completion");

    if (dfa.isTotal()) {
      return dfa;
    }

    StateId sink = Utils.freshState("sink", dfa.states());
    Automaton.Builder builder = Automaton.Builder.from(dfa).addState(sink);

    int redirected = 0;
    for (StateId s : Utils.sorted(dfa.states())) {
      for (Character c : dfa.missingSignals(s)) {
        builder.addTransition(s, c, sink);
        redirected++;
      }
    }

    for (Character c : dfa.alphabet()) {
      builder.addTransition(sink, c, sink);
    }

    LOG.debug("added sink state {} for {} undefined transitions", sink, redirected);
    return builder.build();
  }

  /**
   * @return an automaton which accepts exactly the strings {@code dfa} rejects
   * @throws PreconditionException if {@code dfa} is nondeterministic or partial, see {@link #complete(Automaton)}
   */
  public static Automaton complement(Automaton dfa) {
    requireDeterministic(dfa, "complement");
    if (!dfa.isTotal()) {
      throw new PreconditionException("complement requires a total automaton, complete it first");
    }

    Automaton.Builder builder = Automaton.Builder.dfa().setStart(dfa.start());
    dfa.alphabet().forEach(builder::addSymbol);
    dfa.transitions().forEach(builder::add);

    for (StateId s : dfa.states()) {
      builder.addState(s);
      if (!dfa.isFinal(s)) {
        builder.addFinal(s);
      }
    }

    return builder.build();
  }

  /// reversal

  /**
   * @return {@code automaton}, if it has exactly one accepting state, otherwise an equivalent automaton where every
   * original accepting state has an epsilon move to a single new accepting state
   */
  public static Automaton normalizeFinals(Automaton automaton) {
    if (automaton.finals().size() == 1) {
      return automaton;
    }

    StateId accept = Utils.freshState("qf", automaton.states());

    Automaton.Builder builder = Automaton.Builder.nfa().setStart(automaton.start()).addFinal(accept);
    automaton.states().forEach(builder::addState);
    automaton.alphabet().forEach(builder::addSymbol);

    // existing transitions out of accepting states are kept, the epsilon move is an additional choice
    automaton.transitions().forEach(builder::add);
    for (StateId f : Utils.sorted(automaton.finals())) {
      builder.addEpsilon(f, accept);
    }

    LOG.debug("merged {} accepting states into {}", automaton.finals().size(), accept);
    return builder.build();
  }

  /**
   * @return an automaton with every transition of {@code automaton} pointing the other way, starting from its accepting
   * state and accepting at its start state
   * @throws PreconditionException if {@code automaton} doesn't have exactly one accepting state
   */
  public static Automaton reverseTransitions(Automaton automaton) {
    if (automaton.finals().size() != 1) {
      throw new PreconditionException(
              "reversal requires exactly one accepting state, found " + automaton.finals().size());
    }

    Automaton.Builder builder = Automaton.Builder.nfa()
            .setStart(automaton.finals().iterator().next())
            .addFinal(automaton.start());
    automaton.states().forEach(builder::addState);
    automaton.alphabet().forEach(builder::addSymbol);

    for (Transition t : automaton.transitions()) {
      builder.add(t.reversed());
    }

    return builder.build();
  }

  /**
   * @return a nondeterministic automaton accepting the reverse of every string {@code automaton} accepts
   */
  public static Automaton reverse(Automaton automaton) {
    return reverseTransitions(normalizeFinals(automaton));
  }

  ///

  private static void requireDeterministic(Automaton automaton, String operation) {
    if (!automaton.isDeterministic()) {
      throw new PreconditionException(operation + " requires a deterministic automaton, determinize it first");
    }
  }
}
