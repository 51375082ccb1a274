package io.lacuna.regular;

import io.lacuna.bifurcan.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Function;

/**
 * Subset construction.  Each state of the resulting DFA is a composite {@link StateId} over an epsilon-closed set of
 * the source automaton's states; pairs with no successors are left undefined, so the result may be partial.
 */
public class Determinizer {

  private static final Logger LOG = LoggerFactory.getLogger(Determinizer.class);

  public static final int DEFAULT_MAX_STATES = 10_000;

  private final int maxStates;

  public Determinizer() {
    this(DEFAULT_MAX_STATES);
  }

  /**
   * @param maxStates the most composite states which may be discovered before giving up
   */
  public Determinizer(int maxStates) {
    if (maxStates <= 0) {
      throw new IllegalArgumentException("maxStates must be positive, was " + maxStates);
    }
    this.maxStates = maxStates;
  }

  public int maxStates() {
    return maxStates;
  }

  /**
   * @return a deterministic automaton accepting the same language as {@code nfa}
   * @throws StateLimitExceededException if more than {@link #maxStates()} states are discovered
   */
  public Automaton determinize(Automaton nfa) {

    Automaton.Builder builder = Automaton.Builder.dfa();
    nfa.alphabet().forEach(builder::addSymbol);

    // canonical composite -> discovery index
    LinearMap<StateId, Integer> discovered = new LinearMap<>();
    LinearList<StateId> queue = new LinearList<>();

    Function<ISet<StateId>, StateId> enqueue = states -> {
      StateId composite = StateId.composite(states);
      if (!discovered.contains(composite)) {
        if (discovered.size() >= maxStates) {
          throw new StateLimitExceededException(maxStates);
        }
        discovered.put(composite, (int) discovered.size());
        queue.addLast(composite);

        builder.addState(composite);
        if (Utils.containsAny(nfa.finals(), states)) {
          builder.addFinal(composite);
        }
      }
      return composite;
    };

    builder.setStart(enqueue.apply(EpsilonClosure.of(nfa, nfa.start())));

    List<Character> signals = Utils.sorted(nfa.alphabet());
    while (queue.size() > 0) {
      StateId current = queue.popFirst();

      for (char signal : signals) {
        LinearSet<StateId> targets = new LinearSet<>();
        for (StateId s : current.members()) {
          Utils.union(targets, nfa.transitions(s, signal));
        }

        if (targets.size() > 0) {
          builder.addTransition(current, signal, enqueue.apply(EpsilonClosure.of(nfa, targets)));
        }
      }
    }

    LOG.debug("discovered {} states from an automaton with {}", discovered.size(), nfa.states().size());
    return builder.build();
  }
}
