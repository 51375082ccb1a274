package io.lacuna.regular;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Converts a right-linear {@link Grammar} into an equivalent nondeterministic automaton, with one state per
 * nonterminal and a single fresh accepting state.
 */
public class NfaBuilder {

  private static final Logger LOG = LoggerFactory.getLogger(NfaBuilder.class);

  private final Consumer<GrammarShapeException> onMalformed;

  /**
   * Creates a builder which logs, and then skips, any malformed production.
   */
  public NfaBuilder() {
    this(e -> LOG.warn("skipping production: {}", e.getMessage()));
  }

  /**
   * @param onMalformed invoked once for each production which is skipped
   */
  public NfaBuilder(Consumer<GrammarShapeException> onMalformed) {
    this.onMalformed = onMalformed;
  }

  public Automaton build(Grammar grammar) {
    StateId accept = StateId.of(Utils.fresh("Z", grammar.nonterminals()::contains));

    Automaton.Builder builder = Automaton.Builder.nfa()
            .setStart(StateId.of(grammar.start()))
            .addFinal(accept);
    grammar.nonterminals().forEach(n -> builder.addState(StateId.of(n)));
    grammar.terminals().forEach(builder::addSymbol);

    int skipped = 0;
    for (Production p : grammar.productions()) {
      try {
        check(grammar, p);
      } catch (GrammarShapeException e) {
        skipped++;
        onMalformed.accept(e);
        continue;
      }

      StateId from = StateId.of(p.left);
      switch (p.shape()) {
        case TERMINAL_NONTERMINAL:
          builder.addTransition(from, p.terminal.charAt(0), StateId.of(p.right));
          break;
        case NONTERMINAL:
          builder.addEpsilon(from, StateId.of(p.right));
          break;
        case TERMINAL:
          builder.addTransition(from, p.terminal.charAt(0), accept);
          break;
        case EMPTY:
          builder.addEpsilon(from, accept);
          break;
      }
    }

    Automaton nfa = builder.build();
    LOG.debug("built {} from {} productions, {} skipped", nfa, grammar.productions().size(), skipped);
    return nfa;
  }

  private static void check(Grammar grammar, Production p) {
    if (p.left == null || !grammar.nonterminals().contains(p.left)) {
      throw new GrammarShapeException(p.toString(), "must rewrite a declared nonterminal");
    }
    if (p.terminal != null) {
      if (p.terminal.length() != 1) {
        throw new GrammarShapeException(p.toString(), "has more than one terminal");
      }
      if (!grammar.terminals().contains(p.terminal.charAt(0))) {
        throw new GrammarShapeException(p.toString(), "uses undeclared terminal '" + p.terminal + "'");
      }
    }
    if (p.right != null && !grammar.nonterminals().contains(p.right)) {
      throw new GrammarShapeException(p.toString(), "uses undeclared nonterminal '" + p.right + "'");
    }
  }
}
