package io.lacuna.regular;

import io.lacuna.bifurcan.*;

/**
 * An immutable right-linear grammar.  Productions are kept exactly as given, malformed ones included, since reporting
 * them is left to {@link NfaBuilder}.
 */
public class Grammar {

  private final ISet<String> nonterminals;
  private final ISet<Character> terminals;
  private final IList<Production> productions;
  private final String start;

  public Grammar(
          Iterable<String> nonterminals,
          Iterable<Character> terminals,
          Iterable<Production> productions,
          String start) {

    LinearSet<String> n = new LinearSet<>();
    nonterminals.forEach(n::add);

    LinearSet<Character> t = new LinearSet<>();
    terminals.forEach(t::add);

    LinearList<Production> p = new LinearList<>();
    productions.forEach(p::addLast);

    if (!n.contains(start)) {
      throw new IllegalArgumentException("start symbol '" + start + "' is not a nonterminal");
    }
    if (t.contains(Automaton.EPSILON)) {
      throw new IllegalArgumentException("epsilon cannot be a terminal");
    }

    this.nonterminals = n.forked();
    this.terminals = t.forked();
    this.productions = p.forked();
    this.start = start;
  }

  public ISet<String> nonterminals() {
    return nonterminals;
  }

  public ISet<Character> terminals() {
    return terminals;
  }

  public IList<Production> productions() {
    return productions;
  }

  public String start() {
    return start;
  }

  @Override
  public String toString() {
    LinearSet<String> t = Utils.map(terminals, c -> c.toString());
    return "G = ({" + String.join(", ", Utils.sorted(nonterminals)) + "}, {"
            + String.join(", ", Utils.sorted(t)) + "}, P, " + start + ")";
  }
}
