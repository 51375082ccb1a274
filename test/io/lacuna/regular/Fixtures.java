package io.lacuna.regular;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Shared automata and input generators.
 */
final class Fixtures {

  private Fixtures() {
  }

  static StateId s(String label) {
    return StateId.of(label);
  }

  // S -> aA, A -> bS, S -> ε
  static Grammar alternating() {
    return new Grammar(
            List.of("S", "A"),
            List.of('a', 'b'),
            List.of(Production.of("S", 'a', "A"), Production.of("A", 'b', "S"), Production.empty("S")),
            "S");
  }

  // accepts strings whose n-th symbol from the end is 'a', the classic exponential case for subset construction
  static Automaton nthFromLast(int n) {
    Automaton.Builder b = Automaton.Builder.nfa().setStart(s("0")).addFinal(s(String.valueOf(n)));
    b.addTransition(s("0"), 'a', s("0")).addTransition(s("0"), 'b', s("0"));
    b.addTransition(s("0"), 'a', s("1"));
    for (int i = 1; i < n; i++) {
      b.addTransition(s(String.valueOf(i)), 'a', s(String.valueOf(i + 1)));
      b.addTransition(s(String.valueOf(i)), 'b', s(String.valueOf(i + 1)));
    }
    return b.build();
  }

  static Automaton randomDfa(Random random, int states, String alphabet, double density) {
    Automaton.Builder b = Automaton.Builder.dfa().setStart(s("p0"));
    for (char c : alphabet.toCharArray()) {
      b.addSymbol(c);
    }
    for (int i = 0; i < states; i++) {
      StateId from = s("p" + i);
      b.addState(from);
      if (random.nextInt(3) == 0) {
        b.addFinal(from);
      }
      for (char c : alphabet.toCharArray()) {
        if (random.nextDouble() < density) {
          b.addTransition(from, c, s("p" + random.nextInt(states)));
        }
      }
    }
    return b.build();
  }

  static List<String> strings(String alphabet, int maxLength) {
    List<String> result = new ArrayList<>();
    result.add("");
    int from = 0;
    for (int length = 1; length <= maxLength; length++) {
      int to = result.size();
      for (int i = from; i < to; i++) {
        for (char c : alphabet.toCharArray()) {
          result.add(result.get(i) + c);
        }
      }
      from = to;
    }
    return result;
  }

  static String reverse(String s) {
    return new StringBuilder(s).reverse().toString();
  }
}
