package io.lacuna.regular;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static io.lacuna.regular.Fixtures.s;

public class OperationsTest {

  private static Automaton alternatingDfa() {
    return StateRenamer.rename(new Determinizer().determinize(new NfaBuilder().build(Fixtures.alternating())));
  }

  /// completion

  @Test
  void testCompletion() {
    Automaton dfa = alternatingDfa();
    Automaton total = Operations.complete(dfa);

    Assertions.assertTrue(total.isTotal());
    Assertions.assertTrue(total.isDeterministic());
    Assertions.assertEquals(3, total.states().size());
    Assertions.assertEquals(s("sink"), total.transition(s("q0"), 'b'));
    Assertions.assertEquals(s("sink"), total.transition(s("q1"), 'a'));
    Assertions.assertEquals(s("sink"), total.transition(s("sink"), 'a'));
    Assertions.assertEquals(s("sink"), total.transition(s("sink"), 'b'));
    Assertions.assertFalse(total.isFinal(s("sink")));

    // the input is untouched
    Assertions.assertFalse(dfa.isTotal());
    Assertions.assertEquals(2, dfa.states().size());

    Assertions.assertSame(total, Operations.complete(total));
  }

  @Test
  void testSinkNameIsFresh() {
    Automaton dfa = Automaton.Builder.dfa()
            .setStart(s("sink"))
            .addTransition(s("sink"), 'a', s("sink"))
            .addSymbol('b')
            .build();

    Automaton total = Operations.complete(dfa);

    Assertions.assertEquals(s("sink'"), total.transition(s("sink"), 'b'));
    Assertions.assertEquals(2, total.states().size());
  }

  @Test
  void testCompletionPreservesLanguage() {
    Random random = new Random(42);
    for (int i = 0; i < 50; i++) {
      Automaton dfa = Fixtures.randomDfa(random, 1 + random.nextInt(5), "ab", 0.5);
      Automaton total = Operations.complete(dfa);
      for (String w : Fixtures.strings("ab", 5)) {
        Assertions.assertEquals(Simulator.simulate(dfa, w).accepted(), Simulator.simulate(total, w).accepted(), w);
      }
    }
  }

  /// complement

  @Test
  void testComplement() {
    Automaton complement = Operations.complement(Operations.complete(alternatingDfa()));

    Assertions.assertEquals(2, complement.finals().size());
    Assertions.assertTrue(complement.isFinal(s("q1")));
    Assertions.assertTrue(complement.isFinal(s("sink")));
    Assertions.assertFalse(complement.isFinal(s("q0")));

    Assertions.assertFalse(Simulator.simulate(complement, "abab").accepted());
    Assertions.assertTrue(Simulator.simulate(complement, "aba").accepted());
    Assertions.assertTrue(Simulator.simulate(complement, "b").accepted());
  }

  @Test
  void testComplementProperty() {
    Random random = new Random(1);
    for (int i = 0; i < 100; i++) {
      Automaton dfa = Fixtures.randomDfa(random, 1 + random.nextInt(6), "ab", 0.6);
      Automaton complement = Operations.complement(Operations.complete(dfa));

      for (String w : Fixtures.strings("ab", 6)) {
        Assertions.assertNotEquals(
                Simulator.simulate(dfa, w).accepted(),
                Simulator.simulate(complement, w).accepted(),
                w);
      }
    }
  }

  @Test
  void testComplementPreconditions() {
    Assertions.assertThrows(PreconditionException.class, () -> Operations.complement(alternatingDfa()));
    Assertions.assertThrows(PreconditionException.class,
            () -> Operations.complement(new NfaBuilder().build(Fixtures.alternating())));
    Assertions.assertThrows(PreconditionException.class,
            () -> Operations.complete(new NfaBuilder().build(Fixtures.alternating())));
  }

  /// reversal

  @Test
  void testNormalizeFinals() {
    Automaton dfa = Automaton.Builder.dfa()
            .setStart(s("p"))
            .addTransition(s("p"), 'a', s("x"))
            .addTransition(s("p"), 'b', s("y"))
            .addTransition(s("x"), 'a', s("x"))
            .addFinal(s("x"))
            .addFinal(s("y"))
            .build();

    Automaton normalized = Operations.normalizeFinals(dfa);

    Assertions.assertFalse(normalized.isDeterministic());
    Assertions.assertEquals(1, normalized.finals().size());
    Assertions.assertTrue(normalized.isFinal(s("qf")));
    Assertions.assertEquals(dfa.transitionCount() + 2, normalized.transitionCount());

    // accepting states keep their outgoing transitions
    Assertions.assertTrue(normalized.transitions(s("x"), 'a').contains(s("x")));

    for (String w : Fixtures.strings("ab", 4)) {
      Assertions.assertEquals(Simulator.simulate(dfa, w).accepted(), Simulator.simulate(normalized, w).accepted(), w);
    }

    Automaton single = Automaton.Builder.dfa().setStart(s("p")).addFinal(s("p")).build();
    Assertions.assertSame(single, Operations.normalizeFinals(single));
  }

  @Test
  void testReverseTransitions() {
    Automaton dfa = alternatingDfa();
    Automaton reversed = Operations.reverseTransitions(dfa);

    Assertions.assertEquals(s("q0"), reversed.start());
    Assertions.assertTrue(reversed.isFinal(s("q0")));
    Assertions.assertTrue(reversed.transitions(s("q1"), 'a').contains(s("q0")));
    Assertions.assertTrue(reversed.transitions(s("q0"), 'b').contains(s("q1")));

    Assertions.assertTrue(Simulator.simulate(reversed, "ba").accepted());
    Assertions.assertTrue(Simulator.simulate(reversed, "").accepted());
    Assertions.assertFalse(Simulator.simulate(reversed, "ab").accepted());

    Automaton twoFinals = Automaton.Builder.dfa()
            .setStart(s("p"))
            .addTransition(s("p"), 'a', s("x"))
            .addFinal(s("p"))
            .addFinal(s("x"))
            .build();
    Assertions.assertThrows(PreconditionException.class, () -> Operations.reverseTransitions(twoFinals));
  }

  @Test
  void testReversalProperty() {
    Random random = new Random(3);
    Determinizer determinizer = new Determinizer();

    for (int i = 0; i < 100; i++) {
      Automaton dfa = Fixtures.randomDfa(random, 1 + random.nextInt(6), "ab", 0.7);
      Automaton reverse = Operations.reverse(dfa);
      Automaton reverseDfa = determinizer.determinize(reverse);

      for (String w : Fixtures.strings("ab", 5)) {
        boolean expected = Simulator.simulate(dfa, w).accepted();
        Assertions.assertEquals(expected, Simulator.simulate(reverse, Fixtures.reverse(w)).accepted(), w);
        Assertions.assertEquals(expected, Simulator.simulate(reverseDfa, Fixtures.reverse(w)).accepted(), w);
      }
    }
  }

  @Test
  void testReverseWithoutFinals() {
    Automaton dfa = Automaton.Builder.dfa()
            .setStart(s("p"))
            .addTransition(s("p"), 'a', s("p"))
            .build();

    Automaton reverse = Operations.reverse(dfa);

    Assertions.assertEquals(s("qf"), reverse.start());
    for (String w : Fixtures.strings("a", 4)) {
      Assertions.assertFalse(Simulator.simulate(reverse, w).accepted(), w);
    }
  }
}
