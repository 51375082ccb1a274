package io.lacuna.regular;

import io.lacuna.bifurcan.*;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static io.lacuna.regular.Fixtures.s;

public class SimulatorTest {

  private static Automaton alternatingNfa() {
    return new NfaBuilder().build(Fixtures.alternating());
  }

  private static Automaton alternatingDfa() {
    return StateRenamer.rename(new Determinizer().determinize(alternatingNfa()));
  }

  @Test
  void testTrace() {
    Simulation result = Simulator.simulate(alternatingDfa(), "abab");

    Assertions.assertTrue(result.accepted());
    Assertions.assertFalse(result.failure().isPresent());

    IList<Simulation.Step> trace = result.trace();
    Assertions.assertEquals(5, trace.size());
    String[] expected = {"q0", "q1", "q0", "q1", "q0"};
    for (int i = 0; i < expected.length; i++) {
      Assertions.assertEquals(s(expected[i]), trace.nth(i).state());
    }

    Assertions.assertEquals(Optional.empty(), trace.nth(0).symbol());
    Assertions.assertEquals(Optional.of('a'), trace.nth(1).symbol());
    Assertions.assertEquals("q0", trace.nth(0).toString());
    Assertions.assertEquals("a => q1", trace.nth(1).toString());
  }

  @Test
  void testEmptyInput() {
    Simulation result = Simulator.simulate(alternatingDfa(), "");
    Assertions.assertTrue(result.accepted());
    Assertions.assertEquals(1, result.trace().size());

    Automaton nonAccepting = Automaton.Builder.dfa().setStart(s("p")).addFinal(s("x")).build();
    Assertions.assertFalse(Simulator.simulate(nonAccepting, "").accepted());
  }

  @Test
  void testSymbolNotInAlphabet() {
    Automaton empty = Automaton.Builder.dfa().setStart(s("p")).addFinal(s("p")).build();

    Assertions.assertTrue(Simulator.simulate(empty, "").accepted());

    Simulation result = Simulator.simulate(empty, "a");
    Assertions.assertFalse(result.accepted());
    Simulation.Failure failure = result.failure().get();
    Assertions.assertEquals(0, failure.position);
    Assertions.assertEquals('a', failure.symbol);
    Assertions.assertEquals(Simulation.Reason.SYMBOL_NOT_IN_ALPHABET, failure.reason);

    Simulation nfaResult = Simulator.simulate(alternatingNfa(), "abc");
    Assertions.assertEquals(Simulation.Reason.SYMBOL_NOT_IN_ALPHABET, nfaResult.failure().get().reason);
    Assertions.assertEquals(2, nfaResult.failure().get().position);
    Assertions.assertEquals(3, nfaResult.trace().size());
  }

  @Test
  void testUndefinedTransition() {
    Automaton dfa = alternatingDfa();

    Simulation b = Simulator.simulate(dfa, "b");
    Assertions.assertFalse(b.accepted());
    Assertions.assertEquals(Simulation.Reason.UNDEFINED_TRANSITION, b.failure().get().reason);
    Assertions.assertEquals(0, b.failure().get().position);
    Assertions.assertEquals(1, b.trace().size());

    // the trace stops before the failing symbol
    Simulation aa = Simulator.simulate(dfa, "aa");
    Assertions.assertEquals(1, aa.failure().get().position);
    Assertions.assertEquals(2, aa.trace().size());
    Assertions.assertEquals(s("q1"), aa.trace().nth(1).state());
    Assertions.assertEquals("no transition for 'a' at position 1", aa.failure().get().toString());

    Assertions.assertFalse(Simulator.simulate(dfa, "aba").accepted());
    Assertions.assertFalse(Simulator.simulate(dfa, "aba").failure().isPresent());
  }

  @Test
  void testNondeterministic() {
    Automaton nfa = alternatingNfa();

    Simulation result = Simulator.simulate(nfa, "abab");
    Assertions.assertTrue(result.accepted());
    Assertions.assertEquals(5, result.trace().size());

    ISet<StateId> first = result.trace().nth(0).states();
    Assertions.assertEquals(2, first.size());
    Assertions.assertTrue(first.contains(s("S")));
    Assertions.assertTrue(first.contains(s("Z")));
    Assertions.assertTrue(result.trace().nth(4).states().contains(s("Z")));

    Assertions.assertFalse(Simulator.simulate(nfa, "aba").accepted());
  }

  @Test
  void testDeadEnd() {
    Simulation result = Simulator.simulate(alternatingNfa(), "b");

    Assertions.assertFalse(result.accepted());
    Assertions.assertEquals(Simulation.Reason.DEAD_END, result.failure().get().reason);
    Assertions.assertEquals(0, result.failure().get().position);
    Assertions.assertEquals(2, result.trace().size());
    Assertions.assertEquals(0, result.trace().nth(1).states().size());
  }

  @Test
  void testDeterministicRequiresDfa() {
    Assertions.assertThrows(PreconditionException.class, () -> Simulator.deterministic(alternatingNfa(), "ab"));

    // a DFA can still be walked as a set of active states
    Automaton dfa = alternatingDfa();
    for (String w : Fixtures.strings("ab", 5)) {
      Assertions.assertEquals(
              Simulator.deterministic(dfa, w).accepted(),
              Simulator.nondeterministic(dfa, w).accepted(),
              w);
    }
  }
}
