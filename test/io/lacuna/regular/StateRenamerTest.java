package io.lacuna.regular;

import io.lacuna.bifurcan.*;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static io.lacuna.regular.Fixtures.s;

public class StateRenamerTest {

  @Test
  void testDiscoveryOrder() {
    Automaton dfa = new Determinizer().determinize(new NfaBuilder().build(Fixtures.alternating()));
    Automaton renamed = StateRenamer.rename(dfa);

    Assertions.assertEquals(s("q0"), renamed.start());
    Assertions.assertTrue(renamed.isFinal(s("q0")));
    Assertions.assertFalse(renamed.isFinal(s("q1")));
    Assertions.assertEquals(s("q1"), renamed.transition(s("q0"), 'a'));
    Assertions.assertEquals(s("q0"), renamed.transition(s("q1"), 'b'));
    Assertions.assertTrue(renamed.isDeterministic());
  }

  @Test
  void testUnreachableStatesAreNumberedLast() {
    Automaton dfa = Automaton.Builder.dfa()
            .setStart(s("m"))
            .addState(s("a"))
            .addTransition(s("m"), 'x', s("z"))
            .build();

    IMap<StateId, StateId> names = StateRenamer.names(dfa);

    Assertions.assertEquals(s("q0"), names.get(s("m"), null));
    Assertions.assertEquals(s("q1"), names.get(s("z"), null));
    Assertions.assertEquals(s("q2"), names.get(s("a"), null));
  }

  @Test
  void testBijectionPreservesLanguage() {
    Random random = new Random(7);
    for (int i = 0; i < 50; i++) {
      Automaton dfa = Fixtures.randomDfa(random, 1 + random.nextInt(6), "ab", 0.7);
      Automaton renamed = StateRenamer.rename(dfa);

      IMap<StateId, StateId> names = StateRenamer.names(dfa);
      Set<StateId> images = new HashSet<>();
      for (StateId s : names.keys()) {
        images.add(names.get(s, null));
      }
      Assertions.assertEquals(dfa.states().size(), images.size());
      Assertions.assertEquals(dfa.states().size(), renamed.states().size());
      Assertions.assertEquals(dfa.finals().size(), renamed.finals().size());
      Assertions.assertEquals(dfa.transitionCount(), renamed.transitionCount());

      for (String w : Fixtures.strings("ab", 5)) {
        Assertions.assertEquals(
                Simulator.simulate(dfa, w).accepted(),
                Simulator.simulate(renamed, w).accepted(),
                w);
      }
    }
  }

  @Test
  void testRenamingIsStable() {
    Automaton dfa = new Determinizer().determinize(Fixtures.nthFromLast(3));
    List<Transition> a = Utils.sorted(StateRenamer.rename(dfa).transitions());
    List<Transition> b = Utils.sorted(StateRenamer.rename(dfa).transitions());
    Assertions.assertEquals(a, b);
  }
}
