package fsa;

import static fsa.Fixtures.state;
import static fsa.Fixtures.symbol;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import fsa.util.OrderedSet;
import java.util.LinkedHashMap;
import java.util.List;
import org.junit.Test;

public class NonDeterministicAutomatonWithEpsilonTest {

  private static final List<String> FIXTURES = List.of("NFA1e.json", "NFA2e.json", "NFA3e.json");

  @Test
  public void testAccept() {
    final var nfae = Fixtures.nfae("NFA1e.json");
    assertTrue(nfae.accept("010"));
    assertTrue(nfae.accept("11"));
    assertFalse(nfae.accept(""));
    assertFalse(nfae.accept("01"));

    final var endsInOneOne = Fixtures.nfae("NFA2e.json");
    assertFalse(endsInOneOne.accept(""));
    assertFalse(endsInOneOne.accept("0"));
    assertFalse(endsInOneOne.accept("01"));
    assertTrue(endsInOneOne.accept("011"));

    final var zerosThenOnes = Fixtures.nfae("NFA3e.json");
    assertTrue(zerosThenOnes.accept("01"));
    assertTrue(zerosThenOnes.accept("0"));
    assertTrue(zerosThenOnes.accept(""));
    assertFalse(zerosThenOnes.accept("10"));
  }

  @Test
  public void testEpsilonClosureFollowsChains() {
    final var nfae = Fixtures.nfae("NFA1e.json");
    final var closure = nfae.epsilonClosure(OrderedSet.of(state("s")));
    assertEquals(OrderedSet.of(state("s"), state("m"), state("a"), state("b")), closure);
  }

  @Test
  public void testEpsilonClosureIsIdempotent() {
    for (String fixture : FIXTURES) {
      final var nfae = Fixtures.nfae(fixture);
      for (State state : nfae.states()) {
        final var once = nfae.epsilonClosure(OrderedSet.of(state));
        assertEquals(fixture + " from " + state, once, nfae.epsilonClosure(once));
      }
      final var all = nfae.epsilonClosure(nfae.states());
      assertEquals(fixture, nfae.states(), all);
    }
  }

  @Test
  public void testEpsilonClosureOfEmptySet() {
    final var nfae = Fixtures.nfae("NFA1e.json");
    assertTrue(nfae.epsilonClosure(new OrderedSet<>()).isEmpty());
  }

  @Test
  public void testEpsilonClosureLeavesArgumentUntouched() {
    final var nfae = Fixtures.nfae("NFA2e.json");
    final var states = OrderedSet.of(state("p"));
    assertEquals(OrderedSet.of(state("p"), state("r")), nfae.epsilonClosure(states));
    assertEquals(OrderedSet.of(state("p")), states);
  }

  @Test
  public void testEpsilonClosureTerminatesOnCycles() {
    final var p = state("p");
    final var q = state("q");
    final var epsilon = symbol("e");
    final var delta = new LinkedHashMap<Transition<State>, OrderedSet<State>>();
    delta.put(new Transition<>(epsilon, p), OrderedSet.of(q));
    delta.put(new Transition<>(epsilon, q), OrderedSet.of(p));
    delta.put(new Transition<>(symbol("x"), q), OrderedSet.of(q));
    final var fsm = new FiniteStateMachine(
      OrderedSet.of(p, q),
      OrderedSet.of(epsilon, symbol("x")),
      OrderedSet.of(p)
    );
    final var nfae = new NonDeterministicAutomatonWithEpsilon(OrderedSet.of(p), delta, fsm, epsilon);

    assertEquals(OrderedSet.of(p, q), nfae.epsilonClosure(OrderedSet.of(p)));
    assertTrue(nfae.accept("xxx"));

    final var dfa = nfae.toDfa();
    assertEquals(1, dfa.states().len());
    assertThat(dfa.alphabet(), contains(symbol("x")));
  }

  @Test
  public void testDefaultEpsilon() {
    final var nfae = Fixtures.nfae("NFA2e.json");
    assertEquals(NonDeterministicAutomatonWithEpsilon.DEFAULT_EPSILON, nfae.epsilon());
    assertEquals(symbol("ε"), nfae.epsilon());
  }

  @Test
  public void testToDfaDropsEpsilonFromAlphabet() {
    final var dfa = Fixtures.nfae("NFA1e.json").toDfa();
    assertThat(dfa.alphabet(), contains(symbol("0"), symbol("1")));
    assertThat(dfa.alphabet(), not(hasItem(symbol("ε"))));
  }

  @Test
  public void testToDfaStartsFromClosure() {
    final var dfa = Fixtures.nfae("NFA3e.json").toDfa();

    // {ones, zeros} is accepting straight away
    assertEquals(state("q_0"), dfa.start());
    assertTrue(dfa.ends().contains(dfa.start()));
    assertEquals(2, dfa.states().len());
  }

  @Test
  public void testToDfaPreservesLanguage() {
    for (String fixture : FIXTURES) {
      final var nfae = Fixtures.nfae(fixture);
      final var dfa = nfae.toDfa();
      final var minimal = dfa.minimize();
      for (List<Symbol> word : Words.upTo(dfa.alphabet(), 7)) {
        final boolean expected = nfae.accept(word);
        assertEquals(fixture + " on " + word, expected, dfa.accept(word));
        assertEquals(fixture + " minimized on " + word, expected, minimal.accept(word));
      }
    }
  }

  @Test
  public void testWordsContainingEpsilonAreRejected() {
    final var zerosThenOnes = Fixtures.nfae("NFA3e.json");
    assertFalse(zerosThenOnes.accept("ε"));
    assertFalse(zerosThenOnes.accept("0ε1"));
    assertFalse(zerosThenOnes.accept("01ε"));

    for (String fixture : FIXTURES) {
      final var nfae = Fixtures.nfae(fixture);
      assertThat(nfae.alphabet(), hasItem(nfae.epsilon()));

      final var dfa = nfae.toDfa();
      for (List<Symbol> word : Words.upTo(nfae.alphabet(), 5)) {
        assertEquals(fixture + " on " + word, nfae.accept(word), dfa.accept(word));
      }
    }
  }

  @Test
  public void testMinimizedSizes() {
    // ends in 0 or contains 11
    assertEquals(4, Fixtures.nfae("NFA1e.json").toDfa().minimize().states().len());
    // ends in 11
    assertEquals(3, Fixtures.nfae("NFA2e.json").toDfa().minimize().states().len());
    // 0*1*
    assertEquals(2, Fixtures.nfae("NFA3e.json").toDfa().minimize().states().len());
  }
}
