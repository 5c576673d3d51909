package fsa;

import fsa.util.OrderedSet;
import java.util.Objects;

/**
 * Static shape shared by every kind of automaton: its states, its alphabet and
 * its accepting ("end") states.
 *
 * <p>The sets are frozen copies of the constructor arguments, so a machine can
 * be shared freely between automata.
 */
public final class FiniteStateMachine {

  private final OrderedSet<State> states;

  private final OrderedSet<Symbol> alphabet;

  private final OrderedSet<State> ends;

  /**
   * @param states every state of the machine
   * @param alphabet every symbol the machine can read
   * @param ends accepting states, which must all be in {@code states}
   */
  public FiniteStateMachine(
    OrderedSet<State> states,
    OrderedSet<Symbol> alphabet,
    OrderedSet<State> ends
  ) {
    this.states = Objects.requireNonNull(states, "states is null").frozen();
    this.alphabet = Objects.requireNonNull(alphabet, "alphabet is null").frozen();
    this.ends = Objects.requireNonNull(ends, "ends is null").frozen();

    if (!this.ends.difference(this.states).isEmpty()) {
      throw new IllegalArgumentException(
        "end states " + this.ends.difference(this.states) + " are not states of the machine"
      );
    }
  }

  public OrderedSet<State> states() {
    return states;
  }

  public OrderedSet<Symbol> alphabet() {
    return alphabet;
  }

  public OrderedSet<State> ends() {
    return ends;
  }

  /**
   * Same states and alphabet, different accepting states.
   *
   * @param newEnds accepting states of the new machine
   */
  public FiniteStateMachine withEnds(OrderedSet<State> newEnds) {
    return new FiniteStateMachine(states, alphabet, newEnds);
  }

  @Override
  public int hashCode() {
    return Objects.hash(states, alphabet, ends);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof FiniteStateMachine)) {
      return false;
    } else {
      final var other = (FiniteStateMachine) obj;
      return states.equals(other.states)
        && alphabet.equals(other.alphabet)
        && ends.equals(other.ends);
    }
  }

  @Override
  public String toString() {
    return "FiniteStateMachine{states=" + states + ", alphabet=" + alphabet + ", ends=" + ends + "}";
  }
}
