package fsa;

import fsa.util.OrderedSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Non-deterministic finite automaton without epsilon transitions.
 *
 * <p>Every transition leads to a non-empty set of states. A missing entry in the
 * transition table means there is no transition at all.
 */
public final class NonDeterministicAutomaton implements Automaton<OrderedSet<State>, OrderedSet<State>> {

  private final OrderedSet<State> starts;

  private final Map<Transition<State>, OrderedSet<State>> delta;

  private final FiniteStateMachine fsm;

  /**
   * @param starts initial states
   * @param delta transition table, copied; every image must be non-empty
   * @param fsm states, alphabet and accepting states
   */
  public NonDeterministicAutomaton(
    OrderedSet<State> starts,
    Map<Transition<State>, OrderedSet<State>> delta,
    FiniteStateMachine fsm
  ) {
    this.starts = Objects.requireNonNull(starts, "starts is null").frozen();
    this.delta = TransitionTables.copyNonDeterministic(Objects.requireNonNull(delta, "delta is null"));
    this.fsm = Objects.requireNonNull(fsm, "fsm is null");

    for (State start : this.starts) {
      TransitionTables.checkStart(fsm, start);
    }
    TransitionTables.checkTable(fsm, this.delta, images -> images);
  }

  @Override
  public FiniteStateMachine fsm() {
    return fsm;
  }

  /**
   * Initial states.
   *
   * @return frozen set of start states
   */
  @Override
  public OrderedSet<State> start() {
    return starts;
  }

  /**
   * Alias of {@link #start()}.
   *
   * @return frozen set of start states
   */
  public OrderedSet<State> starts() {
    return starts;
  }

  @Override
  public Map<Transition<State>, OrderedSet<State>> delta() {
    return delta;
  }

  /**
   * Apply the transition function to a single state.
   *
   * @param transition symbol and the state it is read from
   * @return states reached, if there is a transition
   */
  public Optional<OrderedSet<State>> image(Transition<State> transition) {
    return Optional.ofNullable(delta.get(transition));
  }

  /**
   * States reached by reading a symbol from any state of a set.
   *
   * @param states states the symbol is read from
   * @param symbol symbol to read
   * @return union of the images, empty if none of the states has a transition
   */
  public OrderedSet<State> image(OrderedSet<State> states, Symbol symbol) {
    return step(delta, states, symbol);
  }

  @Override
  public boolean accept(Iterable<Symbol> word) {
    OrderedSet<State> currentStates = starts;

    for (Symbol symbol : word) {
      currentStates = image(currentStates, symbol);

      // Every run is stuck
      if (currentStates.isEmpty()) {
        return false;
      }
    }

    return currentStates.intersects(fsm.ends());
  }

  /**
   * Determinize the automaton by subset construction.
   *
   * @return deterministic automaton over the reachable sets of states
   */
  @Override
  public DeterministicAutomaton toDfa() {
    return SubsetConstruction.determinize(starts, fsm.alphabet(), this::image, fsm.ends());
  }

  /**
   * Union of the images of some states on a symbol.
   *
   * <p>States without a transition on the symbol contribute nothing.
   */
  static OrderedSet<State> step(
    Map<Transition<State>, OrderedSet<State>> delta,
    OrderedSet<State> states,
    Symbol symbol
  ) {
    final var images = new OrderedSet<State>();
    for (State state : states) {
      final OrderedSet<State> image = delta.get(new Transition<>(symbol, state));
      if (image != null) {
        images.insertAll(image);
      }
    }
    return images;
  }

  @Override
  public int hashCode() {
    return Objects.hash(starts, delta, fsm);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof NonDeterministicAutomaton)) {
      return false;
    } else {
      final var other = (NonDeterministicAutomaton) obj;
      return starts.equals(other.starts) && delta.equals(other.delta) && fsm.equals(other.fsm);
    }
  }

  @Override
  public String toString() {
    return "NonDeterministicAutomaton{starts=" + starts + ", delta=" + delta + ", fsm=" + fsm + "}";
  }
}
