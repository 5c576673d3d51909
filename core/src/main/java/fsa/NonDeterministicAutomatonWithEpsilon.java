package fsa;

import fsa.util.OrderedSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Non-deterministic finite automaton with epsilon transitions.
 *
 * <p>Transitions on the epsilon symbol are taken without reading any input. Runs
 * therefore always continue from the epsilon-closure of the states they reach.
 */
public final class NonDeterministicAutomatonWithEpsilon
  implements Automaton<OrderedSet<State>, OrderedSet<State>> {

  /**
   * Epsilon symbol used when none is specified.
   */
  public static final Symbol DEFAULT_EPSILON = new Symbol("ε");

  private final OrderedSet<State> starts;

  private final Map<Transition<State>, OrderedSet<State>> delta;

  private final FiniteStateMachine fsm;

  private final Symbol epsilon;

  /**
   * Automaton using {@link #DEFAULT_EPSILON} for its epsilon transitions.
   *
   * @param starts initial states
   * @param delta transition table, copied; every image must be non-empty
   * @param fsm states, alphabet and accepting states
   */
  public NonDeterministicAutomatonWithEpsilon(
    OrderedSet<State> starts,
    Map<Transition<State>, OrderedSet<State>> delta,
    FiniteStateMachine fsm
  ) {
    this(starts, delta, fsm, DEFAULT_EPSILON);
  }

  /**
   * @param starts initial states
   * @param delta transition table, copied; every image must be non-empty
   * @param fsm states, alphabet and accepting states
   * @param epsilon symbol of the transitions which read no input
   */
  public NonDeterministicAutomatonWithEpsilon(
    OrderedSet<State> starts,
    Map<Transition<State>, OrderedSet<State>> delta,
    FiniteStateMachine fsm,
    Symbol epsilon
  ) {
    this.starts = Objects.requireNonNull(starts, "starts is null").frozen();
    this.delta = TransitionTables.copyNonDeterministic(Objects.requireNonNull(delta, "delta is null"));
    this.fsm = Objects.requireNonNull(fsm, "fsm is null");
    this.epsilon = Objects.requireNonNull(epsilon, "epsilon is null");

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
   * Initial states, before taking any epsilon transition.
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

  public Symbol epsilon() {
    return epsilon;
  }

  /**
   * Apply the transition function to a single state, without any closure.
   *
   * @param transition symbol and the state it is read from
   * @return states reached, if there is a transition
   */
  public Optional<OrderedSet<State>> image(Transition<State> transition) {
    return Optional.ofNullable(delta.get(transition));
  }

  /**
   * States reached by reading a symbol from any state of a set, followed by
   * any number of epsilon transitions.
   *
   * @param states states the symbol is read from
   * @param symbol symbol to read
   * @return epsilon-closure of the union of the images
   */
  public OrderedSet<State> image(OrderedSet<State> states, Symbol symbol) {
    return epsilonClosure(NonDeterministicAutomaton.step(delta, states, symbol));
  }

  /**
   * States reachable from a set of states using only epsilon transitions.
   *
   * <p>The closure is the least fixed point containing {@code states}: new
   * epsilon images are added until a pass discovers nothing new.
   *
   * @param states states to start from, left unmodified
   * @return new set containing {@code states} and everything reachable from them
   */
  public OrderedSet<State> epsilonClosure(OrderedSet<State> states) {
    final OrderedSet<State> closure = states.copy();
    OrderedSet<State> added = closure.copy();

    while (!added.isEmpty()) {
      added = NonDeterministicAutomaton.step(delta, added, epsilon).difference(closure);
      closure.insertAll(added);
    }

    return closure;
  }

  @Override
  public boolean accept(Iterable<Symbol> word) {
    OrderedSet<State> currentStates = epsilonClosure(starts);

    for (Symbol symbol : word) {

      // Epsilon is never read from the input
      if (symbol.equals(epsilon)) {
        return false;
      }
      currentStates = image(currentStates, symbol);
    }

    return currentStates.intersects(fsm.ends());
  }

  /**
   * Determinize the automaton by subset construction over epsilon-closed sets
   * of states.
   *
   * <p>The epsilon symbol is not part of the resulting automaton's alphabet.
   *
   * @return deterministic automaton over the reachable closed sets of states
   */
  @Override
  public DeterministicAutomaton toDfa() {
    final OrderedSet<Symbol> inputs = fsm.alphabet().difference(OrderedSet.of(epsilon));
    return SubsetConstruction.determinize(epsilonClosure(starts), inputs, this::image, fsm.ends());
  }

  @Override
  public int hashCode() {
    return Objects.hash(starts, delta, fsm, epsilon);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof NonDeterministicAutomatonWithEpsilon)) {
      return false;
    } else {
      final var other = (NonDeterministicAutomatonWithEpsilon) obj;
      return starts.equals(other.starts)
        && delta.equals(other.delta)
        && fsm.equals(other.fsm)
        && epsilon.equals(other.epsilon);
    }
  }

  @Override
  public String toString() {
    return "NonDeterministicAutomatonWithEpsilon{starts=" + starts + ", delta=" + delta
      + ", fsm=" + fsm + ", epsilon=" + epsilon + "}";
  }
}
