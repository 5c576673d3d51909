package fsa;

import fsa.util.OrderedSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic finite automaton.
 *
 * <p>The transition function may be partial: reading a symbol for which the
 * current state has no transition rejects the word.
 */
public final class DeterministicAutomaton implements Automaton<State, State> {

  private static final Logger logger = LoggerFactory.getLogger(DeterministicAutomaton.class);

  private final State start;

  private final Map<Transition<State>, State> delta;

  private final FiniteStateMachine fsm;

  /**
   * @param start initial state
   * @param delta transition table, copied
   * @param fsm states, alphabet and accepting states
   */
  public DeterministicAutomaton(
    State start,
    Map<Transition<State>, State> delta,
    FiniteStateMachine fsm
  ) {
    this.start = Objects.requireNonNull(start, "start is null");
    this.delta = TransitionTables.copyDeterministic(Objects.requireNonNull(delta, "delta is null"));
    this.fsm = Objects.requireNonNull(fsm, "fsm is null");

    TransitionTables.checkStart(fsm, start);
    TransitionTables.checkTable(fsm, this.delta, state -> List.of(state));
  }

  @Override
  public FiniteStateMachine fsm() {
    return fsm;
  }

  @Override
  public State start() {
    return start;
  }

  @Override
  public Map<Transition<State>, State> delta() {
    return delta;
  }

  /**
   * Apply the transition function.
   *
   * @param transition symbol and the state it is read from
   * @return the next state, if there is a transition
   */
  public Optional<State> image(Transition<State> transition) {
    return Optional.ofNullable(delta.get(transition));
  }

  @Override
  public boolean accept(Iterable<Symbol> word) {
    State currentState = start;

    for (Symbol symbol : word) {
      final State next = delta.get(new Transition<>(symbol, currentState));

      // Stuck: no way to read the rest of the word
      if (next == null) {
        return false;
      }
      currentState = next;
    }

    return fsm.ends().contains(currentState);
  }

  /**
   * Reverse every transition, and swap the start and accepting states.
   *
   * <p>The result recognizes the mirror image of this automaton's language. It
   * is usually not deterministic, since several transitions may point into
   * the same state on the same symbol.
   *
   * @return transposed automaton
   */
  public NonDeterministicAutomaton transpose() {
    final var reversed = new LinkedHashMap<Transition<State>, OrderedSet<State>>();
    for (var entry : delta.entrySet()) {
      final Transition<State> forward = entry.getKey();
      reversed
        .computeIfAbsent(new Transition<>(forward.symbol(), entry.getValue()), k -> new OrderedSet<>())
        .insert(forward.content());
    }

    final FiniteStateMachine transposedFsm = fsm.withEnds(OrderedSet.of(start));
    return new NonDeterministicAutomaton(fsm.ends(), reversed, transposedFsm);
  }

  /**
   * Minimal automaton recognizing the same language (Brzozowski's algorithm).
   *
   * <p>Transposing then determinizing keeps only the states reachable in the
   * mirror automaton. Doing it twice therefore prunes states which are not
   * reachable or cannot reach an accepting state, and the second subset
   * construction merges every pair of equivalent states.
   *
   * @return minimal deterministic automaton
   */
  public DeterministicAutomaton minimize() {
    DeterministicAutomaton current = this;
    for (int round = 0; round < 2; round++) {
      current = current.transpose().toDfa();
    }
    logger.debug("minimized automaton from {} to {} states", fsm.states().len(), current.states().len());
    return current;
  }

  /**
   * Already deterministic.
   *
   * @return an equal copy of this automaton
   */
  @Override
  public DeterministicAutomaton toDfa() {
    return new DeterministicAutomaton(start, delta, fsm);
  }

  @Override
  public int hashCode() {
    return Objects.hash(start, delta, fsm);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof DeterministicAutomaton)) {
      return false;
    } else {
      final var other = (DeterministicAutomaton) obj;
      return start.equals(other.start) && delta.equals(other.delta) && fsm.equals(other.fsm);
    }
  }

  @Override
  public String toString() {
    return "DeterministicAutomaton{start=" + start + ", delta=" + delta + ", fsm=" + fsm + "}";
  }
}
