package fsa;

import fsa.util.OrderedSet;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Helpers for validating and copying the transition tables handed to automata.
 */
final class TransitionTables {

  private TransitionTables() {
  }

  /**
   * Check that a start state belongs to the machine.
   *
   * @param fsm machine the state should belong to
   * @param start state to check
   */
  static void checkStart(FiniteStateMachine fsm, State start) {
    if (!fsm.states().contains(start)) {
      throw new IllegalArgumentException("start state " + start + " is not a state of the machine");
    }
  }

  /**
   * Check that every state and symbol mentioned in a table belongs to the machine.
   *
   * @param fsm machine the table belongs to
   * @param delta transition table
   * @param imageStates states appearing in an image
   */
  static <V> void checkTable(
    FiniteStateMachine fsm,
    Map<Transition<State>, V> delta,
    Function<V, Iterable<State>> imageStates
  ) {
    for (var entry : delta.entrySet()) {
      final Transition<State> key = entry.getKey();
      if (!fsm.alphabet().contains(key.symbol())) {
        throw new IllegalArgumentException("transition " + key + " reads a symbol outside of the alphabet");
      }
      if (!fsm.states().contains(key.content())) {
        throw new IllegalArgumentException("transition " + key + " leaves from an unknown state");
      }
      for (State image : imageStates.apply(entry.getValue())) {
        if (!fsm.states().contains(image)) {
          throw new IllegalArgumentException("transition " + key + " leads to unknown state " + image);
        }
      }
    }
  }

  /**
   * Unmodifiable copy of a deterministic table.
   */
  static Map<Transition<State>, State> copyDeterministic(Map<Transition<State>, State> delta) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(delta));
  }

  /**
   * Unmodifiable copy of a non-deterministic table, with frozen image sets.
   *
   * @param delta table to copy
   * @return copy sharing no mutable state with {@code delta}
   */
  static Map<Transition<State>, OrderedSet<State>> copyNonDeterministic(
    Map<Transition<State>, OrderedSet<State>> delta
  ) {
    final var copy = new LinkedHashMap<Transition<State>, OrderedSet<State>>();
    for (var entry : delta.entrySet()) {
      if (entry.getValue().isEmpty()) {
        throw new IllegalArgumentException("transition " + entry.getKey() + " has an empty image");
      }
      copy.put(entry.getKey(), entry.getValue().frozen());
    }
    return Collections.unmodifiableMap(copy);
  }
}
