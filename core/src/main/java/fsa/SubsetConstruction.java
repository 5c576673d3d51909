package fsa;

import fsa.util.OrderedSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Powerset construction shared by the non-deterministic automata.
 *
 * <p>Superstates (sets of states of the source automaton) are explored breadth
 * first from the initial superstate. Only superstates that are actually
 * reached become states of the resulting automaton, where they are named
 * {@code q_0}, {@code q_1}, ... in the order they were discovered.
 */
final class SubsetConstruction {

  private static final Logger logger = LoggerFactory.getLogger(SubsetConstruction.class);

  /**
   * Prefix of the names given to discovered superstates.
   */
  static final String STATE_PREFIX = "q_";

  private SubsetConstruction() {
  }

  /**
   * Build the deterministic automaton over reachable superstates.
   *
   * @param initial superstate where runs begin (already closed, if the source has a closure)
   * @param alphabet symbols to explore from every superstate
   * @param step image of a superstate on a symbol (empty if there is no transition)
   * @param ends accepting states of the source automaton
   * @return deterministic automaton recognizing the same language
   */
  static DeterministicAutomaton determinize(
    OrderedSet<State> initial,
    OrderedSet<Symbol> alphabet,
    BiFunction<OrderedSet<State>, Symbol, OrderedSet<State>> step,
    OrderedSet<State> ends
  ) {
    final OrderedSet<State> initialState = initial.frozen();

    // Transitions between superstates, in the order they were found
    final var superDelta = new LinkedHashMap<Transition<OrderedSet<State>>, OrderedSet<State>>();

    // Superstates in discovery order, mapped to their names
    final var concordance = new LinkedHashMap<OrderedSet<State>, State>();

    final var known = new OrderedSet<OrderedSet<State>>();
    var frontier = new OrderedSet<OrderedSet<State>>();
    known.insert(initialState);
    frontier.insert(initialState);
    name(concordance, initialState);

    int round = 0;
    while (!frontier.isEmpty()) {
      final var produced = new OrderedSet<OrderedSet<State>>();

      for (OrderedSet<State> superstate : frontier) {
        for (Symbol symbol : alphabet) {
          final OrderedSet<State> image = step.apply(superstate, symbol);

          // No transition on that symbol from any of the constituent states
          if (image.isEmpty()) {
            continue;
          }

          final OrderedSet<State> frozenImage = image.frozen();
          superDelta.put(new Transition<>(symbol, superstate), frozenImage);
          produced.insert(frozenImage);
        }
      }

      frontier = produced.difference(known);
      known.insertAll(frontier);
      for (OrderedSet<State> discovered : frontier) {
        name(concordance, discovered);
      }

      round++;
      logger.debug("subset construction round {}: {} new superstates, {} known", round, frontier.len(), known.len());
    }

    final var delta = new LinkedHashMap<Transition<State>, State>();
    for (var entry : superDelta.entrySet()) {
      final Transition<OrderedSet<State>> key = entry.getKey();
      delta.put(
        new Transition<>(key.symbol(), concordance.get(key.content())),
        concordance.get(entry.getValue())
      );
    }

    final var states = new OrderedSet<State>();
    final var newEnds = new OrderedSet<State>();
    for (Map.Entry<OrderedSet<State>, State> entry : concordance.entrySet()) {
      states.insert(entry.getValue());
      if (entry.getKey().intersects(ends)) {
        newEnds.insert(entry.getValue());
      }
    }

    final var fsm = new FiniteStateMachine(states, alphabet, newEnds);
    return new DeterministicAutomaton(concordance.get(initialState), delta, fsm);
  }

  private static void name(Map<OrderedSet<State>, State> concordance, OrderedSet<State> superstate) {
    concordance.put(superstate, new State(STATE_PREFIX + concordance.size()));
  }
}
