package fsa;

import fsa.util.OrderedSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Finite automaton recognizing words over its alphabet.
 *
 * @param <S> how the automaton starts (one state, or a set of states)
 * @param <V> images of the transition table (one state, or a set of states)
 */
public interface Automaton<S, V> {

  /**
   * States, alphabet and accepting states.
   *
   * @return static shape of the automaton
   */
  FiniteStateMachine fsm();

  /**
   * Where runs begin.
   *
   * @return start state, or set of start states
   */
  S start();

  /**
   * Transition table.
   *
   * <p>Pairs without an entry have no transition: a run reading that symbol
   * from that state gets stuck.
   *
   * @return unmodifiable mapping from (symbol, source state) to image
   */
  Map<Transition<State>, V> delta();

  default OrderedSet<State> states() {
    return fsm().states();
  }

  default OrderedSet<Symbol> alphabet() {
    return fsm().alphabet();
  }

  default OrderedSet<State> ends() {
    return fsm().ends();
  }

  /**
   * Check whether a word is in the language of the automaton.
   *
   * @param word sequence of symbols
   * @return whether the automaton accepts the word
   */
  boolean accept(Iterable<Symbol> word);

  /**
   * Check whether a word is in the language of the automaton, reading one
   * symbol per Unicode code point.
   *
   * @param word input word
   * @return whether the automaton accepts the word
   */
  default boolean accept(String word) {
    return accept(symbols(word));
  }

  /**
   * Equivalent deterministic automaton.
   *
   * @return new automaton recognizing the same language
   */
  DeterministicAutomaton toDfa();

  /**
   * Split a word into one symbol per code point.
   *
   * @param word input word
   * @return symbols of the word, in order
   */
  static List<Symbol> symbols(String word) {
    final var symbols = new ArrayList<Symbol>(word.length());
    word.codePoints().forEach(codePoint -> symbols.add(Symbol.ofCodePoint(codePoint)));
    return symbols;
  }
}
