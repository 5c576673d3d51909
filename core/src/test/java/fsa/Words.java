package fsa;

import fsa.util.OrderedSet;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates every word over an alphabet, up to some length.
 */
public final class Words {

  private Words() {
  }

  /**
   * @param alphabet symbols words are made of
   * @param maxLength longest word to produce
   * @return all words, shortest first (the empty word included)
   */
  public static List<List<Symbol>> upTo(OrderedSet<Symbol> alphabet, int maxLength) {
    final var words = new ArrayList<List<Symbol>>();
    var previousLength = List.<List<Symbol>>of(List.of());
    words.addAll(previousLength);

    for (int length = 1; length <= maxLength; length++) {
      final var nextLength = new ArrayList<List<Symbol>>();
      for (List<Symbol> prefix : previousLength) {
        for (Symbol symbol : alphabet) {
          final var word = new ArrayList<Symbol>(prefix);
          word.add(symbol);
          nextLength.add(word);
        }
      }
      words.addAll(nextLength);
      previousLength = nextLength;
    }

    return words;
  }
}
