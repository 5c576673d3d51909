package fsa;

import java.util.Comparator;
import java.util.Objects;

/**
 * Key of a transition table: an input symbol read from some content.
 *
 * <p>The content is a {@link State} in the transition tables of automata, and a
 * set of states when subset construction indexes the transitions of
 * superstates.
 *
 * @param symbol symbol being read
 * @param content what the symbol is read from
 * @param <T> type of the content
 */
public record Transition<T extends Comparable<? super T>>(
  Symbol symbol,
  T content
) implements Comparable<Transition<T>> {

  public Transition {
    Objects.requireNonNull(symbol, "symbol is null");
    Objects.requireNonNull(content, "content is null");
  }

  @Override
  public int compareTo(Transition<T> other) {
    return Comparator
      .comparing((Transition<T> t) -> t.symbol)
      .thenComparing((Transition<T> t) -> t.content)
      .compare(this, other);
  }

  @Override
  public String toString() {
    return "(" + symbol + ", " + content + ")";
  }
}
