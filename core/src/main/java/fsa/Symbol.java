package fsa;

import java.util.Objects;

/**
 * Input symbol of an automaton.
 *
 * <p>Usually a single character, but nothing prevents a symbol from being a
 * longer token.
 *
 * @param value text of the symbol
 */
public record Symbol(String value) implements Comparable<Symbol> {

  public Symbol {
    Objects.requireNonNull(value, "value is null");
  }

  /**
   * Symbol for a single Unicode code point.
   *
   * @param codePoint code point read from an input word
   * @return symbol whose value is that code point
   */
  public static Symbol ofCodePoint(int codePoint) {
    return new Symbol(Character.toString(codePoint));
  }

  @Override
  public int compareTo(Symbol other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
