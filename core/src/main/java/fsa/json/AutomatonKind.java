package fsa.json;

/**
 * Kinds of automata that can be described in JSON.
 */
public enum AutomatonKind {

  /**
   * Single {@code start} state, transitions with one {@code image}.
   */
  DETERMINISTIC,

  /**
   * Set of {@code starts}, transitions with a list of {@code images}.
   */
  NON_DETERMINISTIC,

  /**
   * Like {@link #NON_DETERMINISTIC}, with some transitions on the epsilon symbol.
   */
  NON_DETERMINISTIC_WITH_EPSILON;
}
