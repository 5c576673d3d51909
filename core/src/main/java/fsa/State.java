package fsa;

import java.util.Objects;

/**
 * Named state of an automaton.
 *
 * @param name name of the state, which is also its identity
 */
public record State(String name) implements Comparable<State> {

  public State {
    Objects.requireNonNull(name, "name is null");
  }

  @Override
  public int compareTo(State other) {
    return name.compareTo(other.name);
  }

  @Override
  public String toString() {
    return name;
  }
}
