package fsa;

import com.fasterxml.jackson.databind.JsonNode;
import fsa.json.AutomatonJsonReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Automata stored under {@code src/test/resources/automata}.
 */
public final class Fixtures {

  private Fixtures() {
  }

  public static JsonNode json(String name) {
    try (InputStream in = Fixtures.class.getResourceAsStream("/automata/" + name)) {
      if (in == null) {
        throw new IllegalArgumentException("no fixture named " + name);
      }
      return AutomatonJsonReader.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static DeterministicAutomaton dfa(String name) {
    return AutomatonJsonReader.readDeterministic(json(name));
  }

  public static NonDeterministicAutomaton nfa(String name) {
    return AutomatonJsonReader.readNonDeterministic(json(name));
  }

  public static NonDeterministicAutomatonWithEpsilon nfae(String name) {
    return AutomatonJsonReader.readNonDeterministicWithEpsilon(json(name));
  }

  public static State state(String name) {
    return new State(name);
  }

  public static Symbol symbol(String value) {
    return new Symbol(value);
  }
}
