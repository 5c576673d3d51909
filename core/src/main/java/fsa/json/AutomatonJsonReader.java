package fsa.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fsa.Automaton;
import fsa.DeterministicAutomaton;
import fsa.FiniteStateMachine;
import fsa.NonDeterministicAutomaton;
import fsa.NonDeterministicAutomatonWithEpsilon;
import fsa.State;
import fsa.Symbol;
import fsa.Transition;
import fsa.util.OrderedSet;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads automata from JSON documents.
 *
 * <p>A deterministic automaton looks like
 *
 * <pre>{@code
 * {
 *   "states" : ["q_0", "q_1"],
 *   "alphabet" : ["a", "b"],
 *   "ends" : ["q_0"],
 *   "start" : "q_0",
 *   "delta" : [
 *     { "state" : "q_0", "symbol" : "a", "image" : "q_1" },
 *     { "state" : "q_1", "symbol" : "b", "image" : "q_0" }
 *   ]
 * }
 * }</pre>
 *
 * <p>Non-deterministic automata have a list of {@code starts} instead of a
 * {@code start}, and each transition has a non-empty list of {@code images}.
 * Those with epsilon transitions may name their epsilon symbol in an
 * {@code epsilon} field (it defaults to {@code "ε"}).
 *
 * <p>The {@code states} and {@code alphabet} lists are optional: every state and
 * symbol mentioned elsewhere in the document is added to them.
 */
public final class AutomatonJsonReader {

  private static final Logger logger = LoggerFactory.getLogger(AutomatonJsonReader.class);

  private static final ObjectMapper mapper = new ObjectMapper();

  private AutomatonJsonReader() {
  }

  /**
   * Parse JSON text.
   *
   * @param json text of the document
   * @return document tree
   */
  public static JsonNode parse(String json) {
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new AutomatonFormatException("$", "invalid JSON: " + e.getOriginalMessage(), e);
    }
  }

  /**
   * Read and parse a JSON file.
   *
   * @param path location of the file
   * @return document tree
   */
  public static JsonNode readTree(Path path) throws IOException {
    final String content = Files.readString(path);
    logger.debug("loading automaton from {}", path);
    return parse(content);
  }

  /**
   * Decide which kind of automaton a document describes.
   *
   * @param json document tree
   * @return kind of the automaton
   */
  public static AutomatonKind detectKind(JsonNode json) {
    requireObject(json);
    if (json.has("start")) {
      return AutomatonKind.DETERMINISTIC;
    }
    if (!json.has("starts")) {
      throw new AutomatonFormatException("$", "missing both 'start' and 'starts'");
    }
    if (json.has("epsilon")) {
      return AutomatonKind.NON_DETERMINISTIC_WITH_EPSILON;
    }

    final String epsilon = NonDeterministicAutomatonWithEpsilon.DEFAULT_EPSILON.value();
    for (JsonNode symbol : json.path("alphabet")) {
      if (epsilon.equals(symbol.asText())) {
        return AutomatonKind.NON_DETERMINISTIC_WITH_EPSILON;
      }
    }
    for (JsonNode transition : json.path("delta")) {
      if (epsilon.equals(transition.path("symbol").asText())) {
        return AutomatonKind.NON_DETERMINISTIC_WITH_EPSILON;
      }
    }
    return AutomatonKind.NON_DETERMINISTIC;
  }

  /**
   * Read an automaton of whichever kind the document describes.
   *
   * @param json document tree
   * @return the automaton
   */
  public static Automaton<?, ?> read(JsonNode json) {
    switch (detectKind(json)) {
      case DETERMINISTIC:
        return readDeterministic(json);
      case NON_DETERMINISTIC:
        return readNonDeterministic(json);
      case NON_DETERMINISTIC_WITH_EPSILON:
        return readNonDeterministicWithEpsilon(json);
      default:
        throw new IllegalStateException("unknown automaton kind");
    }
  }

  public static Automaton<?, ?> read(Path path) throws IOException {
    return read(readTree(path));
  }

  /**
   * Read just the states, alphabet, and accepting states of a document.
   *
   * <p>Unlike the automaton readers, this only looks at the {@code states},
   * {@code alphabet} and {@code ends} fields (accepting states are added to the
   * states).
   *
   * @param json document tree
   * @return finite state machine
   */
  public static FiniteStateMachine readFiniteStateMachine(JsonNode json) {
    requireObject(json);
    final var states = OrderedSet.fromSequence(stateList(json, "states"));
    final var alphabet = OrderedSet.fromSequence(symbolList(json, "alphabet"));
    final var ends = OrderedSet.fromSequence(stateList(json, "ends"));
    states.insertAll(ends);
    return new FiniteStateMachine(states, alphabet, ends);
  }

  public static FiniteStateMachine readFiniteStateMachine(Path path) throws IOException {
    return readFiniteStateMachine(readTree(path));
  }

  /**
   * Read a deterministic automaton.
   *
   * @param json document tree
   * @return deterministic automaton
   */
  public static DeterministicAutomaton readDeterministic(JsonNode json) {
    final var shape = new Shape(json);
    final State start = new State(requiredText(json, "start", "start"));
    shape.states.insert(start);

    final var delta = new LinkedHashMap<Transition<State>, State>();
    final JsonNode transitions = requiredArray(json, "delta", "delta");
    for (int i = 0; i < transitions.size(); i++) {
      final String field = "delta[" + i + "]";
      final JsonNode transitionJson = transitions.get(i);
      final Transition<State> transition = shape.transition(transitionJson, field);
      final State image = new State(requiredText(transitionJson, "image", field + ".image"));
      shape.states.insert(image);

      final State previous = delta.put(transition, image);
      if (previous != null && !previous.equals(image)) {
        throw new AutomatonFormatException(field, "transition " + transition + " leads to both " + previous + " and " + image);
      }
    }

    return new DeterministicAutomaton(start, delta, shape.fsm());
  }

  public static DeterministicAutomaton readDeterministic(Path path) throws IOException {
    return readDeterministic(readTree(path));
  }

  /**
   * Read a non-deterministic automaton without epsilon transitions.
   *
   * @param json document tree
   * @return non-deterministic automaton
   */
  public static NonDeterministicAutomaton readNonDeterministic(JsonNode json) {
    final var shape = new Shape(json);
    final var starts = shape.starts();
    final var delta = shape.nonDeterministicDelta();
    return new NonDeterministicAutomaton(starts, delta, shape.fsm());
  }

  public static NonDeterministicAutomaton readNonDeterministic(Path path) throws IOException {
    return readNonDeterministic(readTree(path));
  }

  /**
   * Read a non-deterministic automaton with epsilon transitions.
   *
   * @param json document tree
   * @return non-deterministic automaton with epsilon transitions
   */
  public static NonDeterministicAutomatonWithEpsilon readNonDeterministicWithEpsilon(JsonNode json) {
    final var shape = new Shape(json);
    final Symbol epsilon = json.has("epsilon")
      ? new Symbol(requiredText(json, "epsilon", "epsilon"))
      : NonDeterministicAutomatonWithEpsilon.DEFAULT_EPSILON;
    final var starts = shape.starts();
    final var delta = shape.nonDeterministicDelta();
    return new NonDeterministicAutomatonWithEpsilon(starts, delta, shape.fsm(), epsilon);
  }

  public static NonDeterministicAutomatonWithEpsilon readNonDeterministicWithEpsilon(Path path) throws IOException {
    return readNonDeterministicWithEpsilon(readTree(path));
  }

  /**
   * States, alphabet and accepting states accumulated while reading the rest
   * of a document.
   */
  private static final class Shape {

    final JsonNode json;
    final OrderedSet<State> states;
    final OrderedSet<Symbol> alphabet;
    final OrderedSet<State> ends;

    Shape(JsonNode json) {
      requireObject(json);
      this.json = json;
      this.states = new OrderedSet<>();
      this.alphabet = new OrderedSet<>();
      if (json.has("states")) {
        states.insertAll(OrderedSet.fromSequence(stateList(json, "states")));
      }
      if (json.has("alphabet")) {
        alphabet.insertAll(OrderedSet.fromSequence(symbolList(json, "alphabet")));
      }
      this.ends = OrderedSet.fromSequence(stateList(json, "ends"));
      states.insertAll(ends);
    }

    OrderedSet<State> starts() {
      final var starts = OrderedSet.fromSequence(stateList(json, "starts"));
      states.insertAll(starts);
      return starts;
    }

    Transition<State> transition(JsonNode transitionJson, String field) {
      requireObject(transitionJson, field);
      final State state = new State(requiredText(transitionJson, "state", field + ".state"));
      final Symbol symbol = new Symbol(requiredText(transitionJson, "symbol", field + ".symbol"));
      states.insert(state);
      alphabet.insert(symbol);
      return new Transition<>(symbol, state);
    }

    Map<Transition<State>, OrderedSet<State>> nonDeterministicDelta() {
      final var delta = new LinkedHashMap<Transition<State>, OrderedSet<State>>();
      final JsonNode transitions = requiredArray(json, "delta", "delta");
      for (int i = 0; i < transitions.size(); i++) {
        final String field = "delta[" + i + "]";
        final JsonNode transitionJson = transitions.get(i);
        final Transition<State> transition = transition(transitionJson, field);

        final List<State> images = stateList(transitionJson, "images", field + ".images");
        if (images.isEmpty()) {
          throw new AutomatonFormatException(field + ".images", "a transition needs at least one image");
        }
        final var imageSet = delta.computeIfAbsent(transition, k -> new OrderedSet<>());
        for (State image : images) {
          imageSet.insert(image);
          states.insert(image);
        }
      }
      return delta;
    }

    FiniteStateMachine fsm() {
      return new FiniteStateMachine(states, alphabet, ends);
    }
  }

  private static void requireObject(JsonNode json) {
    requireObject(json, "$");
  }

  private static void requireObject(JsonNode json, String field) {
    if (json == null || !json.isObject()) {
      throw new AutomatonFormatException(field, "expected a JSON object");
    }
  }

  private static String requiredText(JsonNode json, String name, String field) {
    final JsonNode value = json.get(name);
    if (value == null) {
      throw new AutomatonFormatException(field, "missing field");
    } else if (!value.isTextual()) {
      throw new AutomatonFormatException(field, "expected a string but found " + value.getNodeType());
    }
    return value.textValue();
  }

  private static JsonNode requiredArray(JsonNode json, String name, String field) {
    final JsonNode value = json.get(name);
    if (value == null) {
      throw new AutomatonFormatException(field, "missing field");
    } else if (!value.isArray()) {
      throw new AutomatonFormatException(field, "expected an array but found " + value.getNodeType());
    }
    return value;
  }

  private static List<String> textList(JsonNode json, String name, String field) {
    final JsonNode array = requiredArray(json, name, field);
    final var values = new ArrayList<String>(array.size());
    for (int i = 0; i < array.size(); i++) {
      final JsonNode value = array.get(i);
      if (!value.isTextual()) {
        throw new AutomatonFormatException(field + "[" + i + "]", "expected a string but found " + value.getNodeType());
      }
      values.add(value.textValue());
    }
    return values;
  }

  private static List<State> stateList(JsonNode json, String name) {
    return stateList(json, name, name);
  }

  private static List<State> stateList(JsonNode json, String name, String field) {
    final var states = new ArrayList<State>();
    for (String stateName : textList(json, name, field)) {
      states.add(new State(stateName));
    }
    return states;
  }

  private static List<Symbol> symbolList(JsonNode json, String name) {
    final var symbols = new ArrayList<Symbol>();
    for (String value : textList(json, name, name)) {
      symbols.add(new Symbol(value));
    }
    return symbols;
  }
}
