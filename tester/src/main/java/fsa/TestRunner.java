package fsa;

import fsa.json.AutomatonJsonReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Charged with running test cases.
 *
 * <p>Every word is checked against the automaton as loaded, against its
 * determinization, and against the minimized determinization. All three must
 * agree with the expected output.
 */
public class TestRunner implements Consumer<TestCase> {

  /**
   * How are test outcomes reported?
   */
  final TestReporter reporter;

  /**
   * Automata already loaded, along with their derived forms.
   */
  private final Map<Path, Map<String, Automaton<?, ?>>> loaded = new HashMap<>();

  public TestRunner(TestReporter reporter) {
    this.reporter = reporter;
  }

  /**
   * Accept a new test case.
   *
   * @param testCase test to run
   */
  public void accept(TestCase testCase) {

    // Load the automaton
    final Map<String, Automaton<?, ?>> forms;
    try {
      forms = loaded.computeIfAbsent(testCase.automaton, TestRunner::load);
    } catch (Exception error) {
      if (testCase.expectsError()) {
        reporter.onSuccess(testCase, true);
      } else {
        reporter.onAutomatonError(testCase, error);
      }
      return;
    }

    // Compare the outputs of every form
    for (var form : forms.entrySet()) {
      final String foundOutput = Boolean.toString(form.getValue().accept(testCase.input));
      if (!testCase.output.equals(foundOutput)) {
        reporter.onUnexpectedOutput(testCase, form.getKey(), foundOutput);
        return;
      }
    }
    reporter.onSuccess(testCase, false);
  }

  private static Map<String, Automaton<?, ?>> load(Path path) {
    final Automaton<?, ?> automaton;
    try {
      automaton = AutomatonJsonReader.read(path);
    } catch (IOException err) {
      throw new UncheckedIOException(err);
    }

    final DeterministicAutomaton determinized = automaton.toDfa();
    final var forms = new LinkedHashMap<String, Automaton<?, ?>>();
    forms.put("loaded", automaton);
    forms.put("determinized", determinized);
    forms.put("minimized", determinized.minimize());
    return forms;
  }
}
