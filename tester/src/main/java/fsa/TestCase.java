package fsa;

import java.nio.file.Path;

/**
 * Test case in a test file.
 *
 * @param automaton JSON file describing the automaton under test
 * @param input word to feed to the automaton
 * @param output expected output ({@code true}, {@code false}, or {@code error...})
 */
public class TestCase {

  /**
   * JSON file describing the automaton (already resolved against the test file).
   */
  public final Path automaton;

  /**
   * Word to feed to the automaton.
   */
  public final String input;

  /**
   * Expected output.
   */
  public final String output;

  /**
   * Source file from which the test originated.
   */
  public final String filePath;

  /**
   * Line in the source file from which the test originated.
   */
  public final int lineNumber;

  public TestCase(
    Path automaton,
    String input,
    String output,
    String filePath,
    int lineNumber
  ) {
    this.automaton = automaton;
    this.input = input;
    this.output = output;
    this.filePath = filePath;
    this.lineNumber = lineNumber;
  }

  /**
   * Whether the test expects the automaton to fail to load.
   */
  public boolean expectsError() {
    return output.startsWith("error");
  }

  /**
   * Render the test and its source location in a human readable fashion.
   */
  public String getSummary() {
    return automaton.getFileName() + " on \"" + input + "\" (at " + filePath + ":" + lineNumber + ")";
  }
}
