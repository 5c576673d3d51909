package fsa;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads test cases as triples of lines: automaton file, input word, expected output.
 *
 * <p>Skips over comment lines, processes escape sequences. Automaton files are
 * relative to the directory of the test file, and {@code ""} stands for the
 * empty word.
 */
public class TestFileReader implements Closeable {

  private static final Pattern UNICODE_ESCAPES = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

  /**
   * Line standing for the empty input word.
   */
  static final String EMPTY_WORD = "\"\"";

  private final BufferedReader reader;

  private final String filePath;

  private final Path directory;

  private int lineNumber = 0;

  public TestFileReader(String filePath) throws IOException {
    this.reader = Files.newBufferedReader(Path.of(filePath), StandardCharsets.UTF_8);
    this.filePath = filePath;
    final Path parent = Path.of(filePath).toAbsolutePath().getParent();
    this.directory = parent == null ? Path.of("") : parent;
  }

  /**
   * Read the next processed line from the input.
   */
  public String readLine() throws IOException {
    String line;

    while (true) {
      line = reader.readLine();
      lineNumber++;
      if (line == null) {
        return line; // EOF
      } else if (line.startsWith("//") || line.isEmpty()) {
        continue; // Not a valid line
      }

      line = processLineEscapes(line);
      break;
    }

    return line;
  }

  /**
   * Read the next test case from the input.
   *
   * @return next test case, or {@code null} at the end of the file
   */
  public TestCase readTestCase() throws IOException {

    // Test data
    final String automaton = readLine();
    if (automaton == null) {
      return null;
    }
    final int lineNumber = this.lineNumber;
    final String input = readLine();
    final String outputData = readLine();
    if (input == null || outputData == null) {
      throw new IOException(filePath + ":" + lineNumber + ": incomplete test case");
    }

    return new TestCase(
      directory.resolve(automaton),
      EMPTY_WORD.equals(input) ? "" : input,
      outputData.trim(),
      filePath,
      lineNumber
    );
  }

  /**
   * Run an action for every remaining test case in the file.
   *
   * @param action action to run on each test case
   */
  public void forEachTestCase(Consumer<? super TestCase> action) throws IOException {
    TestCase testCase;
    while ((testCase = readTestCase()) != null) {
      action.accept(testCase);
    }
  }

  public int getLineNumber() {
    return lineNumber;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  /**
   * Process a line to replace some escape sequences with the actual characters
   *
   * @param line line to escape
   * @return escaped line
   */
  private static String processLineEscapes(String line) {

    // process newline escapes
    line = line.replaceAll("\\\\n", "\n");

    // process unicode escapes
    line = UNICODE_ESCAPES.matcher(line).replaceAll(result ->
      Matcher.quoteReplacement(Character.toString((char) Integer.parseInt(result.group(1), 16)))
    );

    return line;
  }
}
