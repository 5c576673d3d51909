package fsa;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Processes `.txt` files that encode acceptance tests over JSON automata.
  *
  * Each test is three lines: the automaton file, the input word, and the
  * expected output ({@code true} or {@code false}).
  */
class FileTesterMain {

  private static final Logger logger = LoggerFactory.getLogger(FileTesterMain.class);

  static int successes = 0;
  static int failures = 0;
  static int skipped = 0;

  public static void main(String[] testFiles) throws IOException {

    // Console reporter - writes its output straight to console
    final var consoleReporter = new TestReporter() {
      @Override
      public void onAutomatonError(TestCase testCase, Exception error) {
        logger.error("Unexpected error loading {}: {}", testCase.getSummary(), error.getMessage());
        FileTesterMain.failures++;
      }

      @Override
      public void onUnexpectedOutput(TestCase testCase, String form, String foundOutput) {
        logger.error(
          "Unexpected output from the {} automaton for {}: expected '{}' but got '{}'",
          form,
          testCase.getSummary(),
          testCase.output,
          foundOutput
        );
        FileTesterMain.failures++;
      }

      @Override
      public void onSuccess(TestCase testCase, boolean expectedFailure) {
        FileTesterMain.successes++;
      }
    };

    final var runner = new TestRunner(consoleReporter);
    for (String testFile : testFiles) {
      processFileOfTests(runner, testFile);
    }

    System.err.println();
    System.err.println("PASSED: " + successes + ", FAILED: " + failures + ", SKIPPED: " + skipped);
    if (failures > 0) {
      System.exit(1);
    }
  }

  /**
   * Process all of the tests inside a test file.
   *
   * <p>A file which cannot be found is skipped.
   *
   * @param runner test runner
   * @param testFile filepath to the tests
   */
  public static void processFileOfTests(TestRunner runner, String testFile) throws IOException {
    final TestFileReader reader;
    try {
      reader = new TestFileReader(testFile);
    } catch (NoSuchFileException err) {
      logger.warn("Failed to open file {}: {}", testFile, err.getMessage());
      FileTesterMain.skipped++;
      return;
    }

    try (reader) {
      reader.forEachTestCase(runner);
    }
  }
}
