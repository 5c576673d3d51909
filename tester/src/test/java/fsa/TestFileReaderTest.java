package fsa;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestFileReaderTest {

  @Rule
  public TemporaryFolder folder = new TemporaryFolder();

  static String resource(String name) throws URISyntaxException {
    return Path.of(TestFileReaderTest.class.getResource("/tests/" + name).toURI()).toString();
  }

  @Test
  public void testReadsTriples() throws Exception {
    final String file = resource("passing.txt");
    final List<TestCase> cases = new ArrayList<>();
    try (var reader = new TestFileReader(file)) {
      reader.forEachTestCase(cases::add);
    }

    assertEquals(7, cases.size());

    final TestCase first = cases.get(0);
    assertEquals(Path.of(file).getParent().resolve("DFA1.json"), first.automaton);
    assertEquals("", first.input);
    assertEquals("true", first.output);
    assertEquals(2, first.lineNumber);
    assertFalse(first.expectsError());

    // unicode escapes
    assertEquals("01", cases.get(5).input);
    assertEquals("false", cases.get(5).output);

    assertTrue(cases.get(6).expectsError());
    assertThat(cases.get(6).getSummary(), containsString("broken.json on \"a\""));
  }

  @Test
  public void testEscapesOfReplacementCharacters() throws IOException {
    final Path file = folder.newFile("special.txt").toPath();
    Files.writeString(file, "DFA1.json\n\\u0024\nfalse\nDFA1.json\na\\u005cb\nfalse\n");
    try (var reader = new TestFileReader(file.toString())) {
      assertEquals("$", reader.readTestCase().input);
      assertEquals("a\\b", reader.readTestCase().input);
    }
  }

  @Test
  public void testEmptyFile() throws IOException {
    final Path file = folder.newFile("empty.txt").toPath();
    Files.writeString(file, "// nothing here\n\n");
    try (var reader = new TestFileReader(file.toString())) {
      assertNull(reader.readTestCase());
    }
  }

  @Test
  public void testIncompleteTestCase() throws IOException {
    final Path file = folder.newFile("incomplete.txt").toPath();
    Files.writeString(file, "DFA1.json\nab\n");
    try (var reader = new TestFileReader(file.toString())) {
      reader.readTestCase();
      fail("expected an incomplete test case");
    } catch (IOException e) {
      assertThat(e.getMessage(), containsString("incomplete test case"));
    }
  }
}
