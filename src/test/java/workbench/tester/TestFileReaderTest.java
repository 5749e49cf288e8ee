package workbench.tester;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Optional;

import workbench.SimulationOutcome;

public class TestFileReaderTest {

  @TempDir
  Path tempDir;

  @Test
  void readsCasesSkippingCommentsAndBlanks() throws IOException {
    final Path file = tempDir.resolve("cases.txt");
    Files.writeString(file, String.join("\n",
      "// strings ending in a",
      "",
      "a",
      "ACCEPT",
      "\"\"",
      "REJECT",
      "\\u0061b",
      "REJECT",
      ""
    ), StandardCharsets.UTF_8);

    final var cases = new ArrayList<TestCase>();
    try (var reader = new TestFileReader(file)) {
      reader.forEachTestCase(cases::add);
    }

    Assertions.assertEquals(3, cases.size());

    Assertions.assertEquals("a", cases.get(0).input);
    Assertions.assertEquals("ACCEPT", cases.get(0).expected);
    Assertions.assertEquals(3, cases.get(0).lineNumber);
    Assertions.assertEquals(file.toString(), cases.get(0).filePath);

    Assertions.assertEquals("", cases.get(1).input);
    Assertions.assertEquals(5, cases.get(1).lineNumber);

    Assertions.assertEquals("ab", cases.get(2).input);
    Assertions.assertEquals(Optional.of(SimulationOutcome.REJECT), cases.get(2).expectedOutcome());
  }

  @Test
  void danglingInputHasNoExpectation() throws IOException {
    final Path file = tempDir.resolve("dangling.txt");
    Files.writeString(file, "abc\n", StandardCharsets.UTF_8);

    try (var reader = new TestFileReader(file)) {
      final TestCase testCase = reader.readTestCase();
      Assertions.assertEquals("abc", testCase.input);
      Assertions.assertNull(testCase.expected);
      Assertions.assertEquals(Optional.empty(), testCase.expectedOutcome());
      Assertions.assertNull(reader.readTestCase());
    }
  }

  @Test
  void expectedOutcomeParsing() {
    Assertions.assertEquals(
      Optional.of(SimulationOutcome.DEAD_END),
      new TestCase("a", " DEAD_END ", "f", 1).expectedOutcome()
    );
    Assertions.assertEquals(Optional.empty(), new TestCase("a", "MAYBE", "f", 1).expectedOutcome());
    Assertions.assertEquals("\"a\" (at f:1)", new TestCase("a", "MAYBE", "f", 1).getSummary());
  }

  @Test
  void unreadableFileIsReported() {
    Assertions.assertThrows(IOException.class, () -> new TestFileReader(tempDir.resolve("missing.txt")));
  }
}
