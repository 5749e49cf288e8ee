package workbench.tester;

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
 * Reads simulation test cases from a text file.
 *
 * Each case is two lines: the input, then the expected outcome. Skips over
 * comment lines and blank lines, processes escape sequences. Since blank lines
 * are skipped, an input line of exactly {@code ""} stands for the empty input.
 */
public class TestFileReader implements Closeable {

  /**
   * Input line standing for the empty string.
   */
  public static final String EMPTY_INPUT = "\"\"";

  private static final Pattern UNICODE_ESCAPES = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

  private final BufferedReader reader;

  private final String filePath;

  private int lineNumber = 0;

  public TestFileReader(Path filePath) throws IOException {
    this.reader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8);
    this.filePath = filePath.toString();
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
   * @return next case, or {@code null} at the end of the file
   */
  public TestCase readTestCase() throws IOException {

    // Test data
    final String input = readLine();
    if (input == null) {
      return null;
    }
    final int lineNumber = this.lineNumber;
    final String expected = readLine();

    return new TestCase(EMPTY_INPUT.equals(input) ? "" : input, expected, filePath, lineNumber);
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
