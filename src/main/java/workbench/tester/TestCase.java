package workbench.tester;

import java.util.Optional;

import workbench.SimulationOutcome;
import workbench.SimulationTrace;

/**
 * Test case in a test file.
 */
public class TestCase {

  /**
   * Input string to feed to the automaton.
   */
  public final String input;

  /**
   * Expected outcome, as written in the file (eg. {@code ACCEPT}).
   */
  public final String expected;

  /**
   * Source file from which the test originated.
   */
  public final String filePath;

  /**
   * Line in the source file from which the test originated.
   */
  public final int lineNumber;

  public TestCase(
    String input,
    String expected,
    String filePath,
    int lineNumber
  ) {
    this.input = input;
    this.expected = expected;
    this.filePath = filePath;
    this.lineNumber = lineNumber;
  }

  /**
   * Parse the expected outcome.
   *
   * @return outcome, or nothing if the expectation is not an outcome name
   */
  public Optional<SimulationOutcome> expectedOutcome() {
    if (expected == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(SimulationOutcome.valueOf(expected.trim()));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }

  /**
   * Construct an output string from a simulation.
   *
   * @param trace result of the simulation
   * @return outcome name, followed by the status message when it adds something
   */
  public static String createOutput(SimulationTrace trace) {
    final String outcome = trace.outcome().name();
    return outcome.equals(trace.message()) ? outcome : outcome + " (" + trace.message() + ")";
  }

  /**
   * Render the test and its source location in a human readable fashion.
   */
  public String getSummary() {
    return "\"" + input + "\" (at " + filePath + ":" + lineNumber + ")";
  }
}
