package workbench.tester;

import java.util.Optional;
import java.util.function.Consumer;

import workbench.AutomatonManager;
import workbench.SimulationOutcome;
import workbench.SimulationTrace;

/**
 * Charged with running test cases against the current automaton of a manager.
 */
public class TestRunner implements Consumer<TestCase> {

  /**
   * How are test outcomes reported?
   */
  final TestReporter reporter;

  /**
   * Holds the automaton under test.
   */
  final AutomatonManager manager;

  public TestRunner(TestReporter reporter, AutomatonManager manager) {
    this.reporter = reporter;
    this.manager = manager;
  }

  /**
   * Accept a new test case.
   *
   * @param testCase test to run
   */
  public void accept(TestCase testCase) {
    final Optional<SimulationOutcome> expected = testCase.expectedOutcome();
    if (expected.isEmpty()) {
      reporter.onMalformedCase(testCase);
      return;
    }

    final SimulationTrace trace = manager.simulateCurrent(testCase.input);

    // Compare the outcomes
    if (trace.outcome() == expected.get()) {
      reporter.onSuccess(testCase);
    } else {
      reporter.onUnexpectedOutcome(testCase, TestCase.createOutput(trace));
    }
  }
}
