package workbench.tester;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

import workbench.AutomatonManager;
import workbench.Mode;
import workbench.OperationResult;

/**
 * Runs `.txt` files of simulation test cases against an automaton saved as JSON.
 *
 * <pre>
 *   automaton-tester [--convert] [--mode NFA|DFA] automaton.json cases.txt...
 * </pre>
 */
public class FileTesterMain {

  /**
   * Counts of test results across all files.
   */
  static final class Tally {
    int successes = 0;
    int failures = 0;
    int skipped = 0;
  }

  public static void main(String[] args) {
    System.exit(run(args, System.err));
  }

  /**
   * Parse the arguments and run every test file.
   *
   * @param args command line arguments
   * @param console where to write failures and the summary
   * @return process exit status: 0 if every case passed, 1 on failures, 2 on bad usage
   */
  public static int run(String[] args, PrintStream console) {
    final ArgumentParser parser = ArgumentParsers
      .newFor("automaton-tester")
      .build()
      .defaultHelp(true)
      .description("Simulate test inputs on a saved NFA or DFA and check the outcomes.");
    parser.addArgument("automaton")
      .help("JSON file holding the automaton");
    parser.addArgument("--convert")
      .action(Arguments.storeTrue())
      .help("convert the NFA to a DFA and test the DFA");
    parser.addArgument("--mode")
      .choices("NFA", "DFA")
      .help("automaton to test, overriding the mode stored in the file");
    parser.addArgument("tests")
      .nargs("+")
      .help("test files: an input line followed by an expected outcome line, per case");

    final Namespace namespace;
    try {
      namespace = parser.parseArgs(args);
    } catch (ArgumentParserException e) {
      parser.handleError(e);
      return 2;
    }

    final var manager = new AutomatonManager();
    final OperationResult loaded = manager.loadFromFile(Path.of(namespace.getString("automaton")));
    if (!loaded.success()) {
      console.println("Failed to load automaton: " + loaded.message());
      return 2;
    }

    final String mode = namespace.getString("mode");
    if (mode != null) {
      manager.setMode(Mode.valueOf(mode));
    }

    if (namespace.getBoolean("convert")) {
      final OperationResult converted = manager.convertToDfa();
      if (!converted.success()) {
        console.println("Failed to convert: " + converted.message());
        return 2;
      }
      manager.setMode(Mode.DFA);
    }

    final var tally = new Tally();

    // Console reporter - writes its output straight to console
    final var consoleReporter = new TestReporter() {
      @Override
      public void onMalformedCase(TestCase testCase) {
        console.println("Unknown expected outcome for " + testCase.getSummary() + ": '" + testCase.expected + "'");
        tally.skipped++;
      }

      @Override
      public void onUnexpectedOutcome(TestCase testCase, String foundOutput) {
        console.println("Unexpected outcome simulating " + testCase.getSummary() + ": expected '" + testCase.expected + "' but got '" + foundOutput + "'");
        tally.failures++;
      }

      @Override
      public void onSuccess(TestCase testCase) {
        tally.successes++;
      }
    };

    final var runner = new TestRunner(consoleReporter, manager);
    final List<String> testFiles = namespace.getList("tests");
    for (String testFile : testFiles) {
      if (!processFileOfTests(runner, Path.of(testFile), console)) {
        tally.failures++;
      }
    }

    console.println();
    console.println("PASSED: " + tally.successes + ", FAILED: " + tally.failures + ", SKIPPED: " + tally.skipped);
    return tally.failures == 0 ? 0 : 1;
  }

  /**
   * Process all of the tests inside a test file.
   *
   * @param runner test runner
   * @param testFile filepath to the tests
   * @param console where to report a file that cannot be read
   * @return whether the file could be read to the end
   */
  public static boolean processFileOfTests(TestRunner runner, Path testFile, PrintStream console) {
    try (var reader = new TestFileReader(testFile)) {
      reader.forEachTestCase(runner);
      return true;
    } catch (IOException err) {
      console.println("Failed to read file " + testFile + ": " + err.getMessage());
      return false;
    }
  }
}
