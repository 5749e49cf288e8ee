package workbench;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import workbench.io.DfaDump;
import workbench.io.NfaDump;

public class AutomatonManagerTest {

  @TempDir
  Path tempDir;

  @Test
  void startsEmptyInNfaMode() {
    final var manager = new AutomatonManager();
    Assertions.assertEquals(Mode.NFA, manager.mode());
    Assertions.assertSame(manager.nfa(), manager.current());
    Assertions.assertFalse(manager.isDfaAvailable());
    Assertions.assertEquals(Map.of(), manager.stateMap());
  }

  @Test
  void routesEditsToCurrentAutomaton() {
    final var manager = new AutomatonManager();
    manager.addState("n0");
    manager.addSymbol("a");
    manager.setStart("n0");
    Assertions.assertTrue(manager.toggleFinal("n0"));
    manager.addTransition("n0", "a", "n0");

    manager.setMode(Mode.DFA);
    Assertions.assertSame(manager.dfa(), manager.current());
    manager.addState("d0");
    manager.addSymbol("b");

    Assertions.assertEquals(Set.of("n0"), manager.nfa().states());
    Assertions.assertEquals(Set.of("d0"), manager.dfa().states());
    Assertions.assertThrows(UnknownStateException.class, () -> manager.addTransition("n0", "b", "d0"));

    manager.setMode(Mode.NFA);
    manager.deleteTransition("n0", "a", "n0");
    manager.deleteSymbol("a");
    manager.deleteState("n0");
    Assertions.assertEquals(Set.of(), manager.nfa().states());
  }

  @Test
  void epsilonOnlyInNfaMode() {
    final var manager = new AutomatonManager();
    manager.addEpsilon();
    Assertions.assertTrue(manager.nfa().hasEpsilon());
    Assertions.assertThrows(DuplicateSymbolException.class, manager::addEpsilon);

    manager.setMode(Mode.DFA);
    Assertions.assertThrows(EpsilonNotAllowedException.class, manager::addEpsilon);
  }

  @Test
  void convertingEmptyNfaFails() {
    final var manager = new AutomatonManager();
    final OperationResult result = manager.convertToDfa();

    Assertions.assertFalse(result.success());
    Assertions.assertEquals("NFA is empty", result.message());
    Assertions.assertThrows(EmptyAutomatonException.class, manager::convert);
  }

  @Test
  void conversionReplacesDfaAndRecordsSubsets() {
    final var manager = new AutomatonManager();
    manager.setMode(Mode.DFA);
    manager.addState("stale");

    manager.setMode(Mode.NFA);
    manager.loadSampleData();
    final OperationResult result = manager.convertToDfa();

    Assertions.assertTrue(result.success());
    Assertions.assertEquals("NFA converted to DFA", result.message());
    Assertions.assertTrue(manager.isDfaAvailable());
    Assertions.assertEquals(List.of("q0", "q1"), List.copyOf(manager.dfa().states()));
    Assertions.assertEquals(
      Map.of("q0", StateSet.of("q0"), "q1", StateSet.of("q0", "q1")),
      manager.stateMap()
    );
    Assertions.assertEquals(Mode.NFA, manager.mode());
  }

  @Test
  void resetClearsStateMap() {
    final var manager = new AutomatonManager();
    manager.loadSampleData();
    manager.convertToDfa();

    manager.setMode(Mode.DFA);
    manager.resetAutomaton();
    Assertions.assertFalse(manager.isDfaAvailable());
    Assertions.assertEquals(Map.of(), manager.stateMap());
    Assertions.assertEquals(Set.of("q0", "q1"), manager.nfa().states());

    manager.setMode(Mode.NFA);
    manager.resetAutomaton();
    Assertions.assertEquals(Set.of(), manager.nfa().states());
  }

  @Test
  void simulatesCurrentAutomaton() {
    final var manager = new AutomatonManager();
    manager.loadSampleData();
    manager.convertToDfa();

    Assertions.assertTrue(manager.simulateCurrent("ba").accepted());
    Assertions.assertTrue(manager.simulateCurrent("ba").steps().get(1).startsWith("1) After input"));

    manager.setMode(Mode.DFA);
    Assertions.assertEquals("1) Input 'b' -> q0", manager.simulateCurrent("ba").steps().get(1));
    Assertions.assertEquals(SimulationOutcome.REJECT, manager.simulateDfa("ab").outcome());
    Assertions.assertEquals(SimulationOutcome.REJECT, manager.simulateNfa("ab").outcome());
  }

  @Test
  void dumpCarriesMode() {
    final var manager = new AutomatonManager();
    manager.loadSampleData();
    Assertions.assertTrue(manager.toDump() instanceof NfaDump);

    manager.convertToDfa();
    manager.setMode(Mode.DFA);
    Assertions.assertTrue(manager.toDump() instanceof DfaDump);
    Assertions.assertEquals(Mode.DFA, manager.toDump().mode());

    final var other = new AutomatonManager();
    other.loadDump(manager.toDump());
    Assertions.assertEquals(Mode.DFA, other.mode());
    Assertions.assertEquals(manager.dfa().toDump(), other.dfa().toDump());
  }

  @Test
  void saveAndLoadNfa() {
    final var manager = new AutomatonManager();
    manager.loadSampleData();
    final Path file = tempDir.resolve("nfa.json");

    final OperationResult saved = manager.saveToFile(file);
    Assertions.assertTrue(saved.success());
    Assertions.assertEquals("Saved NFA to " + file, saved.message());

    final var other = new AutomatonManager();
    other.setMode(Mode.DFA);
    final OperationResult loaded = other.loadFromFile(file);
    Assertions.assertTrue(loaded.success());
    Assertions.assertEquals("Loaded NFA from " + file, loaded.message());
    Assertions.assertEquals(Mode.NFA, other.mode());
    Assertions.assertEquals(manager.nfa().toDump(), other.nfa().toDump());
  }

  @Test
  void saveAndLoadDfa() {
    final var manager = new AutomatonManager();
    manager.loadSampleData();
    manager.convertToDfa();
    manager.setMode(Mode.DFA);
    final Path file = tempDir.resolve("dfa.json");
    Assertions.assertTrue(manager.saveToFile(file).success());

    final var other = new AutomatonManager();
    Assertions.assertTrue(other.loadFromFile(file).success());
    Assertions.assertEquals(Mode.DFA, other.mode());
    Assertions.assertEquals(manager.dfa().toDump(), other.dfa().toDump());
    Assertions.assertTrue(other.simulateCurrent("aaba").accepted());
  }

  @Test
  void loadingNfaForgetsConversion() {
    final var manager = new AutomatonManager();
    manager.loadSampleData();
    manager.convertToDfa();
    Assertions.assertFalse(manager.stateMap().isEmpty());

    manager.loadDump(Samples.partial().toDump());
    Assertions.assertEquals(Map.of(), manager.stateMap());
  }

  @Test
  void failedLoadChangesNothing() throws IOException {
    final var manager = new AutomatonManager();
    manager.loadSampleData();

    final Path dangling = tempDir.resolve("dangling.json");
    Files.writeString(
      dangling,
      "{\"mode\": \"DFA\", \"states\": [\"a\"], \"symbols\": [], \"start\": \"zz\"}",
      StandardCharsets.UTF_8
    );
    final OperationResult result = manager.loadFromFile(dangling);
    Assertions.assertFalse(result.success());
    Assertions.assertEquals("No such state: zz", result.message());
    Assertions.assertEquals(Mode.NFA, manager.mode());
    Assertions.assertEquals(Samples.endsInA().toDump(), manager.nfa().toDump());

    final Path garbage = tempDir.resolve("garbage.json");
    Files.writeString(garbage, "this is not json", StandardCharsets.UTF_8);
    Assertions.assertFalse(manager.loadFromFile(garbage).success());

    Assertions.assertFalse(manager.loadFromFile(tempDir.resolve("missing.json")).success());
    Assertions.assertEquals(Samples.endsInA().toDump(), manager.nfa().toDump());
  }

  @Test
  void nullEntriesInFileAreRejected() throws IOException {
    final var manager = new AutomatonManager();
    manager.loadSampleData();

    final List<String> files = List.of(
      "{\"mode\": \"NFA\", \"states\": [\"q0\"], \"symbols\": [\"a\"], \"transitions\": {\"q0\": {\"a\": null}}}",
      "{\"mode\": \"NFA\", \"states\": [\"q0\"], \"symbols\": [\"a\"], \"transitions\": {\"q0\": {\"a\": [null]}}}",
      "{\"mode\": \"DFA\", \"states\": [\"q0\"], \"symbols\": [\"a\"], \"transitions\": {\"q0\": null}}",
      "{\"mode\": \"DFA\", \"states\": [\"q0\"], \"symbols\": [\"a\"], \"transitions\": {\"q0\": {\"a\": null}}}",
      "{\"mode\": \"NFA\", \"states\": [null]}"
    );
    for (int i = 0; i < files.size(); i++) {
      final Path file = tempDir.resolve("null" + i + ".json");
      Files.writeString(file, files.get(i), StandardCharsets.UTF_8);

      final OperationResult result = manager.loadFromFile(file);
      Assertions.assertFalse(result.success(), files.get(i));
      Assertions.assertEquals(Mode.NFA, manager.mode());
      Assertions.assertEquals(Samples.endsInA().toDump(), manager.nfa().toDump());
      Assertions.assertEquals(Set.of(), manager.dfa().states());
    }
  }

  @Test
  void saveToUnwritablePathFails() {
    final var manager = new AutomatonManager();
    final OperationResult result = manager.saveToFile(tempDir.resolve("no/such/dir/out.json"));
    Assertions.assertFalse(result.success());
  }
}
