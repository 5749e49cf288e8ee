package workbench;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import workbench.io.AutomatonDump;
import workbench.io.AutomatonFiles;
import workbench.io.DfaDump;
import workbench.io.NfaDump;

/**
 * Holds one NFA and one DFA, and routes edits and simulations to whichever
 * of the two the current {@link Mode} selects.
 *
 * The DFA is replaced wholesale each time the NFA is converted. The manager
 * remembers which NFA subset each generated DFA state stands for until the
 * next reset or NFA load.
 *
 * Instances are not thread-safe: one manager per editing session.
 */
public class AutomatonManager {

  private static final Logger LOG = LoggerFactory.getLogger(AutomatonManager.class);

  private Nfa nfa = new Nfa();
  private Dfa dfa = new Dfa();
  private Mode mode = Mode.NFA;

  // Generated DFA state name to the NFA subset it was built from
  private final Map<String, StateSet> stateMap = new LinkedHashMap<>();

  public Mode mode() {
    return mode;
  }

  public void setMode(Mode mode) {
    this.mode = Objects.requireNonNull(mode, "mode");
  }

  public Nfa nfa() {
    return nfa;
  }

  public Dfa dfa() {
    return dfa;
  }

  /**
   * @return the automaton selected by the current mode
   */
  public Automaton current() {
    return mode == Mode.NFA ? nfa : dfa;
  }

  /**
   * NFA subset behind each state of the last converted DFA.
   *
   * @return unmodifiable view, empty if there was no conversion since the last reset
   */
  public Map<String, StateSet> stateMap() {
    return Collections.unmodifiableMap(stateMap);
  }

  /**
   * @return whether there is a DFA with at least one state to work with
   */
  public boolean isDfaAvailable() {
    return !dfa.states().isEmpty();
  }

  public void addState(String name) {
    current().addState(name);
  }

  public void deleteState(String name) {
    current().deleteState(name);
  }

  public void addSymbol(String name) {
    current().addSymbol(name);
  }

  public void deleteSymbol(String name) {
    current().deleteSymbol(name);
  }

  public void addTransition(String from, String symbol, String to) {
    current().addTransition(from, symbol, to);
  }

  public void deleteTransition(String from, String symbol, String to) {
    current().deleteTransition(from, symbol, to);
  }

  public void setStart(String name) {
    current().setStart(name);
  }

  public boolean toggleFinal(String name) {
    return current().toggleFinal(name);
  }

  /**
   * Add {@code ε} to the alphabet of the current automaton.
   *
   * @throws EpsilonNotAllowedException if the manager is in DFA mode
   * @throws DuplicateSymbolException if the NFA already has {@code ε}
   */
  public void addEpsilon() {
    current().addSymbol(Automaton.EPSILON);
  }

  /**
   * Replace the current automaton with a fresh, empty one.
   */
  public void resetAutomaton() {
    if (mode == Mode.NFA) {
      nfa = new Nfa();
    } else {
      dfa = new Dfa();
    }
    stateMap.clear();
    LOG.debug("Reset {}", mode);
  }

  /**
   * Replace the NFA with a sample accepting the strings over {@code {a, b}}
   * which end in {@code a}.
   */
  public void loadSampleData() {
    final var sample = new Nfa();
    sample.addState("q0");
    sample.addState("q1");
    sample.addSymbol("a");
    sample.addSymbol("b");
    sample.setStart("q0");
    sample.addFinal("q1");
    sample.addTransition("q0", "a", "q1");
    sample.addTransition("q0", "a", "q0");
    sample.addTransition("q0", "b", "q0");
    sample.addTransition("q1", "a", "q1");
    sample.addTransition("q1", "b", "q0");
    nfa = sample;
    stateMap.clear();
  }

  /**
   * Convert the NFA, replacing the DFA and the state map.
   *
   * @return conversion output
   * @throws EmptyAutomatonException if the NFA has no states
   */
  public SubsetConstruction.Result convert() {
    if (nfa.states().isEmpty()) {
      throw new EmptyAutomatonException("NFA");
    }

    final SubsetConstruction.Result result = nfa.toDfa();
    dfa = result.dfa();
    stateMap.clear();
    stateMap.putAll(result.subsets());
    LOG.info("Converted NFA with {} states into DFA with {} states", nfa.states().size(), dfa.states().size());
    return result;
  }

  /**
   * Convert the NFA, reporting rather than throwing on failure.
   *
   * @return success, or failure with the reason (eg. {@code NFA is empty})
   */
  public OperationResult convertToDfa() {
    try {
      convert();
      return OperationResult.ok("NFA converted to DFA");
    } catch (AutomatonException e) {
      LOG.warn("Conversion to DFA failed", e);
      return OperationResult.failure(e.getMessage());
    }
  }

  public SimulationTrace simulateCurrent(String input) {
    return mode == Mode.NFA ? simulateNfa(input) : simulateDfa(input);
  }

  public SimulationTrace simulateNfa(String input) {
    return SimulationTracer.simulate(nfa, input);
  }

  public SimulationTrace simulateDfa(String input) {
    return SimulationTracer.simulate(dfa, input);
  }

  /**
   * Dump the current automaton. The dump's type records the mode.
   */
  public AutomatonDump toDump() {
    return mode == Mode.NFA ? nfa.toDump() : dfa.toDump();
  }

  /**
   * Switch to the mode of a dump and load it into the matching automaton.
   *
   * Loading an NFA forgets the state map of any earlier conversion. If the
   * dump is rejected, neither the automata nor the mode change.
   *
   * @param dump automaton to load
   */
  public void loadDump(AutomatonDump dump) {
    if (dump instanceof NfaDump nfaDump) {
      nfa.loadDump(nfaDump);
      stateMap.clear();
    } else if (dump instanceof DfaDump dfaDump) {
      dfa.loadDump(dfaDump);
    } else {
      throw new IllegalArgumentException("unexpected dump type " + dump.getClass().getName());
    }
    mode = dump.mode();
  }

  /**
   * Save the current automaton, tagged with the mode, as JSON.
   *
   * @param path destination file
   * @return success, or failure with the I/O error message
   */
  public OperationResult saveToFile(Path path) {
    try {
      AutomatonFiles.write(path, toDump());
      LOG.info("Saved {} to {}", mode, path);
      return OperationResult.ok("Saved " + mode + " to " + path);
    } catch (IOException e) {
      LOG.warn("Failed to save {} to {}", mode, path, e);
      return OperationResult.failure(e.getMessage());
    }
  }

  /**
   * Load an automaton from a JSON file written by {@link #saveToFile}.
   *
   * @param path source file
   * @return success, or failure with the reason; on failure nothing changes
   */
  public OperationResult loadFromFile(Path path) {
    try {
      loadDump(AutomatonFiles.read(path));
      LOG.info("Loaded {} from {}", mode, path);
      return OperationResult.ok("Loaded " + mode + " from " + path);
    } catch (IOException | AutomatonException e) {
      LOG.warn("Failed to load automaton from {}", path, e);
      return OperationResult.failure(e.getMessage());
    }
  }
}
