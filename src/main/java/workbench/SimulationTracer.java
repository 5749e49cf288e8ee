package workbench;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Step-by-step simulation of an automaton, recording a readable trace.
 *
 * Simulation only reads the automaton. Running off the alphabet or into an
 * empty configuration is reported through the trace outcome, not thrown.
 */
public final class SimulationTracer {

  private static final Logger LOG = LoggerFactory.getLogger(SimulationTracer.class);

  /**
   * Shown in place of an empty configuration or an undefined transition.
   */
  public static final String EMPTY = "∅";

  private SimulationTracer() {
  }

  /**
   * Run an NFA, tracking the whole set of states it could be in.
   *
   * @param nfa automaton to run
   * @param input input string
   * @return trace of configurations, one per input character
   */
  public static SimulationTrace simulate(Nfa nfa, String input) {
    if (nfa.start() == null) {
      return noStartState();
    }

    final var steps = new ArrayList<String>();
    Set<String> current = nfa.initialConfiguration();
    steps.add("Starting at: " + format(current));

    int stepNo = 1;
    for (String symbol : Automaton.inputSymbols(input)) {
      if (!nfa.readsSymbol(symbol)) {
        return invalidSymbol(symbol, steps);
      }
      current = nfa.step(current, symbol);
      steps.add(stepNo++ + ") After input '" + symbol + "' -> " + format(current));
      if (current.isEmpty()) {
        return deadEnd(steps);
      }
    }

    final boolean accepted = current.stream().anyMatch(nfa.finals()::contains);
    steps.add("Final states reached: " + format(current));
    return finished(accepted, steps);
  }

  /**
   * Run a DFA, following its unique transitions.
   *
   * @param dfa automaton to run
   * @param input input string
   * @return trace of states, one per input character
   */
  public static SimulationTrace simulate(Dfa dfa, String input) {
    if (dfa.start() == null) {
      return noStartState();
    }

    final var steps = new ArrayList<String>();
    String current = dfa.start();
    steps.add("Starting at: " + current);

    int stepNo = 1;
    for (String symbol : Automaton.inputSymbols(input)) {
      if (!dfa.readsSymbol(symbol)) {
        return invalidSymbol(symbol, steps);
      }
      final Optional<String> next = dfa.target(current, symbol);
      steps.add(stepNo++ + ") Input '" + symbol + "' -> " + next.orElse(EMPTY));
      if (next.isEmpty()) {
        return deadEnd(steps);
      }
      current = next.get();
    }

    final boolean accepted = dfa.finals().contains(current);
    steps.add("Final state reached: " + current);
    return finished(accepted, steps);
  }

  /**
   * Render a configuration as its sorted, comma separated states.
   *
   * @param states configuration
   * @return rendered states, or {@link #EMPTY} if there are none
   */
  public static String format(Collection<String> states) {
    return states.isEmpty() ? EMPTY : String.join(", ", new TreeSet<>(states));
  }

  private static SimulationTrace noStartState() {
    return new SimulationTrace(false, SimulationOutcome.NO_START_STATE, "No start state", List.of());
  }

  private static SimulationTrace invalidSymbol(String symbol, List<String> steps) {
    LOG.debug("Simulation stopped on symbol {} outside the alphabet", symbol);
    return new SimulationTrace(false, SimulationOutcome.INVALID_SYMBOL, "Invalid symbol \"" + symbol + "\"", steps);
  }

  private static SimulationTrace deadEnd(List<String> steps) {
    return new SimulationTrace(false, SimulationOutcome.DEAD_END, "Dead end", steps);
  }

  private static SimulationTrace finished(boolean accepted, List<String> steps) {
    final SimulationOutcome outcome = accepted ? SimulationOutcome.ACCEPT : SimulationOutcome.REJECT;
    return new SimulationTrace(outcome.accepted(), outcome, outcome.name(), steps);
  }
}
