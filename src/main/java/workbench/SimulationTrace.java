package workbench;

import java.util.List;

/**
 * Result of simulating an automaton on one input.
 *
 * @param accepted whether the input is accepted
 * @param outcome how the simulation ended
 * @param message short status for display, eg. {@code ACCEPT} or {@code Invalid symbol "c"}
 * @param steps human-readable trace, one line per step
 */
public record SimulationTrace(
  boolean accepted,
  SimulationOutcome outcome,
  String message,
  List<String> steps
) {

  public SimulationTrace {
    steps = List.copyOf(steps);
  }
}
