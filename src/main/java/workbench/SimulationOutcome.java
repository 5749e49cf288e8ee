package workbench;

/**
 * How a simulation ended.
 */
public enum SimulationOutcome {

  /** All input was read and the automaton ended in an accepting configuration. */
  ACCEPT,

  /** All input was read but the automaton did not end in an accepting configuration. */
  REJECT,

  /** The automaton has no start state, so nothing was read. */
  NO_START_STATE,

  /** Some input character is not in the alphabet. */
  INVALID_SYMBOL,

  /** The configuration became empty (or the transition was undefined) before input ran out. */
  DEAD_END;

  public boolean accepted() {
    return this == ACCEPT;
  }
}
