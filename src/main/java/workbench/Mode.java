package workbench;

/**
 * Which automaton the manager is currently working on.
 */
public enum Mode {
  NFA,
  DFA
}
