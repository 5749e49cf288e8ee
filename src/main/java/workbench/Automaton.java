package workbench;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Finite automaton over string-named states and symbols.
 *
 * Both the nondeterministic and the deterministic flavours are editable in
 * place. Edits referring to missing states or symbols are rejected with an
 * {@link AutomatonException} and leave the automaton unchanged.
 */
public interface Automaton {

  /**
   * Reserved symbol for spontaneous transitions.
   */
  String EPSILON = "ε";

  /**
   * All states
   *
   * @return unmodifiable view of the states, in insertion order
   */
  Set<String> states();

  /**
   * Input alphabet
   *
   * @return unmodifiable view of the symbols, in insertion order
   */
  Set<String> symbols();

  /**
   * Initial state
   *
   * @return starting state in the machine, or {@code null} if none is set
   */
  String start();

  /**
   * Accepting states
   *
   * @return unmodifiable view of the accepting states
   */
  Set<String> finals();

  /**
   * Look up where a transition leads.
   *
   * For a deterministic automaton this is empty or a singleton.
   *
   * @param state state inside the automaton
   * @param symbol symbol of the alphabet
   * @return targets of the transitions labelled {@code symbol} out of {@code state}
   */
  List<String> destinations(String state, String symbol);

  /**
   * Run the automaton over a whole input.
   *
   * @param input string whose characters are matched against the symbols
   * @return whether the automaton ends in an accepting configuration
   */
  boolean accepts(String input);

  void addState(String name);

  void deleteState(String name);

  void addSymbol(String name);

  void deleteSymbol(String name);

  /**
   * Add a transition. Adding one that is already present does nothing.
   *
   * @param from source state
   * @param symbol label of the transition
   * @param to target state
   */
  void addTransition(String from, String symbol, String to);

  /**
   * Remove a transition. Removing one that is not present does nothing.
   *
   * @param from source state
   * @param symbol label of the transition
   * @param to target state
   */
  void deleteTransition(String from, String symbol, String to);

  /**
   * @param name new initial state, or {@code null} to clear it
   */
  void setStart(String name);

  void addFinal(String name);

  void removeFinal(String name);

  /**
   * Flip whether a state is accepting.
   *
   * @param name state to flip
   * @return whether the state is accepting after the flip
   */
  boolean toggleFinal(String name);

  /**
   * Remove every state, symbol and transition.
   */
  void clear();

  /**
   * Describe the automaton as the tuple {@code (Q, Σ, δ, q0, F)}.
   *
   * @return multi-line text, one transition per line after the header
   */
  String formalDefinition();

  /**
   * Tabulate the transition function: one column per symbol, one row per state.
   */
  TransitionTable transitionTable();

  /**
   * Whether a character of input can be read at all.
   *
   * {@code ε} is never read from input, even when it is in the alphabet.
   *
   * @param symbol one input character
   * @return whether the symbol is in the alphabet and is not {@code ε}
   */
  default boolean readsSymbol(String symbol) {
    return !EPSILON.equals(symbol) && symbols().contains(symbol);
  }

  /**
   * Split an input into the symbols it spells out, one per code point.
   *
   * @param input input string
   * @return symbols in input order
   */
  static List<String> inputSymbols(String input) {
    return input
      .codePoints()
      .mapToObj(Character::toString)
      .collect(Collectors.toList());
  }
}
