package workbench;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import workbench.io.DfaDump;

/**
 * Deterministic finite automaton.
 *
 * A (state, symbol) pair maps to at most one target state; the transition
 * function may be partial. Adding a transition for a pair which already has
 * one replaces the old target.
 */
public final class Dfa extends AbstractAutomaton<String> {

  @Override
  public List<String> destinations(String state, String symbol) {
    return target(state, symbol).map(List::of).orElse(List.of());
  }

  /**
   * Look up the unique transition for a pair.
   *
   * @param state state inside the DFA
   * @param symbol symbol of the alphabet
   * @return target state, if the transition is defined
   */
  public Optional<String> target(String state, String symbol) {
    return Optional.ofNullable(transition(state, symbol));
  }

  /**
   * @return whether every state has a transition on every symbol
   */
  public boolean isTotal() {
    return states
      .stream()
      .allMatch(state -> symbols.stream().allMatch(symbol -> transition(state, symbol) != null));
  }

  @Override
  public boolean accepts(String input) {
    if (start == null) {
      return false;
    }

    String current = start;
    for (String symbol : Automaton.inputSymbols(input)) {
      if (!readsSymbol(symbol)) {
        return false;
      }
      current = transition(current, symbol);
      if (current == null) {
        return false;
      }
    }

    return finals.contains(current);
  }

  /**
   * Snapshot the automaton into its serializable form.
   */
  public DfaDump toDump() {
    final Map<String, Map<String, String>> dumpedTransitions = new LinkedHashMap<>();
    transitions.forEach((state, bySymbol) -> dumpedTransitions.put(state, new LinkedHashMap<>(bySymbol)));
    return new DfaDump(
      List.copyOf(states),
      List.copyOf(symbols),
      start,
      List.copyOf(finals),
      dumpedTransitions
    );
  }

  /**
   * Replace the contents of this automaton with those of a dump.
   *
   * On rejection of any entry this automaton is left untouched.
   *
   * @param dump serialized automaton
   */
  public void loadDump(DfaDump dump) {
    replaceWith(fromDump(dump));
  }

  public static Dfa fromDump(DfaDump dump) {
    final var dfa = new Dfa();
    dump.states().forEach(dfa::addState);
    dump.symbols().forEach(dfa::addSymbol);
    dfa.setStart(dump.start());
    dump.finals().forEach(dfa::addFinal);
    dump.transitions().forEach((from, bySymbol) ->
      bySymbol.forEach((symbol, to) -> dfa.addTransition(from, symbol, to))
    );
    return dfa;
  }

  @Override
  protected void checkSymbol(String name) {
    if (EPSILON.equals(name)) {
      throw new EpsilonNotAllowedException(name);
    }
  }

  @Override
  protected String withTarget(String current, String to) {
    return to;
  }

  @Override
  protected boolean dropTarget(String current, String to) {
    return current.equals(to);
  }

  @Override
  protected String copyTarget(String target) {
    return target;
  }

  @Override
  protected String signature() {
    return "δ : Q × Σ → Q";
  }

  @Override
  protected String renderTarget(String target) {
    return target;
  }

  @Override
  protected String emptyCell() {
    return "";
  }
}
