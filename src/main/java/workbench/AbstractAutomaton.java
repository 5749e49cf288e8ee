package workbench;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * State and alphabet registry shared by both kinds of automaton.
 *
 * @param <T> what a (state, symbol) pair maps to in the transition function
 */
abstract class AbstractAutomaton<T> implements Automaton {

  protected final Set<String> states = new LinkedHashSet<>();
  protected final Set<String> symbols = new LinkedHashSet<>();
  protected final Set<String> finals = new LinkedHashSet<>();
  protected String start = null;

  /**
   * State transitions, indexed along starting states then symbols.
   *
   * Inner maps are only created on the first write for a state, and are
   * dropped again as soon as they become empty.
   */
  protected final Map<String, Map<String, T>> transitions = new LinkedHashMap<>();

  @Override
  public Set<String> states() {
    return Collections.unmodifiableSet(states);
  }

  @Override
  public Set<String> symbols() {
    return Collections.unmodifiableSet(symbols);
  }

  @Override
  public String start() {
    return start;
  }

  @Override
  public Set<String> finals() {
    return Collections.unmodifiableSet(finals);
  }

  @Override
  public void addState(String name) {
    Objects.requireNonNull(name, "state name");
    if (states.contains(name)) {
      throw new DuplicateStateException(name);
    }
    states.add(name);
  }

  @Override
  public void deleteState(String name) {
    requireState(name);
    states.remove(name);
    if (name.equals(start)) {
      start = null;
    }
    finals.remove(name);
    transitions.remove(name);

    final Iterator<Map<String, T>> perState = transitions.values().iterator();
    while (perState.hasNext()) {
      final Map<String, T> bySymbol = perState.next();
      bySymbol.values().removeIf(target -> dropTarget(target, name));
      if (bySymbol.isEmpty()) {
        perState.remove();
      }
    }
  }

  @Override
  public void addSymbol(String name) {
    Objects.requireNonNull(name, "symbol name");
    checkSymbol(name);
    if (symbols.contains(name)) {
      throw new DuplicateSymbolException(name);
    }
    symbols.add(name);
  }

  @Override
  public void deleteSymbol(String name) {
    requireSymbol(name);
    symbols.remove(name);
    transitions.values().forEach(bySymbol -> bySymbol.remove(name));
    transitions.values().removeIf(Map::isEmpty);
  }

  @Override
  public void addTransition(String from, String symbol, String to) {
    requireState(from);
    requireState(to);
    requireSymbol(symbol);
    final Map<String, T> bySymbol = transitions.computeIfAbsent(from, k -> new LinkedHashMap<>());
    bySymbol.put(symbol, withTarget(bySymbol.get(symbol), to));
  }

  @Override
  public void deleteTransition(String from, String symbol, String to) {
    final Map<String, T> bySymbol = transitions.get(from);
    if (bySymbol == null || !bySymbol.containsKey(symbol)) {
      return;
    }
    if (dropTarget(bySymbol.get(symbol), to)) {
      bySymbol.remove(symbol);
      if (bySymbol.isEmpty()) {
        transitions.remove(from);
      }
    }
  }

  @Override
  public void setStart(String name) {
    if (name != null) {
      requireState(name);
    }
    start = name;
  }

  @Override
  public void addFinal(String name) {
    requireState(name);
    finals.add(name);
  }

  @Override
  public void removeFinal(String name) {
    requireState(name);
    finals.remove(name);
  }

  @Override
  public boolean toggleFinal(String name) {
    requireState(name);
    if (finals.remove(name)) {
      return false;
    }
    finals.add(name);
    return true;
  }

  @Override
  public void clear() {
    states.clear();
    symbols.clear();
    finals.clear();
    transitions.clear();
    start = null;
  }

  @Override
  public String formalDefinition() {
    final var lines = new ArrayList<String>();
    lines.add("Q = " + braced(states));
    lines.add("Σ = " + braced(symbols));
    lines.add("q0 = " + (start == null ? "None" : start));
    lines.add("F = " + braced(new TreeSet<>(finals)));
    lines.add(signature());
    lines.add("");

    for (String state : states) {
      for (String symbol : symbols) {
        final T target = transition(state, symbol);
        if (target != null) {
          lines.add("    δ(" + state + ", " + symbol + ") = " + renderTarget(target));
        }
      }
    }
    return String.join("\n", lines);
  }

  @Override
  public TransitionTable transitionTable() {
    final var header = new ArrayList<String>();
    header.add(TransitionTable.DELTA);
    header.addAll(symbols);

    final var rows = new ArrayList<List<String>>();
    for (String state : states) {
      final var row = new ArrayList<String>();
      row.add(state);
      for (String symbol : symbols) {
        final T target = transition(state, symbol);
        row.add(target == null ? emptyCell() : renderTarget(target));
      }
      rows.add(row);
    }
    return new TransitionTable(header, rows);
  }

  @Override
  public String toString() {
    return formalDefinition();
  }

  /**
   * Raw transition lookup.
   *
   * @return stored target(s), or {@code null} if the pair has no transition
   */
  protected T transition(String state, String symbol) {
    final Map<String, T> bySymbol = transitions.get(state);
    return bySymbol == null ? null : bySymbol.get(symbol);
  }

  /**
   * Combine a new target into whatever is currently stored for a pair.
   *
   * @param current stored value, or {@code null} if there is none yet
   * @param to new target state
   * @return value to store for the pair
   */
  protected abstract T withTarget(T current, String to);

  /**
   * Remove a target state from a stored value.
   *
   * @param current stored value
   * @param to target state to remove
   * @return whether nothing is left, meaning the entry must be dropped
   */
  protected abstract boolean dropTarget(T current, String to);

  /**
   * Type signature of the transition function, as shown in the formal definition.
   */
  protected abstract String signature();

  protected abstract String renderTarget(T target);

  protected abstract String emptyCell();

  /**
   * Hook for rejecting symbols this kind of automaton cannot use.
   */
  protected void checkSymbol(String name) {
  }

  protected void requireState(String name) {
    if (name == null || !states.contains(name)) {
      throw new UnknownStateException(name);
    }
  }

  protected void requireSymbol(String name) {
    if (name == null || !symbols.contains(name)) {
      throw new UnknownSymbolException(name);
    }
  }

  /**
   * Copy every field of another automaton of the same kind into this one.
   */
  protected void replaceWith(AbstractAutomaton<T> other) {
    clear();
    states.addAll(other.states);
    symbols.addAll(other.symbols);
    finals.addAll(other.finals);
    start = other.start;
    other.transitions.forEach((state, bySymbol) -> {
      final Map<String, T> copy = new LinkedHashMap<>();
      bySymbol.forEach((symbol, target) -> copy.put(symbol, copyTarget(target)));
      transitions.put(state, copy);
    });
  }

  protected abstract T copyTarget(T target);

  static String braced(Iterable<String> names) {
    return "{" + String.join(", ", names) + "}";
  }
}
