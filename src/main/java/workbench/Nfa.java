package workbench;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.Stack;
import java.util.TreeSet;

import workbench.io.NfaDump;

/**
 * Nondeterministic finite automaton, with support for {@code ε} transitions.
 *
 * A (state, symbol) pair maps to any number of target states. The {@code ε}
 * symbol is an ordinary alphabet entry as far as editing goes, but it is never
 * matched against input: it is followed spontaneously.
 */
public final class Nfa extends AbstractAutomaton<Set<String>> {

  @Override
  public List<String> destinations(String state, String symbol) {
    final Set<String> targets = transition(state, symbol);
    return targets == null ? List.of() : List.copyOf(targets);
  }

  /**
   * @return whether {@code ε} is part of the alphabet
   */
  public boolean hasEpsilon() {
    return symbols.contains(EPSILON);
  }

  /**
   * Compute the states reachable using only {@code ε} transitions.
   *
   * Cycles of {@code ε} transitions are fine: a state is only pushed onto the
   * work stack the first time it enters the closure.
   *
   * @param from states from which to start the search
   * @return smallest superset of {@code from} closed under {@code ε} transitions
   */
  public Set<String> epsilonClosure(Collection<String> from) {
    final var closure = new LinkedHashSet<String>(from);
    final var toVisit = new Stack<String>();
    toVisit.addAll(from);

    while (!toVisit.empty()) {
      for (String next : destinations(toVisit.pop(), EPSILON)) {
        if (closure.add(next)) {
          toVisit.push(next);
        }
      }
    }

    return closure;
  }

  /**
   * Configuration the automaton is in before reading any input.
   *
   * @return {@code ε}-closure of the start state, or nothing if there is no start
   */
  public Set<String> initialConfiguration() {
    return start == null ? Set.of() : epsilonClosure(List.of(start));
  }

  /**
   * Advance a configuration over one input symbol.
   *
   * @param configuration current set of states
   * @param symbol symbol being read (must not be {@code ε})
   * @return {@code ε}-closure of everything reachable over {@code symbol}
   */
  public Set<String> step(Collection<String> configuration, String symbol) {
    final var reached = new LinkedHashSet<String>();
    for (String state : configuration) {
      reached.addAll(destinations(state, symbol));
    }
    return epsilonClosure(reached);
  }

  @Override
  public boolean accepts(String input) {
    if (start == null) {
      return false;
    }

    Set<String> current = initialConfiguration();
    for (String symbol : Automaton.inputSymbols(input)) {
      if (!readsSymbol(symbol)) {
        return false;
      }
      current = step(current, symbol);
      if (current.isEmpty()) {
        return false;
      }
    }

    return current.stream().anyMatch(finals::contains);
  }

  /**
   * Build the equivalent DFA using subset construction.
   *
   * @return the DFA, along with the NFA state subset behind each DFA state
   */
  public SubsetConstruction.Result toDfa() {
    return SubsetConstruction.determinize(this);
  }

  /**
   * Snapshot the automaton into its serializable form.
   */
  public NfaDump toDump() {
    final Map<String, Map<String, List<String>>> dumpedTransitions = new LinkedHashMap<>();
    transitions.forEach((state, bySymbol) -> {
      final Map<String, List<String>> dumped = new LinkedHashMap<>();
      bySymbol.forEach((symbol, targets) -> dumped.put(symbol, List.copyOf(targets)));
      dumpedTransitions.put(state, dumped);
    });
    return new NfaDump(
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
   * Every state, symbol, start, final and transition is replayed through the
   * usual mutators, so a dump with dangling references is rejected. On
   * rejection this automaton is left untouched.
   *
   * @param dump serialized automaton
   */
  public void loadDump(NfaDump dump) {
    replaceWith(fromDump(dump));
  }

  public static Nfa fromDump(NfaDump dump) {
    final var nfa = new Nfa();
    dump.states().forEach(nfa::addState);
    dump.symbols().forEach(nfa::addSymbol);
    nfa.setStart(dump.start());
    dump.finals().forEach(nfa::addFinal);
    dump.transitions().forEach((from, bySymbol) ->
      bySymbol.forEach((symbol, targets) ->
        targets.forEach(to -> nfa.addTransition(from, symbol, to))
      )
    );
    return nfa;
  }

  @Override
  protected Set<String> withTarget(Set<String> current, String to) {
    final Set<String> targets = current == null ? new LinkedHashSet<>() : current;
    targets.add(to);
    return targets;
  }

  @Override
  protected boolean dropTarget(Set<String> current, String to) {
    current.remove(to);
    return current.isEmpty();
  }

  @Override
  protected Set<String> copyTarget(Set<String> target) {
    return new LinkedHashSet<>(target);
  }

  @Override
  protected String signature() {
    return "δ : Q × Σ → P(Q)";
  }

  @Override
  protected String renderTarget(Set<String> target) {
    return braced(new TreeSet<>(target));
  }

  @Override
  protected String emptyCell() {
    return "{}";
  }
}
