package workbench;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Conversion of an NFA into an equivalent DFA.
 *
 * Each DFA state stands for an {@code ε}-closed subset of NFA states. Subsets
 * are named {@code q0} (the start), then {@code q1}, {@code q2}, ... in the
 * order a breadth-first exploration discovers them, so converting the same NFA
 * twice gives the same names.
 */
public final class SubsetConstruction {

  private static final Logger LOG = LoggerFactory.getLogger(SubsetConstruction.class);

  /**
   * Output of the construction.
   *
   * @param dfa deterministic automaton, total over its alphabet
   * @param names generated DFA state name for each NFA subset, in discovery order
   */
  public record Result(Dfa dfa, Map<StateSet, String> names) {

    /**
     * Invert {@link #names()}.
     *
     * @return NFA subset behind each DFA state, in discovery order
     */
    public Map<String, StateSet> subsets() {
      final var inverse = new LinkedHashMap<String, StateSet>();
      names.forEach((subset, name) -> inverse.put(name, subset));
      return Collections.unmodifiableMap(inverse);
    }
  }

  private SubsetConstruction() {
  }

  /**
   * Run the subset construction.
   *
   * Transitions out of a subset on symbol {@code a} lead to the {@code ε}-closure
   * of the union of the NFA's {@code a} transitions. A union which is empty
   * leads to a single dead state, which loops to itself on every symbol and
   * is never accepting. This makes the output total even when the NFA is not.
   *
   * @param nfa input automaton
   * @return the DFA and the subset naming, both empty if the NFA has no start
   */
  public static Result determinize(Nfa nfa) {
    if (nfa.start() == null) {
      LOG.debug("NFA has no start state, producing an empty DFA");
      return new Result(new Dfa(), Map.of());
    }

    // The DFA reads everything but `ε`
    final List<String> alphabet = nfa
      .symbols()
      .stream()
      .filter(symbol -> !Automaton.EPSILON.equals(symbol))
      .collect(Collectors.toList());

    final var dfa = new Dfa();
    alphabet.forEach(dfa::addSymbol);

    final var names = new LinkedHashMap<StateSet, String>();
    final Queue<StateSet> toVisit = new ArrayDeque<>();
    int nextId = 0;

    // Seed the search with the closure of the start state
    {
      final var initial = new StateSet(nfa.initialConfiguration());
      final String name = "q" + nextId++;
      names.put(initial, name);
      dfa.addState(name);
      dfa.setStart(name);
      if (initial.intersects(nfa.finals())) {
        dfa.addFinal(name);
      }
      toVisit.add(initial);
    }

    // BFS loop
    while (!toVisit.isEmpty()) {
      final StateSet powerState = toVisit.poll();
      final String from = names.get(powerState);

      for (String symbol : alphabet) {
        final var reached = new LinkedHashSet<String>();
        for (String state : powerState) {
          reached.addAll(nfa.destinations(state, symbol));
        }
        final StateSet target = reached.isEmpty()
          ? StateSet.EMPTY
          : new StateSet(nfa.epsilonClosure(reached));

        String to = names.get(target);
        if (to == null) {
          to = "q" + nextId++;
          names.put(target, to);
          dfa.addState(to);

          if (target.isEmpty()) {
            for (String deadSymbol : alphabet) {
              dfa.addTransition(to, deadSymbol, to);
            }
            LOG.debug("Dead state {} created on {} from {}", to, symbol, from);
          } else {
            if (target.intersects(nfa.finals())) {
              dfa.addFinal(to);
            }
            toVisit.add(target);
          }
        }

        dfa.addTransition(from, symbol, to);
      }
    }

    LOG.debug("Subset construction produced {} DFA states from {} NFA states", names.size(), nfa.states().size());
    return new Result(dfa, Collections.unmodifiableMap(names));
  }
}
