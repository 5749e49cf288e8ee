package workbench.io;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Null handling shared by the dump records.
 *
 * A missing field reads as empty, but a {@code null} inside a field is
 * rejected, since it cannot name a state or symbol.
 */
final class DumpEntries {

  private DumpEntries() {
  }

  static List<String> names(List<String> names, String field) {
    if (names == null) {
      return List.of();
    }
    requireNoNulls(names, field);
    return List.copyOf(names);
  }

  /**
   * Check that every state has a symbol map and every symbol a target.
   *
   * @param transitions state to symbol to target(s), possibly {@code null}
   * @return the transitions, or an empty map if there were none
   */
  static <T> Map<String, Map<String, T>> transitions(Map<String, Map<String, T>> transitions) {
    if (transitions == null) {
      return Map.of();
    }
    transitions.forEach((state, bySymbol) -> {
      if (bySymbol == null) {
        throw new IllegalArgumentException("null transitions for state " + state);
      }
      bySymbol.forEach((symbol, target) -> {
        if (target == null) {
          throw new IllegalArgumentException("null target for (" + state + ", " + symbol + ")");
        }
      });
    });
    return transitions;
  }

  static void requireNoNulls(Collection<?> entries, String field) {
    if (entries.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("null entry in " + field);
    }
  }
}
