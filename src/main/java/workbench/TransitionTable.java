package workbench;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Tabular view of a transition function.
 *
 * @param header first cell is {@code δ}, then one cell per symbol
 * @param rows one row per state: the state name, then one cell per symbol
 */
public record TransitionTable(List<String> header, List<List<String>> rows) {

  /**
   * Marker heading the state column.
   */
  public static final String DELTA = "δ";

  public TransitionTable {
    header = List.copyOf(header);
    rows = rows
      .stream()
      .map(List::copyOf)
      .collect(Collectors.toUnmodifiableList());
  }
}
