package workbench;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Immutable set of state names.
 *
 * Two sets holding the same names are equal regardless of the order the names
 * were supplied in, which makes this usable as the key identifying a subset
 * of NFA states during subset construction.
 */
public final class StateSet implements Iterable<String> {

  public static final StateSet EMPTY = new StateSet(List.of());

  // Sorted and distinct elements
  private final String[] elements;

  public static StateSet of(String... elems) {
    return new StateSet(Arrays.asList(elems));
  }

  public StateSet(Collection<String> elems) {
    this.elements = new TreeSet<String>(elems).toArray(new String[0]);
  }

  public Stream<String> stream() {
    return Arrays.stream(elements);
  }

  @Override
  public Iterator<String> iterator() {
    return stream().iterator();
  }

  public int size() {
    return elements.length;
  }

  public boolean isEmpty() {
    return elements.length == 0;
  }

  public boolean contains(String state) {
    return Arrays.binarySearch(elements, state) >= 0;
  }

  /**
   * Check whether any state in this set is also in {@code others}.
   *
   * @param others states to test against, eg. the accepting states of an NFA
   * @return whether the two sets share a state
   */
  public boolean intersects(Set<String> others) {
    return stream().anyMatch(others::contains);
  }

  /**
   * @return unmodifiable view of the names, in sorted order
   */
  public Set<String> toSet() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(elements)));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(elements);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    } else if (!(obj instanceof StateSet)) {
      return false;
    } else {
      return Arrays.equals(elements, ((StateSet) obj).elements);
    }
  }

  @Override
  public String toString() {
    return stream().collect(Collectors.joining(", ", "{", "}"));
  }
}
