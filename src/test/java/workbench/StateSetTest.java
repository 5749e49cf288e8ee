package workbench;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

public class StateSetTest {

  @Test
  void identityIgnoresOrderAndDuplicates() {
    final StateSet first = new StateSet(List.of("q2", "q0", "q1", "q0"));
    final StateSet second = StateSet.of("q0", "q1", "q2");

    Assertions.assertEquals(first, second);
    Assertions.assertEquals(first.hashCode(), second.hashCode());
    Assertions.assertEquals(3, first.size());
    Assertions.assertEquals("{q0, q1, q2}", first.toString());
    Assertions.assertNotEquals(StateSet.of("q0"), second);
  }

  @Test
  void membership() {
    final StateSet set = StateSet.of("b", "a");
    Assertions.assertTrue(set.contains("a"));
    Assertions.assertFalse(set.contains("c"));
    Assertions.assertTrue(set.intersects(Set.of("c", "b")));
    Assertions.assertFalse(set.intersects(Set.of("c")));
    Assertions.assertEquals(List.of("a", "b"), List.copyOf(set.toSet()));
  }

  @Test
  void empty() {
    Assertions.assertTrue(StateSet.EMPTY.isEmpty());
    Assertions.assertEquals(StateSet.EMPTY, new StateSet(Set.of()));
    Assertions.assertEquals("{}", StateSet.EMPTY.toString());
    Assertions.assertFalse(StateSet.EMPTY.intersects(Set.of("a")));
  }
}
