package workbench.io;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

import workbench.Mode;

/**
 * Plain structural dump of an automaton.
 *
 * On disk this is a JSON object whose {@code mode} property ({@code NFA} or
 * {@code DFA}) says which kind of automaton the rest of the object describes.
 * Objects without a recognised {@code mode} are read as NFAs.
 */
@JsonTypeInfo(
  use = JsonTypeInfo.Id.NAME,
  include = JsonTypeInfo.As.PROPERTY,
  property = "mode",
  defaultImpl = NfaDump.class
)
@JsonSubTypes({
  @JsonSubTypes.Type(value = NfaDump.class, name = "NFA"),
  @JsonSubTypes.Type(value = DfaDump.class, name = "DFA")
})
public interface AutomatonDump {

  /**
   * @return states, in insertion order
   */
  List<String> states();

  /**
   * @return symbols, in insertion order
   */
  List<String> symbols();

  /**
   * @return start state, or {@code null}
   */
  String start();

  List<String> finals();

  /**
   * Kind of automaton described by the dump. Written to JSON as the type id,
   * not as an ordinary property.
   */
  Mode mode();
}
