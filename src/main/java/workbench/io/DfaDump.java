package workbench.io;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;

import workbench.Mode;

/**
 * Dump of a {@link workbench.Dfa}.
 *
 * @param states states, in insertion order
 * @param symbols symbols, in insertion order
 * @param start start state, or {@code null}
 * @param finals accepting states
 * @param transitions state to symbol to target state
 */
@JsonPropertyOrder({"states", "symbols", "start", "finals", "transitions"})
public record DfaDump(
  @JsonProperty("states") List<String> states,
  @JsonProperty("symbols") List<String> symbols,
  @JsonProperty("start") String start,
  @JsonProperty("finals") List<String> finals,
  @JsonProperty("transitions") Map<String, Map<String, String>> transitions
) implements AutomatonDump {

  // Missing fields read as empty, null entries are rejected
  public DfaDump {
    states = DumpEntries.names(states, "states");
    symbols = DumpEntries.names(symbols, "symbols");
    finals = DumpEntries.names(finals, "finals");
    transitions = DumpEntries.transitions(transitions);
  }

  @Override
  public Mode mode() {
    return Mode.DFA;
  }
}
