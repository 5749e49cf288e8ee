package workbench;

/**
 * Thrown when a deterministic automaton is asked to take the {@code ε} symbol.
 */
public class EpsilonNotAllowedException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 4471929038715296350L;

  public EpsilonNotAllowedException(String name) {
    super("Epsilon transitions are not allowed in a DFA: " + name, name);
  }
}
