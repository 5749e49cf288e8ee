package workbench;

/**
 * Conversion was requested on an automaton with no states.
 */
public class EmptyAutomatonException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -7032545166480213097L;

  /**
   * @param kind which automaton is empty, eg. {@code "NFA"}
   */
  public EmptyAutomatonException(String kind) {
    super(kind + " is empty", kind);
  }
}
