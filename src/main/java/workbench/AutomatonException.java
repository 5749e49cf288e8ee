package workbench;

/**
 * Rejected edit of an automaton.
 *
 * Mutators check every reference before touching any field, so an automaton
 * which threw one of these is exactly as it was before the call.
 */
public class AutomatonException extends IllegalArgumentException {

  @java.io.Serial
  private static final long serialVersionUID = 2184370905121367515L;

  /**
   * State or symbol which caused the failure (or the kind of automaton, for
   * failures not tied to one name).
   */
  public final String subject;

  public AutomatonException(String message, String subject) {
    super(message);
    this.subject = subject;
  }
}
