package workbench;

/**
 * Thrown when an edit refers to a state the automaton does not have.
 */
public class UnknownStateException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 8803716052193864421L;

  public UnknownStateException(String name) {
    super("No such state: " + name, name);
  }
}
