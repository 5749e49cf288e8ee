package workbench;

/**
 * Thrown when adding a state whose name is already taken.
 */
public class DuplicateStateException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = 6120937751304611832L;

  public DuplicateStateException(String name) {
    super("State already exists: " + name, name);
  }
}
