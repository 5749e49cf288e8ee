package workbench;

/**
 * Thrown when adding a symbol already in the alphabet.
 */
public class DuplicateSymbolException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -3340188212740259067L;

  public DuplicateSymbolException(String name) {
    super("Symbol already exists: " + name, name);
  }
}
