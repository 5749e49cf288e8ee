package workbench;

/**
 * Thrown when an edit refers to a symbol outside the alphabet.
 */
public class UnknownSymbolException extends AutomatonException {

  @java.io.Serial
  private static final long serialVersionUID = -1627730495886144150L;

  public UnknownSymbolException(String name) {
    super("Symbol not in alphabet: " + name, name);
  }
}
