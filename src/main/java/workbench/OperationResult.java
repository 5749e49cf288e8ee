package workbench;

/**
 * Outcome of a manager operation whose failure is reported rather than thrown.
 *
 * @param success whether the operation went through
 * @param message status for display
 */
public record OperationResult(boolean success, String message) {

  public static OperationResult ok(String message) {
    return new OperationResult(true, message);
  }

  public static OperationResult failure(String message) {
    return new OperationResult(false, message);
  }
}
