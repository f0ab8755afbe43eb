package cutshoot.core;

/**
 * Raised when a problem description is rejected before any model is built (negative weights,
 * cyclic graphs, empty backend pools, non-positive shot budgets and similar).
 */
public class InvalidInputException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public InvalidInputException(String message) {
    super(message);
  }

  public InvalidInputException(String message, Throwable cause) {
    super(message, cause);
  }

  public static void require(boolean condition, String message) {
    if (!condition) {
      throw new InvalidInputException(message);
    }
  }
}
