package cutshoot.milp;

/** The solver engine could not be created, crashed, or returned an unrecognised status. */
public class SolverFailureException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public SolverFailureException(String message) {
    super(message);
  }

  public SolverFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
