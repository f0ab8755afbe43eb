package cutshoot.milp;

import cutshoot.core.InvalidInputException;
import java.util.Locale;

/**
 * Engine selection and limits for one solve.
 *
 * @param solverId OR-Tools engine id, {@code SCIP} or {@code CBC}
 * @param timeLimitMs wall-clock limit, {@code 0} for none
 * @param randomSeed seed handed to the engine so repeated runs agree
 */
public record SolverSettings(String solverId, long timeLimitMs, int randomSeed) {

  public static final String SCIP = "SCIP";
  public static final String CBC = "CBC";

  public SolverSettings {
    solverId = solverId == null || solverId.isBlank() ? SCIP : solverId.toUpperCase(Locale.ROOT);
    InvalidInputException.require(timeLimitMs >= 0, "solver time limit must be non-negative");
  }

  public boolean hasTimeLimit() {
    return timeLimitMs > 0;
  }
}
