package cutshoot.testing;

import cutshoot.milp.SolverSettings;

/**
 * Centralized test configuration knobs. Lets Maven/JVM runners bound solver time via environment
 * variables or system properties.
 */
public final class TestDefaults {
  private static final String TIME_LIMIT_PROPERTY = "cutshoot.solverTimeLimitMs";
  private static final String TIME_LIMIT_ENV = "CUTSHOOT_SOLVER_TIME_LIMIT_MS";
  private static final long DEFAULT_TIME_LIMIT_MS = 20_000L;

  private TestDefaults() {}

  /**
   * Returns the per-solve time limit for tests. Defaults to 20 seconds but can be overridden via
   * the system property {@code cutshoot.solverTimeLimitMs} or environment variable {@code
   * CUTSHOOT_SOLVER_TIME_LIMIT_MS}.
   */
  public static long solverTimeLimitMs() {
    String propertyValue = System.getProperty(TIME_LIMIT_PROPERTY);
    if (propertyValue != null) {
      try {
        return Long.parseLong(propertyValue);
      } catch (NumberFormatException ignored) {
        // fall back to env/default
      }
    }
    String envValue = System.getenv(TIME_LIMIT_ENV);
    if (envValue != null) {
      try {
        return Long.parseLong(envValue);
      } catch (NumberFormatException ignored) {
        // fall through
      }
    }
    return DEFAULT_TIME_LIMIT_MS;
  }

  /** SCIP with the test time limit and seed 0. */
  public static SolverSettings solverSettings() {
    return new SolverSettings(SolverSettings.SCIP, solverTimeLimitMs(), 0);
  }
}
