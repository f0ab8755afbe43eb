package cutshoot.core;

/** Terminal status of one optimisation run. */
public enum SolveStatus {
  OPTIMAL,
  /** Time limit hit before optimality was proven; an incumbent may or may not exist. */
  LIMIT_REACHED,
  INFEASIBLE,
  UNBOUNDED;

  public boolean isOptimal() {
    return this == OPTIMAL;
  }
}
