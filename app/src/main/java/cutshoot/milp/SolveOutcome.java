package cutshoot.milp;

import cutshoot.core.SolveStatus;

/** Status and objective figures reported by one {@link MilpModel#solve()} call. */
public record SolveOutcome(
    SolveStatus status,
    boolean hasSolution,
    double objectiveValue,
    double bestBound,
    long wallTimeMs) {

  public static SolveOutcome withoutSolution(SolveStatus status, long wallTimeMs) {
    return new SolveOutcome(status, false, Double.NaN, Double.NaN, wallTimeMs);
  }
}
