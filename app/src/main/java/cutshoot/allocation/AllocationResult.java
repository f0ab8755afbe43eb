package cutshoot.allocation;

import cutshoot.core.SolveStatus;
import cutshoot.core.diagnostics.ScheduleDiagnostic;
import cutshoot.core.model.Allocation;
import cutshoot.objective.ObjectiveTerm;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one allocation run; {@code solution} is null when no allocation exists.
 *
 * @param termValues unweighted value of each objective term at the solution
 */
public record AllocationResult(
    SolveStatus status,
    double objectiveValue,
    AllocationSolution solution,
    Map<ObjectiveTerm, Double> termValues,
    List<ScheduleDiagnostic> diagnostics,
    long elapsedMillis) {

  public AllocationResult {
    Objects.requireNonNull(status, "status");
    termValues = termValues == null ? Map.of() : Map.copyOf(termValues);
    diagnostics = List.copyOf(diagnostics);
  }

  public static AllocationResult infeasible(
      List<ScheduleDiagnostic> diagnostics, long elapsedMillis) {
    return new AllocationResult(
        SolveStatus.INFEASIBLE, Double.NaN, null, Map.of(), diagnostics, elapsedMillis);
  }

  public boolean hasSolution() {
    return solution != null;
  }

  public Allocation allocation() {
    if (solution == null) {
      throw new IllegalStateException("no allocation available (status " + status + ")");
    }
    return solution.allocation();
  }

  public double makespan() {
    return solution == null ? Double.NaN : solution.makespan();
  }
}
