package cutshoot.partition;

import cutshoot.core.SolveStatus;
import cutshoot.core.diagnostics.ScheduleDiagnostic;
import java.util.List;
import java.util.Objects;

/** Outcome of one partitioning run; {@code layout} is null when no solution exists. */
public record PartitionResult(
    SolveStatus status,
    double objectiveValue,
    PartitionLayout layout,
    List<ScheduleDiagnostic> diagnostics,
    long elapsedMillis) {

  public PartitionResult {
    Objects.requireNonNull(status, "status");
    diagnostics = List.copyOf(diagnostics);
  }

  public static PartitionResult infeasible(
      List<ScheduleDiagnostic> diagnostics, long elapsedMillis) {
    return new PartitionResult(
        SolveStatus.INFEASIBLE, Double.NaN, null, diagnostics, elapsedMillis);
  }

  public boolean hasSolution() {
    return layout != null;
  }

  public int cutCount() {
    if (layout == null) {
      throw new IllegalStateException("no partition available (status " + status + ")");
    }
    return layout.cutCount();
  }
}
