package cutshoot.core;

import cutshoot.allocation.AllocationResult;
import cutshoot.core.diagnostics.ScheduleDiagnostic;
import cutshoot.partition.PartitionResult;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated outcome of one scheduling run.
 *
 * @param partition partitioning outcome; null when the run stopped before partitioning
 * @param allocation allocation outcome; null when partitioning produced no layout
 * @param postProcessingCost recombination cost charged for the chosen cut count
 */
public record ScheduleResult(
    SolveStatus status,
    double objectiveValue,
    PartitionResult partition,
    AllocationResult allocation,
    double postProcessingCost,
    List<ScheduleDiagnostic> diagnostics,
    ScheduleOptions options,
    long elapsedMillis) {

  public ScheduleResult {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(options, "options");
    diagnostics = List.copyOf(diagnostics);
  }

  /** Whether both a layout and an allocation are present. */
  public boolean hasSchedule() {
    return partition != null
        && partition.hasSolution()
        && allocation != null
        && allocation.hasSolution();
  }

  public int cutCount() {
    return partition.cutCount();
  }

  public ScheduleResult withElapsed(long millis) {
    return new ScheduleResult(
        status,
        objectiveValue,
        partition,
        allocation,
        postProcessingCost,
        diagnostics,
        options,
        millis);
  }
}
