package cutshoot.partition;

import cutshoot.core.InvalidInputException;
import cutshoot.core.diagnostics.ScheduleDiagnostic;
import cutshoot.core.model.WorkloadGraph;
import cutshoot.util.GraphUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Argument validation and cheap infeasibility proofs run before a partition model is built. */
public final class PartitionPrechecks {
  private PartitionPrechecks() {}

  public static void validate(WorkloadGraph graph, int capacity, int maxPartitions) {
    Objects.requireNonNull(graph, "graph");
    InvalidInputException.require(capacity >= 1, "capacity must be at least 1: " + capacity);
    InvalidInputException.require(
        maxPartitions >= 1, "number of partitions must be at least 1: " + maxPartitions);
  }

  /** Reasons that make the instance infeasible without solving; empty if none is derivable. */
  public static List<ScheduleDiagnostic> infeasibilityReasons(
      WorkloadGraph graph, int capacity, int maxPartitions) {
    List<ScheduleDiagnostic> reasons = new ArrayList<>();
    for (int v = 0; v < graph.vertexCount(); v++) {
      if (graph.weight(v) > capacity) {
        reasons.add(ScheduleDiagnostic.vertexExceedsCapacity(v, graph.weight(v), capacity));
      }
    }
    if (GraphUtils.minimumPartitions(graph.totalWeight(), capacity) > maxPartitions) {
      reasons.add(
          ScheduleDiagnostic.partitionCapacity(graph.totalWeight(), capacity, maxPartitions));
    }
    return reasons;
  }
}
