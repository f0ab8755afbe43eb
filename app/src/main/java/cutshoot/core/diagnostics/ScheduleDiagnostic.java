package cutshoot.core.diagnostics;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Structured entry describing why a run produced no schedule. */
public record ScheduleDiagnostic(
    Integer partitionIndex, DiagnosticReason reason, Map<String, Object> attributes) {

  public static final String ATTR_VERTEX = "vertex";
  public static final String ATTR_WEIGHT = "weight";
  public static final String ATTR_CAPACITY = "capacity";
  public static final String ATTR_MAX_PARTITIONS = "maxPartitions";
  public static final String ATTR_TOTAL_WEIGHT = "totalWeight";
  public static final String ATTR_SIZE = "size";
  public static final String ATTR_LARGEST_ELIGIBLE_CAPACITY = "largestEligibleCapacity";
  public static final String ATTR_EXCLUDED = "excludedBackends";
  public static final String ATTR_TIME_LIMIT_MS = "timeLimitMs";

  public ScheduleDiagnostic {
    Objects.requireNonNull(reason, "reason");
    attributes = (attributes == null || attributes.isEmpty()) ? Map.of() : Map.copyOf(attributes);
  }

  public static ScheduleDiagnostic vertexExceedsCapacity(int vertex, int weight, int capacity) {
    return new ScheduleDiagnostic(
        null,
        DiagnosticReason.VERTEX_EXCEEDS_CAPACITY,
        Map.of(ATTR_VERTEX, vertex, ATTR_WEIGHT, weight, ATTR_CAPACITY, capacity));
  }

  public static ScheduleDiagnostic partitionCapacity(
      int totalWeight, int capacity, int maxPartitions) {
    return new ScheduleDiagnostic(
        null,
        DiagnosticReason.PARTITION_CAPACITY,
        Map.of(
            ATTR_TOTAL_WEIGHT, totalWeight,
            ATTR_CAPACITY, capacity,
            ATTR_MAX_PARTITIONS, maxPartitions));
  }

  public static ScheduleDiagnostic predicatesExcludeAll(List<String> excluded) {
    return new ScheduleDiagnostic(
        null,
        DiagnosticReason.PREDICATES_EXCLUDE_ALL,
        Map.of(ATTR_EXCLUDED, List.copyOf(excluded)));
  }

  public static ScheduleDiagnostic noBackendCapacity(
      int partitionIndex, int size, int largestEligibleCapacity) {
    return new ScheduleDiagnostic(
        partitionIndex,
        DiagnosticReason.NO_BACKEND_CAPACITY,
        Map.of(ATTR_SIZE, size, ATTR_LARGEST_ELIGIBLE_CAPACITY, largestEligibleCapacity));
  }

  public static ScheduleDiagnostic noFeasibleAllocation() {
    return new ScheduleDiagnostic(null, DiagnosticReason.NO_FEASIBLE_ALLOCATION, Map.of());
  }

  public static ScheduleDiagnostic limitWithoutIncumbent(long timeLimitMs) {
    return new ScheduleDiagnostic(
        null,
        DiagnosticReason.SOLVER_LIMIT_WITHOUT_INCUMBENT,
        Map.of(ATTR_TIME_LIMIT_MS, timeLimitMs));
  }
}
