package cutshoot.pipeline;

import cutshoot.allocation.AllocationPrechecks;
import cutshoot.core.ScheduleOptions;
import cutshoot.core.model.Backend;
import cutshoot.core.model.WorkloadGraph;
import cutshoot.util.GraphUtils;
import java.util.List;

/**
 * Partition capacity and count actually used by a run.
 *
 * <p>An unset capacity becomes the largest capacity among admitted backends, bounded by what the
 * graph can ever need. An unset partition count becomes one more than the weight lower bound,
 * capped by the vertex count.
 */
public record ProblemSizing(int capacity, int partitions) {

  public static ProblemSizing resolve(
      WorkloadGraph graph, List<Backend> backends, ScheduleOptions options) {
    int capacity = options.maxQubitsPerSubcircuit();
    if (capacity <= 0) {
      int largest = AllocationPrechecks.largestAdmittedCapacity(backends, options.predicates());
      long graphBound = (long) graph.totalWeight() + graph.edgeCount();
      capacity = (int) Math.max(1L, Math.min(largest, graphBound));
    }
    int partitions = options.numSubcircuits();
    if (partitions <= 0) {
      int lowerBound = GraphUtils.minimumPartitions(graph.totalWeight(), capacity);
      partitions = Math.max(1, Math.min(graph.vertexCount(), lowerBound + 1));
    }
    return new ProblemSizing(capacity, partitions);
  }
}
