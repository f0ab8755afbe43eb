package cutshoot.partition;

import cutshoot.core.model.WorkloadGraph;

/** Splits a workload graph into capacity-bounded partitions. */
public interface GraphPartitioner {

  /**
   * Assigns every vertex to one of at most {@code maxPartitions} partitions whose size
   * {@code d = a + p} stays within {@code capacity}, minimising the number of cut edges.
   * Infeasibility is reported through the result status, never relaxed.
   */
  PartitionResult partition(WorkloadGraph graph, int capacity, int maxPartitions);
}
