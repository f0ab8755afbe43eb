package cutshoot.allocation;

/** Chooses backends and distributes shot budgets for partitions of known size. */
public interface BackendAllocator {

  /**
   * Returns an allocation in which every partition's shots sum to its budget and no backend
   * rejected by a predicate or too small for the partition receives shots, or an infeasible
   * result naming the cause.
   */
  AllocationResult allocate(AllocationRequest request);
}
