package cutshoot.allocation;

import cutshoot.core.InvalidInputException;

/**
 * One scheduling unit handed to the allocator.
 *
 * @param size units {@code d} the partition needs on a backend
 * @param shots shot budget that must be fully distributed
 */
public record PartitionDemand(int partition, int size, int shots) {

  public PartitionDemand {
    InvalidInputException.require(partition >= 0, "partition index must be non-negative");
    InvalidInputException.require(size >= 0, "partition size must be non-negative: " + size);
    InvalidInputException.require(shots > 0, "shot budget must be positive: " + shots);
  }
}
