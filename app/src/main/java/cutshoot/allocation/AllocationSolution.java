package cutshoot.allocation;

import cutshoot.core.model.Allocation;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Allocation read back from a solved model with the per-backend busy times it implies.
 *
 * @param busyTimes queue plus accumulated execution share of every used backend, in backend order
 * @param makespan largest busy time
 */
public record AllocationSolution(
    Allocation allocation, Map<String, Double> busyTimes, double makespan) {

  public AllocationSolution {
    Objects.requireNonNull(allocation, "allocation");
    busyTimes = Collections.unmodifiableMap(new LinkedHashMap<>(busyTimes));
  }
}
