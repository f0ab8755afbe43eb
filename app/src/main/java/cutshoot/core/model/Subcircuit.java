package cutshoot.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Non-empty partition produced by the partitioner.
 *
 * @param cutsIn targets of incoming cut edges (vertices needing an initialised input)
 * @param cutsOut sources of outgoing cut edges (vertices measured out)
 */
public record Subcircuit(
    int index,
    List<Integer> vertices,
    PartitionAggregates aggregates,
    List<Integer> cutsIn,
    List<Integer> cutsOut) {

  public Subcircuit {
    Objects.requireNonNull(aggregates, "aggregates");
    vertices = List.copyOf(vertices);
    cutsIn = List.copyOf(cutsIn);
    cutsOut = List.copyOf(cutsOut);
  }

  public int size() {
    return aggregates.d();
  }
}
