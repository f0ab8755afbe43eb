package cutshoot.partition;

import cutshoot.core.model.CutEdge;
import cutshoot.core.model.Subcircuit;
import java.util.List;

/**
 * Vertex assignment read back from a solved model.
 *
 * @param assignment partition index per vertex
 * @param subcircuits non-empty partitions in index order
 * @param cutCount physical cut edges (each counted once)
 */
public record PartitionLayout(
    List<Integer> assignment, List<CutEdge> cutEdges, List<Subcircuit> subcircuits, int cutCount) {

  public PartitionLayout {
    assignment = List.copyOf(assignment);
    cutEdges = List.copyOf(cutEdges);
    subcircuits = List.copyOf(subcircuits);
  }

  public int partitionOf(int vertex) {
    return assignment.get(vertex);
  }

  public int largestSize() {
    return subcircuits.stream().mapToInt(Subcircuit::size).max().orElse(0);
  }
}
