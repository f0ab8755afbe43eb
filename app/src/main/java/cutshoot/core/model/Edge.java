package cutshoot.core.model;

/** Directed dependency between two vertices of a {@link WorkloadGraph}. */
public record Edge(int index, int source, int target) {

  public Edge {
    if (index < 0) {
      throw new IllegalArgumentException("edge index must be non-negative");
    }
  }

  @Override
  public String toString() {
    return source + "->" + target;
  }
}
