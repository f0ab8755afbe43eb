package cutshoot.core.model;

import cutshoot.core.InvalidInputException;
import cutshoot.util.GraphUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable weighted DAG handed over by the graph-extraction step.
 *
 * <p>Vertices are the integers {@code 0..vertexCount-1}; the vertex order is significant because
 * the partitioner breaks label symmetry on it. Parallel edges are kept: each one is a separate wire
 * and is cut and counted on its own.
 */
public final class WorkloadGraph {
  private final int[] weights;
  private final List<Edge> edges;
  private final int totalWeight;
  private final int maxWeight;

  private WorkloadGraph(int[] weights, List<Edge> edges) {
    this.weights = weights;
    this.edges = List.copyOf(edges);
    this.totalWeight = Arrays.stream(weights).sum();
    this.maxWeight = Arrays.stream(weights).max().orElse(0);
  }

  /**
   * Builds a graph from vertex weights and {@code (source, target)} pairs.
   *
   * @throws InvalidInputException on negative weights, dangling or self-loop edges, or a cycle
   */
  public static WorkloadGraph of(int[] weights, List<int[]> edgePairs) {
    Builder builder = builder();
    for (int weight : Objects.requireNonNull(weights, "weights")) {
      builder.addVertex(weight);
    }
    for (int[] pair : Objects.requireNonNull(edgePairs, "edgePairs")) {
      InvalidInputException.require(
          pair != null && pair.length == 2, "edge must be a (source, target) pair");
      builder.addEdge(pair[0], pair[1]);
    }
    return builder.build();
  }

  /** Chain {@code 0 -> 1 -> ... -> n-1} with unit weights. */
  public static WorkloadGraph path(int vertexCount) {
    Builder builder = builder();
    for (int v = 0; v < vertexCount; v++) {
      builder.addVertex(1);
      if (v > 0) {
        builder.addEdge(v - 1, v);
      }
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public int vertexCount() {
    return weights.length;
  }

  public int edgeCount() {
    return edges.size();
  }

  public int weight(int vertex) {
    return weights[vertex];
  }

  public int[] weights() {
    return weights.clone();
  }

  public List<Edge> edges() {
    return edges;
  }

  public Edge edge(int index) {
    return edges.get(index);
  }

  public int totalWeight() {
    return totalWeight;
  }

  public int maxWeight() {
    return maxWeight;
  }

  @Override
  public String toString() {
    return "WorkloadGraph{vertices=" + weights.length + ", edges=" + edges.size() + "}";
  }

  /** Incremental builder; validation happens in {@link #build()}. */
  public static final class Builder {
    private final List<Integer> weights = new ArrayList<>();
    private final List<int[]> pairs = new ArrayList<>();

    private Builder() {}

    public Builder addVertex(int weight) {
      InvalidInputException.require(
          weight >= 0, "vertex " + weights.size() + " has negative weight " + weight);
      weights.add(weight);
      return this;
    }

    public Builder addEdge(int source, int target) {
      pairs.add(new int[] {source, target});
      return this;
    }

    public WorkloadGraph build() {
      InvalidInputException.require(!weights.isEmpty(), "graph has no vertices");
      int n = weights.size();
      List<Edge> edges = new ArrayList<>(pairs.size());
      for (int[] pair : pairs) {
        int source = pair[0];
        int target = pair[1];
        InvalidInputException.require(
            source >= 0 && source < n && target >= 0 && target < n,
            "edge " + source + "->" + target + " references an unknown vertex");
        InvalidInputException.require(source != target, "self loop on vertex " + source);
        edges.add(new Edge(edges.size(), source, target));
      }
      int[] weightArray = weights.stream().mapToInt(Integer::intValue).toArray();
      InvalidInputException.require(
          GraphUtils.topologicalOrder(n, edges).isPresent(), "graph contains a cycle");
      return new WorkloadGraph(weightArray, edges);
    }
  }
}
