package cutshoot.util;

import cutshoot.core.model.Edge;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/** Graph helpers shared by validation and the partitioner. */
public final class GraphUtils {
  private GraphUtils() {}

  /** Kahn ordering of {@code 0..vertexCount-1}; empty when the edges contain a cycle. */
  public static Optional<List<Integer>> topologicalOrder(int vertexCount, List<Edge> edges) {
    int[] inDegree = new int[vertexCount];
    List<List<Integer>> successors = successors(vertexCount, edges);
    for (Edge edge : edges) {
      inDegree[edge.target()]++;
    }
    Deque<Integer> ready = new ArrayDeque<>();
    for (int v = 0; v < vertexCount; v++) {
      if (inDegree[v] == 0) {
        ready.add(v);
      }
    }
    List<Integer> order = new ArrayList<>(vertexCount);
    while (!ready.isEmpty()) {
      int current = ready.poll();
      order.add(current);
      for (int next : successors.get(current)) {
        if (--inDegree[next] == 0) {
          ready.add(next);
        }
      }
    }
    return order.size() == vertexCount ? Optional.of(order) : Optional.empty();
  }

  public static List<List<Integer>> successors(int vertexCount, List<Edge> edges) {
    List<List<Integer>> successors = new ArrayList<>(vertexCount);
    for (int v = 0; v < vertexCount; v++) {
      successors.add(new ArrayList<>());
    }
    for (Edge edge : edges) {
      successors.get(edge.source()).add(edge.target());
    }
    return successors;
  }

  /** Number of weakly connected components. */
  public static int weakComponentCount(int vertexCount, List<Edge> edges) {
    int[] parent = new int[vertexCount];
    for (int v = 0; v < vertexCount; v++) {
      parent[v] = v;
    }
    int components = vertexCount;
    for (Edge edge : edges) {
      int left = find(parent, edge.source());
      int right = find(parent, edge.target());
      if (left != right) {
        parent[left] = right;
        components--;
      }
    }
    return components;
  }

  /** Smallest partition count that the total weight allows under {@code capacity}. */
  public static int minimumPartitions(int totalWeight, int capacity) {
    if (capacity <= 0) {
      return totalWeight == 0 ? 1 : Integer.MAX_VALUE;
    }
    return Math.max(1, (totalWeight + capacity - 1) / capacity);
  }

  private static int find(int[] parent, int v) {
    while (parent[v] != v) {
      parent[v] = parent[parent[v]];
      v = parent[v];
    }
    return v;
  }
}
