package cutshoot.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import cutshoot.core.InvalidInputException;
import java.util.List;
import org.junit.jupiter.api.Test;

final class WorkloadGraphTest {

  @Test
  void pathGraphHasChainedUnitVertices() {
    WorkloadGraph graph = WorkloadGraph.path(4);

    assertEquals(4, graph.vertexCount(), "Path of four vertices");
    assertEquals(3, graph.edgeCount(), "Chain of four vertices has three edges");
    assertEquals(4, graph.totalWeight(), "Unit weights add up to the vertex count");
    assertEquals(new Edge(1, 1, 2), graph.edge(1), "Edges are indexed in insertion order");
  }

  @Test
  void parallelEdgesAreKeptAsSeparateWires() {
    WorkloadGraph graph =
        WorkloadGraph.of(new int[] {2, 3, 1}, List.of(new int[] {0, 1}, new int[] {0, 1}));

    assertEquals(2, graph.edgeCount(), "Each (source, target) pair is its own edge");
    assertEquals(new Edge(1, 0, 1), graph.edge(1), "The second wire keeps its own index");
    assertEquals(3, graph.maxWeight(), "Largest vertex weight");
    assertEquals(6, graph.totalWeight(), "Sum of weights");
  }

  @Test
  void rejectsCycles() {
    assertThrows(
        InvalidInputException.class,
        () ->
            WorkloadGraph.of(
                new int[] {1, 1, 1},
                List.of(new int[] {0, 1}, new int[] {1, 2}, new int[] {2, 0})),
        "A cycle is not a valid workload graph");
  }

  @Test
  void rejectsMalformedInput() {
    assertThrows(
        InvalidInputException.class,
        () -> WorkloadGraph.of(new int[] {1, -1}, List.of()),
        "Negative weights are rejected");
    assertThrows(
        InvalidInputException.class,
        () -> WorkloadGraph.of(new int[] {1, 1}, List.<int[]>of(new int[] {0, 5})),
        "Edges must reference known vertices");
    assertThrows(
        InvalidInputException.class,
        () -> WorkloadGraph.of(new int[] {1, 1}, List.<int[]>of(new int[] {1, 1})),
        "Self loops are rejected");
    assertThrows(
        InvalidInputException.class,
        () -> WorkloadGraph.builder().build(),
        "An empty graph is rejected");
  }

  @Test
  void weightsAreDefensivelyCopied() {
    WorkloadGraph graph = WorkloadGraph.of(new int[] {1, 2}, List.<int[]>of(new int[] {0, 1}));
    int[] weights = graph.weights();
    weights[0] = 99;

    assertEquals(1, graph.weight(0), "Mutating the returned array must not affect the graph");
  }
}
