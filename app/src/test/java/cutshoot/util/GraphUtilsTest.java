package cutshoot.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cutshoot.core.model.Edge;
import java.util.List;
import org.junit.jupiter.api.Test;

final class GraphUtilsTest {

  @Test
  void ordersVerticesTopologically() {
    List<Edge> edges = List.of(new Edge(0, 2, 0), new Edge(1, 0, 1));

    List<Integer> order = GraphUtils.topologicalOrder(3, edges).orElseThrow();

    assertTrue(order.indexOf(2) < order.indexOf(0), "2 precedes 0");
    assertTrue(order.indexOf(0) < order.indexOf(1), "0 precedes 1");
  }

  @Test
  void detectsCycles() {
    List<Edge> edges = List.of(new Edge(0, 0, 1), new Edge(1, 1, 0));

    assertTrue(GraphUtils.topologicalOrder(2, edges).isEmpty(), "Two-cycle has no ordering");
  }

  @Test
  void countsWeakComponents() {
    List<Edge> edges = List.of(new Edge(0, 0, 1), new Edge(1, 2, 1), new Edge(2, 3, 4));

    assertEquals(2, GraphUtils.weakComponentCount(5, edges), "{0,1,2} and {3,4}");
    assertEquals(3, GraphUtils.weakComponentCount(3, List.of()), "Isolated vertices");
  }

  @Test
  void minimumPartitionsRoundsUp() {
    assertEquals(3, GraphUtils.minimumPartitions(10, 4), "ceil(10 / 4)");
    assertEquals(1, GraphUtils.minimumPartitions(0, 4), "Weightless graphs still need one");
    assertEquals(
        Integer.MAX_VALUE, GraphUtils.minimumPartitions(1, 0), "Zero capacity never suffices");
  }
}
