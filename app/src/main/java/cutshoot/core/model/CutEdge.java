package cutshoot.core.model;

import java.util.Objects;

/** An edge that crosses the boundary of {@code partition}. */
public record CutEdge(Edge edge, int partition, Direction direction) {

  public CutEdge {
    Objects.requireNonNull(edge, "edge");
    Objects.requireNonNull(direction, "direction");
  }

  /** {@code IN}: the edge target lives in the partition. {@code OUT}: the source does. */
  public enum Direction {
    IN,
    OUT
  }
}
