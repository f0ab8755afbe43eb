package cutshoot.core.model;

/**
 * Resource accounting of one partition: {@code a} owned units, {@code p} units introduced to
 * receive cut edges, {@code o} units measured out at cut edges, {@code f = a + p - o} units that
 * reach the final output and {@code d = a + p} units the partition occupies.
 *
 * <p>{@code f} may be negative: a fan-out vertex measured out on several cut edges counts once
 * per edge.
 */
public record PartitionAggregates(int a, int p, int o, int f, int d) {

  public PartitionAggregates {
    if (a < 0 || p < 0 || o < 0 || d < 0) {
      throw new IllegalArgumentException(
          "a, p, o and d must be non-negative: " + a + "," + p + "," + o + "," + d);
    }
    if (f != a + p - o) {
      throw new IllegalArgumentException("f must equal a + p - o");
    }
    if (d != a + p) {
      throw new IllegalArgumentException("d must equal a + p");
    }
  }

  public static PartitionAggregates of(int a, int p, int o) {
    return new PartitionAggregates(a, p, o, a + p - o, a + p);
  }

  public boolean isEmpty() {
    return d == 0;
  }
}
