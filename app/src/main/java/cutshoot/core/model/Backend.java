package cutshoot.core.model;

import cutshoot.core.InvalidInputException;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Immutable execution backend descriptor for one scheduling run.
 *
 * <p>{@code executionTime} is the time needed to run a partition's whole shot budget; a partition
 * of size {@code d} costs {@code executionTime + executionTimePerUnit * d}. Price (per shot),
 * reliability and region are optional.
 */
public record Backend(
    String id,
    double executionTime,
    double executionTimePerUnit,
    double queueTime,
    int capacity,
    Double price,
    Double reliability,
    String region) {

  public Backend {
    InvalidInputException.require(id != null && !id.isBlank(), "backend id must be non-blank");
    requireFiniteNonNegative(executionTime, id, "execution time");
    requireFiniteNonNegative(executionTimePerUnit, id, "execution time per unit");
    requireFiniteNonNegative(queueTime, id, "queue time");
    InvalidInputException.require(capacity >= 0, "backend " + id + " has negative capacity");
    if (price != null) {
      requireFiniteNonNegative(price, id, "price");
    }
    if (reliability != null) {
      InvalidInputException.require(
          reliability >= 0.0 && reliability <= 1.0,
          "backend " + id + " reliability must lie in [0, 1]: " + reliability);
    }
    region = region == null || region.isBlank() ? null : region;
  }

  public static Backend of(String id, double executionTime, double queueTime, int capacity) {
    return builder(id).executionTime(executionTime).queueTime(queueTime).capacity(capacity).build();
  }

  public static Builder builder(String id) {
    return new Builder(id);
  }

  /** Execution-time estimate for a partition that needs {@code size} resource units. */
  public double executionTimeFor(int size) {
    return executionTime + executionTimePerUnit * size;
  }

  public boolean isSizeDependent() {
    return executionTimePerUnit > 0.0;
  }

  public boolean canHost(int size) {
    return size <= capacity;
  }

  public OptionalDouble priceIfKnown() {
    return price == null ? OptionalDouble.empty() : OptionalDouble.of(price);
  }

  public OptionalDouble reliabilityIfKnown() {
    return reliability == null ? OptionalDouble.empty() : OptionalDouble.of(reliability);
  }

  public Optional<String> regionIfKnown() {
    return Optional.ofNullable(region);
  }

  /** Returns a copy with overridden metrics; this descriptor is left untouched. */
  public Backend withMetrics(double executionTime, double queueTime, int capacity) {
    return toBuilder().executionTime(executionTime).queueTime(queueTime).capacity(capacity).build();
  }

  public Builder toBuilder() {
    return new Builder(id)
        .executionTime(executionTime)
        .executionTimePerUnit(executionTimePerUnit)
        .queueTime(queueTime)
        .capacity(capacity)
        .price(price)
        .reliability(reliability)
        .region(region);
  }

  private static void requireFiniteNonNegative(double value, String id, String what) {
    InvalidInputException.require(
        Double.isFinite(value) && value >= 0.0,
        "backend " + id + " has invalid " + what + ": " + value);
  }

  /** Fluent builder used by loaders and tests. */
  public static final class Builder {
    private final String id;
    private double executionTime;
    private double executionTimePerUnit;
    private double queueTime;
    private int capacity = Integer.MAX_VALUE;
    private Double price;
    private Double reliability;
    private String region;

    private Builder(String id) {
      this.id = Objects.requireNonNull(id, "id");
    }

    public Builder executionTime(double executionTime) {
      this.executionTime = executionTime;
      return this;
    }

    public Builder executionTimePerUnit(double executionTimePerUnit) {
      this.executionTimePerUnit = executionTimePerUnit;
      return this;
    }

    public Builder queueTime(double queueTime) {
      this.queueTime = queueTime;
      return this;
    }

    public Builder capacity(int capacity) {
      this.capacity = capacity;
      return this;
    }

    public Builder price(Double price) {
      this.price = price;
      return this;
    }

    public Builder reliability(Double reliability) {
      this.reliability = reliability;
      return this;
    }

    public Builder region(String region) {
      this.region = region;
      return this;
    }

    public Backend build() {
      return new Backend(
          id, executionTime, executionTimePerUnit, queueTime, capacity, price, reliability, region);
    }
  }
}
