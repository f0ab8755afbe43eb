package cutshoot.allocation;

import cutshoot.core.InvalidInputException;
import cutshoot.core.model.Backend;
import cutshoot.objective.ObjectiveMode;
import cutshoot.objective.ObjectiveWeights;
import cutshoot.objective.QosWeights;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Inputs of one allocation run.
 *
 * @param uniformSplit split shots evenly among selected backends; ignored by
 *     {@link ObjectiveMode#SINGLE_SELECT}
 * @param postProcessingTime constant recombination time added to the objective
 */
public record AllocationRequest(
    List<Backend> backends,
    List<PartitionDemand> demands,
    ObjectiveMode mode,
    QosWeights qosWeights,
    List<BackendPredicate> predicates,
    boolean uniformSplit,
    UniformSplitStrategy strategy,
    ObjectiveWeights objectiveWeights,
    double postProcessingTime) {

  public AllocationRequest {
    InvalidInputException.require(
        backends != null && !backends.isEmpty(), "at least one backend is required");
    InvalidInputException.require(
        demands != null && !demands.isEmpty(), "at least one partition demand is required");
    backends = List.copyOf(backends);
    demands = List.copyOf(demands);
    mode = mode == null ? ObjectiveMode.SINGLE_SELECT : mode;
    qosWeights = qosWeights == null ? QosWeights.none() : qosWeights;
    predicates = predicates == null ? List.of() : List.copyOf(predicates);
    strategy = strategy == null ? UniformSplitStrategy.LOOKUP_TABLE : strategy;
    objectiveWeights = objectiveWeights == null ? ObjectiveWeights.defaults() : objectiveWeights;
    InvalidInputException.require(
        Double.isFinite(postProcessingTime) && postProcessingTime >= 0,
        "post-processing time must be non-negative");

    Set<String> ids = new HashSet<>();
    for (Backend backend : backends) {
      InvalidInputException.require(ids.add(backend.id()), "duplicate backend id: " + backend.id());
    }
    Set<Integer> partitions = new HashSet<>();
    for (PartitionDemand demand : demands) {
      InvalidInputException.require(
          partitions.add(demand.partition()), "duplicate partition demand: " + demand.partition());
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  ShotSplit shotSplit() {
    if (mode.singleBackend()) {
      return ShotSplit.SINGLE;
    }
    return uniformSplit ? ShotSplit.UNIFORM : ShotSplit.OPTIMIZED;
  }

  public boolean admits(Backend backend) {
    return BackendPredicates.admitsAll(predicates, backend);
  }

  public Builder toBuilder() {
    return new Builder()
        .backends(backends)
        .demands(demands)
        .mode(mode)
        .qosWeights(qosWeights)
        .predicates(predicates)
        .uniformSplit(uniformSplit)
        .strategy(strategy)
        .objectiveWeights(objectiveWeights)
        .postProcessingTime(postProcessingTime);
  }

  /** Builder; {@code uniformSplit} follows the mode unless set explicitly. */
  public static final class Builder {
    private List<Backend> backends = new ArrayList<>();
    private List<PartitionDemand> demands = new ArrayList<>();
    private ObjectiveMode mode = ObjectiveMode.SINGLE_SELECT;
    private QosWeights qosWeights = QosWeights.none();
    private List<BackendPredicate> predicates = new ArrayList<>();
    private Boolean uniformSplit;
    private UniformSplitStrategy strategy = UniformSplitStrategy.LOOKUP_TABLE;
    private ObjectiveWeights objectiveWeights = ObjectiveWeights.defaults();
    private double postProcessingTime;

    private Builder() {}

    public Builder backends(List<Backend> value) {
      this.backends = new ArrayList<>(value);
      return this;
    }

    public Builder addBackend(Backend backend) {
      backends.add(Objects.requireNonNull(backend, "backend"));
      return this;
    }

    public Builder demands(List<PartitionDemand> value) {
      this.demands = new ArrayList<>(value);
      return this;
    }

    public Builder addDemand(int partition, int size, int shots) {
      demands.add(new PartitionDemand(partition, size, shots));
      return this;
    }

    public Builder mode(ObjectiveMode value) {
      this.mode = value;
      return this;
    }

    public Builder qosWeights(QosWeights value) {
      this.qosWeights = value;
      return this;
    }

    public Builder predicates(List<BackendPredicate> value) {
      this.predicates = new ArrayList<>(value);
      return this;
    }

    public Builder addPredicate(BackendPredicate predicate) {
      predicates.add(Objects.requireNonNull(predicate, "predicate"));
      return this;
    }

    public Builder uniformSplit(Boolean value) {
      this.uniformSplit = value;
      return this;
    }

    public Builder strategy(UniformSplitStrategy value) {
      this.strategy = value;
      return this;
    }

    public Builder objectiveWeights(ObjectiveWeights value) {
      this.objectiveWeights = value;
      return this;
    }

    public Builder postProcessingTime(double value) {
      this.postProcessingTime = value;
      return this;
    }

    public AllocationRequest build() {
      ObjectiveMode resolvedMode = mode == null ? ObjectiveMode.SINGLE_SELECT : mode;
      boolean split = uniformSplit != null ? uniformSplit : resolvedMode.defaultUniformSplit();
      return new AllocationRequest(
          backends,
          demands,
          resolvedMode,
          qosWeights,
          predicates,
          split,
          strategy,
          objectiveWeights,
          postProcessingTime);
    }
  }
}
