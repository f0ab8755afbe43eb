package cutshoot.core;

import cutshoot.allocation.BackendPredicate;
import cutshoot.allocation.UniformSplitStrategy;
import cutshoot.milp.SolverSettings;
import cutshoot.objective.ObjectiveMode;
import cutshoot.objective.ObjectiveWeights;
import cutshoot.objective.PostProcessingCostModel;
import cutshoot.objective.QosWeights;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of one scheduling run.
 *
 * @param maxQubitsPerSubcircuit partition capacity; {@code 0} uses the largest eligible backend
 * @param numSubcircuits partition count upper bound; {@code 0} derives it from the total weight
 * @param uniformSplit null follows {@link ObjectiveMode#defaultUniformSplit()}
 * @param solverTimeLimitMs {@code 0} for no limit
 * @param combined solve partitioning and allocation in one model
 * @param solutionPoolSize cut strata explored for a non-linear post-processing cost
 */
public record ScheduleOptions(
    int maxQubitsPerSubcircuit,
    int numSubcircuits,
    ObjectiveMode objectiveMode,
    QosWeights qosWeights,
    List<BackendPredicate> predicates,
    Boolean uniformSplit,
    UniformSplitStrategy uniformSplitStrategy,
    int shotsPerSubcircuit,
    ObjectiveWeights objectiveWeights,
    PostProcessingCostModel postProcessing,
    long solverTimeLimitMs,
    String solverId,
    int randomSeed,
    boolean combined,
    int solutionPoolSize) {

  public static final int DEFAULT_SHOTS = 1024;
  public static final int DEFAULT_POOL_SIZE = 3;

  public ScheduleOptions {
    predicates = predicates == null ? List.of() : List.copyOf(predicates);
  }

  public static ScheduleOptions defaults() {
    return new ScheduleOptions(
        0,
        0,
        ObjectiveMode.SINGLE_SELECT,
        QosWeights.none(),
        List.of(),
        null,
        UniformSplitStrategy.LOOKUP_TABLE,
        DEFAULT_SHOTS,
        ObjectiveWeights.defaults(),
        PostProcessingCostModel.none(),
        0L,
        SolverSettings.SCIP,
        0,
        false,
        DEFAULT_POOL_SIZE);
  }

  /** Fills unset fields with defaults and rejects values that can never be valid. */
  public static ScheduleOptions normalize(ScheduleOptions options) {
    if (options == null) {
      return defaults();
    }
    ScheduleOptions defaults = defaults();
    InvalidInputException.require(
        options.maxQubitsPerSubcircuit() >= 0,
        "max_qubits_per_subcircuit must be at least 1: " + options.maxQubitsPerSubcircuit());
    InvalidInputException.require(
        options.numSubcircuits() >= 0,
        "num_subcircuits must be at least 1: " + options.numSubcircuits());
    InvalidInputException.require(
        options.shotsPerSubcircuit() >= 0,
        "shots_per_subcircuit must be positive: " + options.shotsPerSubcircuit());
    InvalidInputException.require(
        options.solverTimeLimitMs() >= 0, "solver_time_limit must be non-negative");
    InvalidInputException.require(
        options.solutionPoolSize() >= 0, "solution_pool_size must be non-negative");
    return new ScheduleOptions(
        options.maxQubitsPerSubcircuit(),
        options.numSubcircuits(),
        options.objectiveMode() != null ? options.objectiveMode() : defaults.objectiveMode(),
        options.qosWeights() != null ? options.qosWeights() : defaults.qosWeights(),
        options.predicates(),
        options.uniformSplit(),
        options.uniformSplitStrategy() != null
            ? options.uniformSplitStrategy()
            : defaults.uniformSplitStrategy(),
        options.shotsPerSubcircuit() > 0
            ? options.shotsPerSubcircuit()
            : defaults.shotsPerSubcircuit(),
        options.objectiveWeights() != null
            ? options.objectiveWeights()
            : defaults.objectiveWeights(),
        options.postProcessing() != null ? options.postProcessing() : defaults.postProcessing(),
        options.solverTimeLimitMs(),
        options.solverId() != null && !options.solverId().isBlank()
            ? options.solverId()
            : defaults.solverId(),
        options.randomSeed(),
        options.combined(),
        options.solutionPoolSize() > 0
            ? options.solutionPoolSize()
            : defaults.solutionPoolSize());
  }

  public boolean effectiveUniformSplit() {
    return uniformSplit != null ? uniformSplit : objectiveMode.defaultUniformSplit();
  }

  public SolverSettings solverSettings() {
    return new SolverSettings(solverId, solverTimeLimitMs, randomSeed);
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  public static Builder builder() {
    return new Builder(defaults());
  }

  /** Mutable builder seeded with defaults or an existing options value. */
  public static final class Builder {
    private int maxQubitsPerSubcircuit;
    private int numSubcircuits;
    private ObjectiveMode objectiveMode;
    private QosWeights qosWeights;
    private List<BackendPredicate> predicates;
    private Boolean uniformSplit;
    private UniformSplitStrategy uniformSplitStrategy;
    private int shotsPerSubcircuit;
    private ObjectiveWeights objectiveWeights;
    private PostProcessingCostModel postProcessing;
    private long solverTimeLimitMs;
    private String solverId;
    private int randomSeed;
    private boolean combined;
    private int solutionPoolSize;

    private Builder(ScheduleOptions seed) {
      this.maxQubitsPerSubcircuit = seed.maxQubitsPerSubcircuit();
      this.numSubcircuits = seed.numSubcircuits();
      this.objectiveMode = seed.objectiveMode();
      this.qosWeights = seed.qosWeights();
      this.predicates = new ArrayList<>(seed.predicates());
      this.uniformSplit = seed.uniformSplit();
      this.uniformSplitStrategy = seed.uniformSplitStrategy();
      this.shotsPerSubcircuit = seed.shotsPerSubcircuit();
      this.objectiveWeights = seed.objectiveWeights();
      this.postProcessing = seed.postProcessing();
      this.solverTimeLimitMs = seed.solverTimeLimitMs();
      this.solverId = seed.solverId();
      this.randomSeed = seed.randomSeed();
      this.combined = seed.combined();
      this.solutionPoolSize = seed.solutionPoolSize();
    }

    public Builder maxQubitsPerSubcircuit(int value) {
      this.maxQubitsPerSubcircuit = value;
      return this;
    }

    public Builder numSubcircuits(int value) {
      this.numSubcircuits = value;
      return this;
    }

    public Builder objectiveMode(ObjectiveMode value) {
      this.objectiveMode = value;
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

    public Builder addPredicate(BackendPredicate value) {
      this.predicates.add(value);
      return this;
    }

    public Builder uniformSplit(Boolean value) {
      this.uniformSplit = value;
      return this;
    }

    public Builder uniformSplitStrategy(UniformSplitStrategy value) {
      this.uniformSplitStrategy = value;
      return this;
    }

    public Builder shotsPerSubcircuit(int value) {
      this.shotsPerSubcircuit = value;
      return this;
    }

    public Builder objectiveWeights(ObjectiveWeights value) {
      this.objectiveWeights = value;
      return this;
    }

    public Builder postProcessing(PostProcessingCostModel value) {
      this.postProcessing = value;
      return this;
    }

    public Builder solverTimeLimitMs(long value) {
      this.solverTimeLimitMs = value;
      return this;
    }

    public Builder solverId(String value) {
      this.solverId = value;
      return this;
    }

    public Builder randomSeed(int value) {
      this.randomSeed = value;
      return this;
    }

    public Builder combined(boolean value) {
      this.combined = value;
      return this;
    }

    public Builder solutionPoolSize(int value) {
      this.solutionPoolSize = value;
      return this;
    }

    public ScheduleOptions build() {
      return new ScheduleOptions(
          maxQubitsPerSubcircuit,
          numSubcircuits,
          objectiveMode,
          qosWeights,
          predicates,
          uniformSplit,
          uniformSplitStrategy,
          shotsPerSubcircuit,
          objectiveWeights,
          postProcessing,
          solverTimeLimitMs,
          solverId,
          randomSeed,
          combined,
          solutionPoolSize);
    }
  }
}
