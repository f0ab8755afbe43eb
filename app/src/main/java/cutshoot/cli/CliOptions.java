package cutshoot.cli;

import cutshoot.allocation.BackendPredicate;
import cutshoot.allocation.UniformSplitStrategy;
import cutshoot.core.ScheduleOptions;
import cutshoot.objective.ObjectiveMode;
import cutshoot.objective.QosWeights;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command line. Every override is nullable; a null field keeps the value from the problem
 * file (or the built-in example).
 */
record CliOptions(
    String problemFile,
    String exampleName,
    Path outputFile,
    Integer maxQubitsPerSubcircuit,
    Integer numSubcircuits,
    ObjectiveMode objectiveMode,
    Double priceWeight,
    Double reliabilityWeight,
    List<BackendPredicate> predicates,
    Boolean uniformSplit,
    UniformSplitStrategy uniformSplitStrategy,
    Integer shotsPerSubcircuit,
    Long solverTimeLimitMs,
    String solverId,
    Boolean combined,
    Integer solutionPoolSize,
    List<Integer> sweepSubcircuits,
    Integer parallelism) {

  CliOptions {
    predicates = predicates == null ? List.of() : List.copyOf(predicates);
    sweepSubcircuits = sweepSubcircuits == null ? List.of() : List.copyOf(sweepSubcircuits);
    if (hasText(problemFile) && hasText(exampleName)) {
      throw new IllegalArgumentException("Use either --file or --example, not both");
    }
  }

  boolean hasProblemFile() {
    return hasText(problemFile);
  }

  boolean hasExample() {
    return hasText(exampleName);
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  /** Applies the command-line overrides on top of {@code base}. */
  ScheduleOptions applyTo(ScheduleOptions base) {
    ScheduleOptions.Builder builder = base.toBuilder();
    if (maxQubitsPerSubcircuit != null) {
      builder.maxQubitsPerSubcircuit(maxQubitsPerSubcircuit);
    }
    if (numSubcircuits != null) {
      builder.numSubcircuits(numSubcircuits);
    }
    if (objectiveMode != null) {
      builder.objectiveMode(objectiveMode);
    }
    if (priceWeight != null || reliabilityWeight != null) {
      QosWeights current = base.qosWeights() == null ? QosWeights.none() : base.qosWeights();
      builder.qosWeights(
          new QosWeights(
              priceWeight != null ? priceWeight : current.priceWeight(),
              reliabilityWeight != null ? reliabilityWeight : current.reliabilityWeight()));
    }
    if (!predicates.isEmpty()) {
      List<BackendPredicate> merged = new ArrayList<>(base.predicates());
      merged.addAll(predicates);
      builder.predicates(merged);
    }
    if (uniformSplit != null) {
      builder.uniformSplit(uniformSplit);
    }
    if (uniformSplitStrategy != null) {
      builder.uniformSplitStrategy(uniformSplitStrategy);
    }
    if (shotsPerSubcircuit != null) {
      builder.shotsPerSubcircuit(shotsPerSubcircuit);
    }
    if (solverTimeLimitMs != null) {
      builder.solverTimeLimitMs(solverTimeLimitMs);
    }
    if (solverId != null) {
      builder.solverId(solverId);
    }
    if (combined != null) {
      builder.combined(combined);
    }
    if (solutionPoolSize != null) {
      builder.solutionPoolSize(solutionPoolSize);
    }
    return builder.build();
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private String problemFile;
    private String exampleName;
    private Path outputFile;
    private Integer maxQubitsPerSubcircuit;
    private Integer numSubcircuits;
    private ObjectiveMode objectiveMode;
    private Double priceWeight;
    private Double reliabilityWeight;
    private final List<BackendPredicate> predicates = new ArrayList<>();
    private Boolean uniformSplit;
    private UniformSplitStrategy uniformSplitStrategy;
    private Integer shotsPerSubcircuit;
    private Long solverTimeLimitMs;
    private String solverId;
    private Boolean combined;
    private Integer solutionPoolSize;
    private List<Integer> sweepSubcircuits = List.of();
    private Integer parallelism;

    Builder problemFile(String value) {
      this.problemFile = value;
      return this;
    }

    Builder exampleName(String value) {
      this.exampleName = value;
      return this;
    }

    Builder outputFile(Path value) {
      this.outputFile = value;
      return this;
    }

    Builder maxQubitsPerSubcircuit(int value) {
      this.maxQubitsPerSubcircuit = value;
      return this;
    }

    Builder numSubcircuits(int value) {
      this.numSubcircuits = value;
      return this;
    }

    Builder objectiveMode(ObjectiveMode value) {
      this.objectiveMode = value;
      return this;
    }

    Builder priceWeight(double value) {
      this.priceWeight = value;
      return this;
    }

    Builder reliabilityWeight(double value) {
      this.reliabilityWeight = value;
      return this;
    }

    Builder addPredicate(BackendPredicate value) {
      this.predicates.add(value);
      return this;
    }

    Builder uniformSplit(boolean value) {
      this.uniformSplit = value;
      return this;
    }

    Builder uniformSplitStrategy(UniformSplitStrategy value) {
      this.uniformSplitStrategy = value;
      return this;
    }

    Builder shotsPerSubcircuit(int value) {
      this.shotsPerSubcircuit = value;
      return this;
    }

    Builder solverTimeLimitMs(long value) {
      this.solverTimeLimitMs = value;
      return this;
    }

    Builder solverId(String value) {
      this.solverId = value;
      return this;
    }

    Builder combined(boolean value) {
      this.combined = value;
      return this;
    }

    Builder solutionPoolSize(int value) {
      this.solutionPoolSize = value;
      return this;
    }

    Builder sweepSubcircuits(List<Integer> value) {
      this.sweepSubcircuits = List.copyOf(value);
      return this;
    }

    Builder parallelism(int value) {
      this.parallelism = value;
      return this;
    }

    CliOptions build() {
      return new CliOptions(
          problemFile,
          exampleName,
          outputFile,
          maxQubitsPerSubcircuit,
          numSubcircuits,
          objectiveMode,
          priceWeight,
          reliabilityWeight,
          predicates,
          uniformSplit,
          uniformSplitStrategy,
          shotsPerSubcircuit,
          solverTimeLimitMs,
          solverId,
          combined,
          solutionPoolSize,
          sweepSubcircuits,
          parallelism);
    }
  }
}
