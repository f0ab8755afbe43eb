package cutshoot.partition;

import cutshoot.core.SolveStatus;
import cutshoot.core.diagnostics.ScheduleDiagnostic;
import cutshoot.core.model.WorkloadGraph;
import cutshoot.milp.MilpModel;
import cutshoot.milp.SolveOutcome;
import cutshoot.milp.SolverSettings;
import cutshoot.objective.ObjectiveComposer;
import cutshoot.objective.ObjectiveTerm;
import cutshoot.objective.ObjectiveWeights;
import cutshoot.util.GraphUtils;
import cutshoot.util.Timing;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link GraphPartitioner} that minimises the cut count with a MILP. */
public final class MilpGraphPartitioner implements GraphPartitioner {
  private static final Logger LOG = LoggerFactory.getLogger(MilpGraphPartitioner.class);

  private final SolverSettings settings;
  private final boolean normalize;

  public MilpGraphPartitioner(SolverSettings settings) {
    this(settings, false);
  }

  /**
   * @param normalize divide the cut count by the edge count in the objective
   */
  public MilpGraphPartitioner(SolverSettings settings, boolean normalize) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.normalize = normalize;
  }

  @Override
  public PartitionResult partition(WorkloadGraph graph, int capacity, int maxPartitions) {
    return solve(graph, capacity, maxPartitions, -1);
  }

  /** Same as {@link #partition} but only accepts layouts with exactly {@code cutCount} cuts. */
  public PartitionResult partitionWithCutCount(
      WorkloadGraph graph, int capacity, int maxPartitions, int cutCount) {
    if (cutCount < 0) {
      throw new IllegalArgumentException("cut count must be non-negative: " + cutCount);
    }
    return solve(graph, capacity, maxPartitions, cutCount);
  }

  private PartitionResult solve(WorkloadGraph graph, int capacity, int maxPartitions, int cuts) {
    PartitionPrechecks.validate(graph, capacity, maxPartitions);
    Timing timing = Timing.start();
    List<ScheduleDiagnostic> reasons =
        PartitionPrechecks.infeasibilityReasons(graph, capacity, maxPartitions);
    if (!reasons.isEmpty()) {
      LOG.warn("Partitioning infeasible before solving: {}", reasons);
      return PartitionResult.infeasible(reasons, timing.elapsedMillis());
    }
    LOG.info(
        "Partitioning {} vertices / {} edges ({} weak components) into at most {} partitions"
            + " of capacity {}",
        graph.vertexCount(),
        graph.edgeCount(),
        GraphUtils.weakComponentCount(graph.vertexCount(), graph.edges()),
        maxPartitions,
        capacity);

    try (MilpModel model = MilpModel.create("partition", settings)) {
      PartitionFormulation formulation =
          PartitionFormulation.build(model, graph, capacity, maxPartitions);
      if (cuts >= 0) {
        formulation.requireCutCount(model, cuts);
      }
      ObjectiveComposer composer =
          new ObjectiveComposer(new ObjectiveWeights(1.0, 0.0, 0.0, 0.0, normalize));
      composer.addTerm(
          ObjectiveTerm.CUTS, formulation.cutCount(), Math.max(1, graph.edgeCount()));
      composer.build(model);

      SolveOutcome outcome = model.solve();
      composer.solved(outcome);
      composer.report();
      LOG.info(
          "Partition solve finished: status={} objective={} wall={}ms",
          outcome.status(),
          outcome.objectiveValue(),
          outcome.wallTimeMs());
      return toResult(model, formulation, outcome, graph, capacity, maxPartitions, timing);
    }
  }

  private PartitionResult toResult(
      MilpModel model,
      PartitionFormulation formulation,
      SolveOutcome outcome,
      WorkloadGraph graph,
      int capacity,
      int maxPartitions,
      Timing timing) {
    if (outcome.hasSolution()) {
      return new PartitionResult(
          outcome.status(),
          outcome.objectiveValue(),
          formulation.extract(model),
          List.of(),
          timing.elapsedMillis());
    }
    List<ScheduleDiagnostic> diagnostics =
        outcome.status() == SolveStatus.INFEASIBLE
            ? List.of(
                ScheduleDiagnostic.partitionCapacity(graph.totalWeight(), capacity, maxPartitions))
            : List.of(ScheduleDiagnostic.limitWithoutIncumbent(settings.timeLimitMs()));
    return new PartitionResult(
        outcome.status(), Double.NaN, null, diagnostics, timing.elapsedMillis());
  }
}
