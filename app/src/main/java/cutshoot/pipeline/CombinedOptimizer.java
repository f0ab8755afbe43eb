package cutshoot.pipeline;

import com.google.ortools.linearsolver.MPVariable;
import cutshoot.allocation.AllocationFormulation;
import cutshoot.allocation.AllocationFormulation.Slot;
import cutshoot.allocation.AllocationPrechecks;
import cutshoot.allocation.AllocationRequest;
import cutshoot.allocation.AllocationResult;
import cutshoot.allocation.PartitionDemand;
import cutshoot.allocation.UniformSplitStrategy;
import cutshoot.core.ScheduleOptions;
import cutshoot.core.ScheduleResult;
import cutshoot.core.SolveStatus;
import cutshoot.core.diagnostics.ScheduleDiagnostic;
import cutshoot.core.model.Backend;
import cutshoot.core.model.WorkloadGraph;
import cutshoot.milp.LinearExpression;
import cutshoot.milp.MilpModel;
import cutshoot.milp.SolveOutcome;
import cutshoot.milp.SolverSettings;
import cutshoot.objective.ObjectiveComposer;
import cutshoot.objective.ObjectiveTerm;
import cutshoot.objective.PostProcessingCostModel;
import cutshoot.partition.PartitionFormulation;
import cutshoot.partition.PartitionLayout;
import cutshoot.partition.PartitionPrechecks;
import cutshoot.partition.PartitionResult;
import cutshoot.util.Timing;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitioning and allocation in a single MILP, so that partition sizes feed the execution-time
 * estimates and backend capacities directly.
 *
 * <p>Partition {@code c} is active iff it holds a vertex, zero-weight vertices included:
 * {@code active[c] >= y[v][c]} for every vertex and {@code active[c] <= sum_v y[v][c]}. Only active
 * partitions receive shots.
 */
public final class CombinedOptimizer {
  private static final Logger LOG = LoggerFactory.getLogger(CombinedOptimizer.class);

  private final SolverSettings settings;

  public CombinedOptimizer(SolverSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * @param exactCuts restricts the model to this cut count; negative for no restriction
   */
  public ScheduleResult optimize(
      WorkloadGraph graph,
      List<Backend> backends,
      ScheduleOptions options,
      ProblemSizing sizing,
      int exactCuts) {
    PartitionPrechecks.validate(graph, sizing.capacity(), sizing.partitions());
    AllocationRequest request = requestFor(backends, options, sizing);
    AllocationFormulation.requireLinear(request, true);
    Timing timing = Timing.start();

    List<ScheduleDiagnostic> reasons = new ArrayList<>();
    reasons.addAll(
        PartitionPrechecks.infeasibilityReasons(graph, sizing.capacity(), sizing.partitions()));
    reasons.addAll(AllocationPrechecks.predicateReasons(backends, options.predicates()));
    if (!reasons.isEmpty()) {
      LOG.warn("Combined model infeasible before solving: {}", reasons);
      return new ScheduleResult(
          SolveStatus.INFEASIBLE,
          Double.NaN,
          PartitionResult.infeasible(reasons, timing.elapsedMillis()),
          null,
          Double.NaN,
          reasons,
          options,
          timing.elapsedMillis());
    }

    ScheduleResult result;
    if (!options.objectiveMode().singleBackend()
        && options.effectiveUniformSplit()
        && options.uniformSplitStrategy() == UniformSplitStrategy.ENUMERATE) {
      result = enumerateCounts(graph, request, options, sizing, exactCuts);
    } else {
      result = solveModel(graph, request, options, sizing, exactCuts, 0);
    }
    return result.withElapsed(timing.elapsedMillis());
  }

  private ScheduleResult enumerateCounts(
      WorkloadGraph graph,
      AllocationRequest request,
      ScheduleOptions options,
      ProblemSizing sizing,
      int exactCuts) {
    int admitted = (int) request.backends().stream().filter(request::admits).count();
    int maxCount = Math.min(admitted, options.shotsPerSubcircuit());
    ScheduleResult best = null;
    ScheduleResult firstMiss = null;
    for (int k = 1; k <= maxCount; k++) {
      ScheduleResult candidate = solveModel(graph, request, options, sizing, exactCuts, k);
      if (!candidate.hasSchedule()) {
        firstMiss = firstMiss == null ? candidate : firstMiss;
        continue;
      }
      if (best == null || candidate.objectiveValue() < best.objectiveValue() - 1e-9) {
        best = candidate;
      }
    }
    return best != null ? best : firstMiss;
  }

  private ScheduleResult solveModel(
      WorkloadGraph graph,
      AllocationRequest request,
      ScheduleOptions options,
      ProblemSizing sizing,
      int exactCuts,
      int count) {
    int capacity = sizing.capacity();
    int partitions = sizing.partitions();
    String name = count > 0 ? "combined_k" + count : "combined";
    try (MilpModel model = MilpModel.create(name, settings)) {
      PartitionFormulation layout = PartitionFormulation.build(model, graph, capacity, partitions);
      if (exactCuts >= 0) {
        layout.requireCutCount(model, exactCuts);
      }
      List<Slot> slots = new ArrayList<>(partitions);
      for (int c = 0; c < partitions; c++) {
        MPVariable active = model.boolVar("active_" + c);
        LinearExpression members = LinearExpression.of(active);
        for (int v = 0; v < graph.vertexCount(); v++) {
          MPVariable placed = layout.placement(v, c);
          model.addGreaterOrEqual(
              LinearExpression.of(active).add(placed, -1.0), 0.0, "active_" + c + "_" + v);
          members.add(placed, -1.0);
        }
        model.addLessOrEqual(members, 0.0, "active_members_" + c);
        slots.add(
            Slot.variable(c, options.shotsPerSubcircuit(), layout.size(c), capacity, active));
      }

      ObjectiveComposer composer = new ObjectiveComposer(options.objectiveWeights());
      AllocationFormulation allocation =
          AllocationFormulation.build(model, request, slots, composer, count);
      if (composer.isEnabled(ObjectiveTerm.CUTS)) {
        composer.addTerm(ObjectiveTerm.CUTS, layout.cutCount(), Math.max(1, graph.edgeCount()));
      }
      PostProcessingCostModel cost = options.postProcessing();
      if (cost.isLinear() && composer.isEnabled(ObjectiveTerm.POST_PROCESSING)) {
        composer.addTerm(
            ObjectiveTerm.POST_PROCESSING,
            LinearExpression.constant(cost.fixedCost())
                .addScaled(layout.cutCount(), cost.perCutCost()));
      }
      composer.build(model);
      LOG.info(
          "Combined model {}: {} variables, {} constraints",
          name,
          model.variableCount(),
          model.constraintCount());

      SolveOutcome outcome = model.solve();
      composer.solved(outcome);
      Map<ObjectiveTerm, Double> terms = composer.report();
      LOG.info(
          "Combined solve finished: status={} objective={} wall={}ms",
          outcome.status(),
          outcome.objectiveValue(),
          outcome.wallTimeMs());
      if (!outcome.hasSolution()) {
        ScheduleDiagnostic reason =
            outcome.status() == SolveStatus.INFEASIBLE
                ? ScheduleDiagnostic.noFeasibleAllocation()
                : ScheduleDiagnostic.limitWithoutIncumbent(settings.timeLimitMs());
        return new ScheduleResult(
            outcome.status(),
            Double.NaN,
            null,
            null,
            Double.NaN,
            List.of(reason),
            options,
            outcome.wallTimeMs());
      }

      PartitionLayout solvedLayout = layout.extract(model);
      PartitionResult partitionResult =
          new PartitionResult(
              outcome.status(),
              solvedLayout.cutCount(),
              solvedLayout,
              List.of(),
              outcome.wallTimeMs());
      AllocationResult allocationResult =
          new AllocationResult(
              outcome.status(),
              outcome.objectiveValue(),
              allocation.extract(model),
              terms,
              List.of(),
              outcome.wallTimeMs());
      return new ScheduleResult(
          outcome.status(),
          outcome.objectiveValue(),
          partitionResult,
          allocationResult,
          cost.cost(solvedLayout.cutCount()),
          List.of(),
          options,
          outcome.wallTimeMs());
    }
  }

  private static AllocationRequest requestFor(
      List<Backend> backends, ScheduleOptions options, ProblemSizing sizing) {
    List<PartitionDemand> demands = new ArrayList<>(sizing.partitions());
    for (int c = 0; c < sizing.partitions(); c++) {
      demands.add(new PartitionDemand(c, 0, options.shotsPerSubcircuit()));
    }
    return AllocationRequest.builder()
        .backends(backends)
        .demands(demands)
        .mode(options.objectiveMode())
        .qosWeights(options.qosWeights())
        .predicates(options.predicates())
        .uniformSplit(options.effectiveUniformSplit())
        .strategy(options.uniformSplitStrategy())
        .objectiveWeights(options.objectiveWeights())
        .build();
  }
}
