package cutshoot.pipeline;

import cutshoot.allocation.AllocationPrechecks;
import cutshoot.allocation.AllocationRequest;
import cutshoot.allocation.AllocationResult;
import cutshoot.allocation.MilpBackendAllocator;
import cutshoot.allocation.PartitionDemand;
import cutshoot.core.InvalidInputException;
import cutshoot.core.ScheduleOptions;
import cutshoot.core.ScheduleResult;
import cutshoot.core.SolveStatus;
import cutshoot.core.diagnostics.ScheduleDiagnostic;
import cutshoot.core.model.Backend;
import cutshoot.core.model.Subcircuit;
import cutshoot.core.model.WorkloadGraph;
import cutshoot.milp.SolverSettings;
import cutshoot.objective.ObjectiveWeights;
import cutshoot.objective.PostProcessingCostModel;
import cutshoot.partition.MilpGraphPartitioner;
import cutshoot.partition.PartitionPrechecks;
import cutshoot.partition.PartitionResult;
import cutshoot.util.Timing;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of a scheduling run.
 *
 * <p>By default the graph is partitioned first and the resulting subcircuits are allocated in a
 * second model; {@link ScheduleOptions#combined()} solves both in one model instead. A non-linear
 * post-processing cost is handled by a {@link CutStratifiedPool} around either flow.
 */
public final class SchedulingPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(SchedulingPipeline.class);

  public ScheduleResult run(WorkloadGraph graph, List<Backend> backends, ScheduleOptions options) {
    Objects.requireNonNull(graph, "graph");
    ScheduleOptions effective = ScheduleOptions.normalize(options);
    validateBackends(backends);
    Timing timing = Timing.start();

    List<ScheduleDiagnostic> excluded =
        AllocationPrechecks.predicateReasons(backends, effective.predicates());
    if (!excluded.isEmpty()) {
      LOG.warn("Predicates exclude every backend: {}", excluded);
      return new ScheduleResult(
          SolveStatus.INFEASIBLE,
          Double.NaN,
          null,
          null,
          Double.NaN,
          excluded,
          effective,
          timing.elapsedMillis());
    }

    ProblemSizing sizing = ProblemSizing.resolve(graph, backends, effective);
    PartitionPrechecks.validate(graph, sizing.capacity(), sizing.partitions());
    LOG.info(
        "Scheduling {} vertices on {} backends: capacity={} partitions={} mode={} combined={}",
        graph.vertexCount(),
        backends.size(),
        sizing.capacity(),
        sizing.partitions(),
        effective.objectiveMode().configKey(),
        effective.combined());

    PostProcessingCostModel cost = effective.postProcessing();
    ScheduleResult result;
    if (cost.isLinear()) {
      result = solveStratum(graph, backends, effective, sizing, -1);
    } else {
      result = explorePool(graph, backends, effective, sizing);
    }
    LOG.info(
        "Schedule finished: status={} objective={} elapsed={}ms",
        result.status(),
        result.objectiveValue(),
        timing.elapsedMillis());
    return result.withElapsed(timing.elapsedMillis());
  }

  private ScheduleResult explorePool(
      WorkloadGraph graph, List<Backend> backends, ScheduleOptions options, ProblemSizing sizing) {
    MilpGraphPartitioner partitioner =
        new MilpGraphPartitioner(options.solverSettings(), options.objectiveWeights().normalize());
    PartitionResult minimal =
        partitioner.partition(graph, sizing.capacity(), sizing.partitions());
    if (!minimal.hasSolution()) {
      return new ScheduleResult(
          minimal.status(),
          Double.NaN,
          minimal,
          null,
          Double.NaN,
          minimal.diagnostics(),
          options,
          minimal.elapsedMillis());
    }
    CutStratifiedPool pool = new CutStratifiedPool(options.solutionPoolSize());
    LOG.info(
        "Exploring cut counts {}..{} for the post-processing cost",
        minimal.cutCount(),
        minimal.cutCount() + pool.size() - 1);
    return pool.explore(
        minimal.cutCount(),
        k -> solveStratum(graph, backends, options, sizing, k),
        options.postProcessing(),
        options.objectiveWeights().postProcessing());
  }

  private ScheduleResult solveStratum(
      WorkloadGraph graph,
      List<Backend> backends,
      ScheduleOptions options,
      ProblemSizing sizing,
      int exactCuts) {
    if (options.combined()) {
      return new CombinedOptimizer(options.solverSettings())
          .optimize(graph, backends, options, sizing, exactCuts);
    }
    return sequential(graph, backends, options, sizing, exactCuts);
  }

  private ScheduleResult sequential(
      WorkloadGraph graph,
      List<Backend> backends,
      ScheduleOptions options,
      ProblemSizing sizing,
      int exactCuts) {
    SolverSettings settings = options.solverSettings();
    ObjectiveWeights weights = options.objectiveWeights();
    MilpGraphPartitioner partitioner = new MilpGraphPartitioner(settings, weights.normalize());
    PartitionResult partition =
        exactCuts < 0
            ? partitioner.partition(graph, sizing.capacity(), sizing.partitions())
            : partitioner.partitionWithCutCount(
                graph, sizing.capacity(), sizing.partitions(), exactCuts);
    if (!partition.hasSolution()) {
      return new ScheduleResult(
          partition.status(),
          Double.NaN,
          partition,
          null,
          Double.NaN,
          partition.diagnostics(),
          options,
          partition.elapsedMillis());
    }

    int cuts = partition.cutCount();
    PostProcessingCostModel cost = options.postProcessing();
    List<PartitionDemand> demands = new ArrayList<>();
    for (Subcircuit subcircuit : partition.layout().subcircuits()) {
      demands.add(
          new PartitionDemand(
              subcircuit.index(), subcircuit.size(), options.shotsPerSubcircuit()));
    }
    AllocationRequest request =
        AllocationRequest.builder()
            .backends(backends)
            .demands(demands)
            .mode(options.objectiveMode())
            .qosWeights(options.qosWeights())
            .predicates(options.predicates())
            .uniformSplit(options.effectiveUniformSplit())
            .strategy(options.uniformSplitStrategy())
            .objectiveWeights(weights)
            .postProcessingTime(cost.isLinear() ? cost.cost(cuts) : 0.0)
            .build();
    AllocationResult allocation = new MilpBackendAllocator(settings).allocate(request);
    if (!allocation.hasSolution()) {
      return new ScheduleResult(
          allocation.status(),
          Double.NaN,
          partition,
          allocation,
          cost.cost(cuts),
          allocation.diagnostics(),
          options,
          partition.elapsedMillis() + allocation.elapsedMillis());
    }

    double cutTerm = weights.cut() * cuts;
    if (weights.normalize()) {
      cutTerm /= Math.max(1, graph.edgeCount());
    }
    return new ScheduleResult(
        worse(partition.status(), allocation.status()),
        cutTerm + allocation.objectiveValue(),
        partition,
        allocation,
        cost.cost(cuts),
        List.of(),
        options,
        partition.elapsedMillis() + allocation.elapsedMillis());
  }

  private static SolveStatus worse(SolveStatus first, SolveStatus second) {
    return first.isOptimal() ? second : first;
  }

  private static void validateBackends(List<Backend> backends) {
    InvalidInputException.require(
        backends != null && !backends.isEmpty(), "at least one backend is required");
    Set<String> ids = new HashSet<>();
    for (Backend backend : backends) {
      Objects.requireNonNull(backend, "backend");
      InvalidInputException.require(ids.add(backend.id()), "duplicate backend id: " + backend.id());
    }
  }
}
