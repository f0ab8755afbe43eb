package cutshoot.allocation;

import cutshoot.allocation.AllocationFormulation.Slot;
import cutshoot.core.SolveStatus;
import cutshoot.core.diagnostics.ScheduleDiagnostic;
import cutshoot.milp.LinearExpression;
import cutshoot.milp.MilpModel;
import cutshoot.milp.SolveOutcome;
import cutshoot.milp.SolverSettings;
import cutshoot.objective.ObjectiveComposer;
import cutshoot.objective.ObjectiveTerm;
import cutshoot.util.Timing;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link BackendAllocator} backed by one MILP per solve (one per count when enumerating). */
public final class MilpBackendAllocator implements BackendAllocator {
  private static final Logger LOG = LoggerFactory.getLogger(MilpBackendAllocator.class);

  private final SolverSettings settings;

  public MilpBackendAllocator(SolverSettings settings) {
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  @Override
  public AllocationResult allocate(AllocationRequest request) {
    Objects.requireNonNull(request, "request");
    Timing timing = Timing.start();
    List<ScheduleDiagnostic> reasons = AllocationPrechecks.infeasibilityReasons(request);
    if (!reasons.isEmpty()) {
      LOG.warn("Allocation infeasible before solving: {}", reasons);
      return AllocationResult.infeasible(reasons, timing.elapsedMillis());
    }
    List<Slot> slots =
        request.demands().stream().map(Slot::fixed).collect(Collectors.toList());
    LOG.info(
        "Allocating {} partition(s) over {} backend(s): mode={} split={} strategy={}",
        slots.size(),
        request.backends().size(),
        request.mode().configKey(),
        request.shotSplit(),
        request.strategy());

    AllocationResult result;
    if (request.shotSplit() == ShotSplit.UNIFORM
        && request.strategy() == UniformSplitStrategy.ENUMERATE) {
      result = enumerateCounts(request, slots);
    } else {
      result = solveOnce(request, slots, 0);
    }
    LOG.info(
        "Allocation finished: status={} objective={} makespan={}",
        result.status(),
        result.objectiveValue(),
        result.makespan());
    return withElapsed(result, timing.elapsedMillis());
  }

  private AllocationResult enumerateCounts(AllocationRequest request, List<Slot> slots) {
    int maxCount = AllocationFormulation.maxSelectable(request, slots);
    AllocationResult best = null;
    boolean limitHit = false;
    for (int k = 1; k <= maxCount; k++) {
      AllocationResult candidate = solveOnce(request, slots, k);
      LOG.debug("Selected count {} -> {} ({})", k, candidate.objectiveValue(), candidate.status());
      limitHit |= candidate.status() == SolveStatus.LIMIT_REACHED;
      if (candidate.hasSolution()
          && (best == null || candidate.objectiveValue() < best.objectiveValue() - 1e-9)) {
        best = candidate;
      }
    }
    if (best == null) {
      ScheduleDiagnostic reason =
          limitHit
              ? ScheduleDiagnostic.limitWithoutIncumbent(settings.timeLimitMs())
              : ScheduleDiagnostic.noFeasibleAllocation();
      SolveStatus status = limitHit ? SolveStatus.LIMIT_REACHED : SolveStatus.INFEASIBLE;
      return new AllocationResult(status, Double.NaN, null, Map.of(), List.of(reason), 0L);
    }
    if (limitHit && best.status() == SolveStatus.OPTIMAL) {
      // a skipped count may still hide a better solution
      return new AllocationResult(
          SolveStatus.LIMIT_REACHED,
          best.objectiveValue(),
          best.solution(),
          best.termValues(),
          best.diagnostics(),
          0L);
    }
    return best;
  }

  private AllocationResult solveOnce(AllocationRequest request, List<Slot> slots, int count) {
    String name = count > 0 ? "allocation_k" + count : "allocation";
    try (MilpModel model = MilpModel.create(name, settings)) {
      ObjectiveComposer composer = new ObjectiveComposer(request.objectiveWeights());
      AllocationFormulation formulation =
          AllocationFormulation.build(model, request, slots, composer, count);
      if (composer.isEnabled(ObjectiveTerm.POST_PROCESSING) && request.postProcessingTime() > 0) {
        composer.addTerm(
            ObjectiveTerm.POST_PROCESSING, LinearExpression.constant(request.postProcessingTime()));
      }
      composer.build(model);
      SolveOutcome outcome = model.solve();
      composer.solved(outcome);
      Map<ObjectiveTerm, Double> terms = composer.report();
      if (!outcome.hasSolution()) {
        ScheduleDiagnostic reason =
            outcome.status() == SolveStatus.INFEASIBLE
                ? ScheduleDiagnostic.noFeasibleAllocation()
                : ScheduleDiagnostic.limitWithoutIncumbent(settings.timeLimitMs());
        return new AllocationResult(
            outcome.status(), Double.NaN, null, Map.of(), List.of(reason), outcome.wallTimeMs());
      }
      return new AllocationResult(
          outcome.status(),
          outcome.objectiveValue(),
          formulation.extract(model),
          terms,
          List.of(),
          outcome.wallTimeMs());
    }
  }

  private static AllocationResult withElapsed(AllocationResult result, long elapsedMillis) {
    return new AllocationResult(
        result.status(),
        result.objectiveValue(),
        result.solution(),
        result.termValues(),
        result.diagnostics(),
        elapsedMillis);
  }
}
