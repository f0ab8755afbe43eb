package cutshoot.pipeline;

import cutshoot.core.ScheduleResult;
import cutshoot.core.SolveStatus;
import cutshoot.objective.PostProcessingCostModel;
import java.util.function.IntFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a post-processing cost that cannot live inside the MILP.
 *
 * <p>One candidate is solved per exact cut count {@code k = first .. first + size - 1}; the
 * weighted cost of {@code k} is added afterwards and the cheapest candidate wins. Strata without
 * a schedule are skipped.
 */
public final class CutStratifiedPool {
  private static final Logger LOG = LoggerFactory.getLogger(CutStratifiedPool.class);

  private final int size;

  public CutStratifiedPool(int size) {
    if (size < 1) {
      throw new IllegalArgumentException("pool size must be at least 1: " + size);
    }
    this.size = size;
  }

  public int size() {
    return size;
  }

  /**
   * @param firstCutCount smallest cut count any layout can reach
   * @param stratum solves the problem restricted to one exact cut count
   * @param weight weight of the post-processing term
   */
  public ScheduleResult explore(
      int firstCutCount,
      IntFunction<ScheduleResult> stratum,
      PostProcessingCostModel cost,
      double weight) {
    ScheduleResult best = null;
    ScheduleResult firstMiss = null;
    boolean limitHit = false;
    for (int k = firstCutCount; k < firstCutCount + size; k++) {
      ScheduleResult candidate = stratum.apply(k);
      limitHit |= candidate.status() == SolveStatus.LIMIT_REACHED;
      if (!candidate.hasSchedule()) {
        LOG.info("Cut stratum {} has no schedule ({})", k, candidate.status());
        if (firstMiss == null) {
          firstMiss = candidate;
        }
        continue;
      }
      double postProcessing = cost.cost(k);
      double total = candidate.objectiveValue() + weight * postProcessing;
      LOG.info(
          "Cut stratum {}: solver objective {} + post-processing {} = {}",
          k,
          candidate.objectiveValue(),
          postProcessing,
          total);
      if (best == null || total < best.objectiveValue() - 1e-9) {
        best =
            new ScheduleResult(
                candidate.status(),
                total,
                candidate.partition(),
                candidate.allocation(),
                postProcessing,
                candidate.diagnostics(),
                candidate.options(),
                candidate.elapsedMillis());
      }
    }
    if (best == null) {
      return firstMiss;
    }
    if (limitHit && best.status() == SolveStatus.OPTIMAL) {
      return new ScheduleResult(
          SolveStatus.LIMIT_REACHED,
          best.objectiveValue(),
          best.partition(),
          best.allocation(),
          best.postProcessingCost(),
          best.diagnostics(),
          best.options(),
          best.elapsedMillis());
    }
    return best;
  }
}
