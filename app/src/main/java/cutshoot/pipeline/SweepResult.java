package cutshoot.pipeline;

import cutshoot.core.ScheduleResult;
import java.util.List;
import java.util.Optional;

/**
 * Results of a configuration sweep in input order.
 *
 * @param bestIndex index of the cheapest run with a schedule, {@code -1} if none has one
 */
public record SweepResult(List<ScheduleResult> results, int bestIndex) {

  public SweepResult {
    results = List.copyOf(results);
  }

  public Optional<ScheduleResult> best() {
    return bestIndex < 0 ? Optional.empty() : Optional.of(results.get(bestIndex));
  }
}
