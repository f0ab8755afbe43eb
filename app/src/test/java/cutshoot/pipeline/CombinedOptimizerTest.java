package cutshoot.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cutshoot.core.ScheduleOptions;
import cutshoot.core.ScheduleResult;
import cutshoot.core.model.Backend;
import cutshoot.core.model.Subcircuit;
import cutshoot.core.model.WorkloadGraph;
import cutshoot.testing.TestDefaults;
import java.util.List;
import org.junit.jupiter.api.Test;

final class CombinedOptimizerTest {
  private final CombinedOptimizer optimizer = new CombinedOptimizer(TestDefaults.solverSettings());

  @Test
  void partitionOfZeroWeightVerticesStillReceivesShots() {
    WorkloadGraph graph = WorkloadGraph.of(new int[] {2, 0}, List.of(new int[] {0, 1}));
    ScheduleOptions options =
        ScheduleOptions.builder()
            .maxQubitsPerSubcircuit(2)
            .numSubcircuits(2)
            .solverTimeLimitMs(TestDefaults.solverTimeLimitMs())
            .build();

    ScheduleResult result =
        optimizer.optimize(
            graph, List.of(Backend.of("only", 10, 1, 10)), options, new ProblemSizing(2, 2), 1);

    assertTrue(result.hasSchedule(), "One cut isolates the zero-weight vertex");
    List<Subcircuit> subcircuits = result.partition().layout().subcircuits();
    assertEquals(2, subcircuits.size(), "Both partitions hold a vertex");
    assertEquals(0, subcircuits.get(1).aggregates().a(), "Second partition owns no units");
    for (Subcircuit subcircuit : subcircuits) {
      assertEquals(
          ScheduleOptions.DEFAULT_SHOTS,
          result.allocation().allocation().totalShots(subcircuit.index()),
          "Subcircuit " + subcircuit.index() + " receives its full budget");
    }
  }
}
