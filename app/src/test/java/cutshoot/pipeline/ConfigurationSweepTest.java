package cutshoot.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cutshoot.core.ScheduleOptions;
import cutshoot.core.SolveStatus;
import cutshoot.core.model.Backend;
import cutshoot.core.model.WorkloadGraph;
import cutshoot.testing.TestDefaults;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ConfigurationSweepTest {
  private static final List<Backend> BACKENDS =
      List.of(Backend.of("qpu_0", 10, 1, 10), Backend.of("qpu_4", 10, 3, 10));

  @Test
  void runsConfigurationsConcurrentlyInInputOrder() {
    ScheduleOptions base =
        ScheduleOptions.builder()
            .maxQubitsPerSubcircuit(4)
            .solverTimeLimitMs(TestDefaults.solverTimeLimitMs())
            .build();
    List<ScheduleOptions> configurations =
        List.of(
            base.toBuilder().numSubcircuits(2).build(),
            base.toBuilder().numSubcircuits(3).build(),
            base.toBuilder().numSubcircuits(4).build());

    SweepResult sweep =
        new ConfigurationSweep(2).run(WorkloadGraph.path(10), BACKENDS, configurations);

    assertEquals(3, sweep.results().size(), "One result per configuration");
    assertEquals(
        SolveStatus.INFEASIBLE, sweep.results().get(0).status(), "Two partitions are too few");
    assertEquals(
        3, sweep.results().get(1).options().numSubcircuits(), "Results keep the input order");
    assertTrue(sweep.results().get(1).hasSchedule(), "Three partitions are enough");
    assertEquals(1, sweep.bestIndex(), "Fewest cuts and partitions win");
    assertTrue(sweep.best().isPresent(), "Best result is exposed");
  }

  @Test
  void emptySweepHasNoBest() {
    SweepResult sweep = new ConfigurationSweep(1).run(WorkloadGraph.path(3), BACKENDS, List.of());

    assertTrue(sweep.results().isEmpty(), "No runs");
    assertFalse(sweep.best().isPresent(), "No best run");
  }
}
