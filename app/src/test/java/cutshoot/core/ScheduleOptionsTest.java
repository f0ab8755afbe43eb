package cutshoot.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cutshoot.allocation.UniformSplitStrategy;
import cutshoot.milp.SolverSettings;
import cutshoot.objective.ObjectiveMode;
import java.util.List;
import org.junit.jupiter.api.Test;

final class ScheduleOptionsTest {

  @Test
  void defaultsFollowTheDocumentedValues() {
    ScheduleOptions defaults = ScheduleOptions.defaults();

    assertEquals(ObjectiveMode.SINGLE_SELECT, defaults.objectiveMode(), "Default mode");
    assertEquals(1024, defaults.shotsPerSubcircuit(), "Default shot budget");
    assertEquals(UniformSplitStrategy.LOOKUP_TABLE, defaults.uniformSplitStrategy(), "Strategy");
    assertNull(defaults.uniformSplit(), "Split follows the mode unless set");
    assertFalse(defaults.combined(), "Sequential flow by default");
    assertEquals(SolverSettings.SCIP, defaults.solverId(), "SCIP engine");
  }

  @Test
  void normalizeFillsUnsetFields() {
    ScheduleOptions sparse =
        new ScheduleOptions(
            4, 2, null, null, null, null, null, 0, null, null, 0L, " ", 3, true, 0);

    ScheduleOptions normalized = ScheduleOptions.normalize(sparse);

    assertEquals(ObjectiveMode.SINGLE_SELECT, normalized.objectiveMode(), "Mode filled in");
    assertEquals(ScheduleOptions.DEFAULT_SHOTS, normalized.shotsPerSubcircuit(), "Shots filled");
    assertEquals(ScheduleOptions.DEFAULT_POOL_SIZE, normalized.solutionPoolSize(), "Pool size");
    assertEquals(SolverSettings.SCIP, normalized.solverId(), "Blank solver id replaced");
    assertTrue(normalized.predicates().isEmpty(), "Null predicates become empty");
    assertEquals(3, normalized.randomSeed(), "Explicit values survive");
    assertTrue(normalized.combined(), "Explicit flags survive");
  }

  @Test
  void uniformSplitFollowsModeUnlessOverridden() {
    ScheduleOptions nonUniform =
        ScheduleOptions.builder().objectiveMode(ObjectiveMode.JOINT_NONUNIFORM).build();

    assertFalse(nonUniform.effectiveUniformSplit(), "Non-uniform mode optimises the split");
    assertTrue(
        nonUniform.toBuilder().uniformSplit(true).build().effectiveUniformSplit(),
        "Explicit override wins");
  }

  @Test
  void normalizeRejectsNegativeValues() {
    assertThrows(
        InvalidInputException.class,
        () -> ScheduleOptions.normalize(ScheduleOptions.builder().numSubcircuits(-1).build()),
        "Negative partition count");
    assertThrows(
        InvalidInputException.class,
        () -> ScheduleOptions.normalize(ScheduleOptions.builder().solverTimeLimitMs(-5).build()),
        "Negative time limit");
  }

  @Test
  void solverSettingsCarryLimitAndSeed() {
    SolverSettings settings =
        ScheduleOptions.builder()
            .solverId("cbc")
            .solverTimeLimitMs(1500)
            .randomSeed(9)
            .predicates(List.of())
            .build()
            .solverSettings();

    assertEquals(SolverSettings.CBC, settings.solverId(), "Engine id is upper-cased");
    assertEquals(1500, settings.timeLimitMs(), "Limit in milliseconds");
    assertEquals(9, settings.randomSeed(), "Seed is forwarded");
  }
}
