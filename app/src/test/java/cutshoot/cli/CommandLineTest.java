package cutshoot.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cutshoot.allocation.UniformSplitStrategy;
import cutshoot.core.InvalidInputException;
import cutshoot.core.ScheduleOptions;
import cutshoot.objective.ObjectiveMode;
import org.junit.jupiter.api.Test;

final class CommandLineTest {

  @Test
  void overridesApplyOnTopOfTheExample() throws Exception {
    CliOptions options =
        CommandLine.parse(
            new String[] {
              "--example", "path10",
              "--mode=joint_uniform",
              "--split-strategy", "enumerate",
              "--time-limit", "2",
              "--combined",
              "--exclude", "qpu_3"
            },
            CommandLine.commonSpecs());

    Problem problem = CommandLine.loadProblem(options);
    ScheduleOptions effective = problem.options();

    assertEquals(ObjectiveMode.JOINT_UNIFORM, effective.objectiveMode(), "Mode override");
    assertEquals(
        UniformSplitStrategy.ENUMERATE, effective.uniformSplitStrategy(), "Strategy override");
    assertEquals(2000L, effective.solverTimeLimitMs(), "Seconds converted to milliseconds");
    assertTrue(effective.combined(), "Flag without value");
    assertEquals(4, effective.maxQubitsPerSubcircuit(), "Example value kept");
    assertEquals(1, effective.predicates().size(), "Exclusion predicate added");
  }

  @Test
  void rejectsUnknownAndIncompleteOptions() {
    assertThrows(
        InvalidInputException.class,
        () -> CommandLine.parse(new String[] {"--bogus"}, CommandLine.commonSpecs()),
        "Unknown option");
    assertThrows(
        InvalidInputException.class,
        () -> CommandLine.parse(new String[] {"--shots"}, CommandLine.commonSpecs()),
        "Missing value");
    assertThrows(
        IllegalArgumentException.class,
        () ->
            CommandLine.parse(
                new String[] {"--file", "a.json", "--example", "path10"},
                CommandLine.commonSpecs()),
        "File and example are exclusive");
  }

  @Test
  void requiresAProblemSource() {
    CliOptions options = CommandLine.parse(new String[0], CommandLine.commonSpecs());

    assertThrows(
        InvalidInputException.class, () -> CommandLine.loadProblem(options), "No input given");
  }

  @Test
  void stripsTheCommandWord() {
    assertEquals(
        1, CommandLine.stripCommand(new String[] {"run", "--combined"}, "run").length, "Stripped");
    assertEquals(
        2,
        CommandLine.stripCommand(new String[] {"--example", "qos"}, "run").length,
        "Nothing to strip");
  }
}
