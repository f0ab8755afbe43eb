package cutshoot.cli;

import cutshoot.core.ScheduleResult;
import cutshoot.core.model.ShotAssignment;
import cutshoot.core.model.Subcircuit;
import cutshoot.pipeline.SchedulingPipeline;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the primary {@code run} command: one scheduling run, JSON report on stdout. */
final class RunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

  int execute(String[] args) throws IOException {
    CliOptions cliOptions =
        CommandLine.parse(CommandLine.stripCommand(args, "run"), CommandLine.commonSpecs());
    Problem problem = CommandLine.loadProblem(cliOptions);

    ScheduleResult result =
        new SchedulingPipeline().run(problem.graph(), problem.backends(), problem.options());
    logSummary(result);
    writeReport(new JsonReportBuilder().build(result), cliOptions.outputFile());
    return ExitCodes.forStatus(result.status());
  }

  private void logSummary(ScheduleResult result) {
    LOG.info(
        "Status {} objective {} in {} ms",
        result.status(),
        result.objectiveValue(),
        result.elapsedMillis());
    if (!result.hasSchedule()) {
      result.diagnostics().forEach(diagnostic -> LOG.warn("Diagnostic: {}", diagnostic));
      return;
    }
    LOG.info("Cuts: {}", result.cutCount());
    for (Subcircuit subcircuit : result.partition().layout().subcircuits()) {
      StringBuilder shots = new StringBuilder();
      for (ShotAssignment assignment :
          result.allocation().allocation().assignments(subcircuit.index())) {
        if (shots.length() > 0) {
          shots.append(", ");
        }
        shots.append(assignment.backendId()).append('=').append(assignment.shots());
      }
      LOG.info(
          "  Subcircuit #{} vertices={} d={} shots [{}]",
          subcircuit.index(),
          subcircuit.vertices(),
          subcircuit.size(),
          shots);
    }
  }

  static void writeReport(String json, Path outputFile) throws IOException {
    if (outputFile == null) {
      System.out.println(json);
      return;
    }
    Path parent = outputFile.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(outputFile, json, StandardCharsets.UTF_8);
    LOG.info("Report written to {}", outputFile);
  }
}
