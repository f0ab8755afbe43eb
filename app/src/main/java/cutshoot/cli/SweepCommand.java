package cutshoot.cli;

import cutshoot.core.ScheduleOptions;
import cutshoot.pipeline.ConfigurationSweep;
import cutshoot.pipeline.SweepResult;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles {@code sweep}: runs one configuration per {@code --subcircuits} value concurrently and
 * reports every run plus the cheapest schedule.
 */
final class SweepCommand {
  private static final Logger LOG = LoggerFactory.getLogger(SweepCommand.class);

  int execute(String[] args) throws IOException {
    Map<String, CommandLine.OptionSpec> specs = CommandLine.commonSpecs();
    specs.put(
        "--subcircuits",
        CommandLine.OptionSpec.withValue(
            (b, raw) -> b.sweepSubcircuits(CliParsers.parseIntList(raw, "--subcircuits"))));
    specs.put(
        "--parallelism",
        CommandLine.OptionSpec.withValue(
            (b, raw) -> b.parallelism(CliParsers.parseInt(raw, "--parallelism"))));
    CliOptions cliOptions = CommandLine.parse(CommandLine.stripCommand(args, "sweep"), specs);
    if (cliOptions.sweepSubcircuits().isEmpty()) {
      throw new IllegalArgumentException("sweep needs --subcircuits, e.g. --subcircuits 2,3,4");
    }
    Problem problem = CommandLine.loadProblem(cliOptions);

    List<ScheduleOptions> configurations = new ArrayList<>();
    for (int count : cliOptions.sweepSubcircuits()) {
      configurations.add(problem.options().toBuilder().numSubcircuits(count).build());
    }
    ConfigurationSweep sweep =
        cliOptions.parallelism() != null
            ? new ConfigurationSweep(cliOptions.parallelism())
            : new ConfigurationSweep();
    SweepResult result = sweep.run(problem.graph(), problem.backends(), configurations);

    for (int i = 0; i < result.results().size(); i++) {
      LOG.info(
          "num_subcircuits={} -> {} {}",
          configurations.get(i).numSubcircuits(),
          result.results().get(i).status(),
          result.results().get(i).objectiveValue());
    }
    RunCommand.writeReport(new JsonReportBuilder().build(result), cliOptions.outputFile());
    return result
        .best()
        .map(best -> ExitCodes.forStatus(best.status()))
        .orElse(ExitCodes.INFEASIBLE);
  }
}
