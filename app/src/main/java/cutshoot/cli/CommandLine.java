package cutshoot.cli;

import cutshoot.allocation.BackendPredicates;
import cutshoot.allocation.UniformSplitStrategy;
import cutshoot.core.InvalidInputException;
import cutshoot.objective.ObjectiveMode;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Option table and argument loop shared by the commands. */
final class CommandLine {
  private CommandLine() {}

  static CliOptions parse(String[] args, Map<String, OptionSpec> specs) {
    CliOptions.Builder builder = CliOptions.builder();
    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec spec = specs.get(parsed.option());
      if (spec == null) {
        throw new InvalidInputException("Unknown option: " + args[i]);
      }
      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new InvalidInputException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  /** Options understood by every command. */
  static Map<String, OptionSpec> commonSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--file", OptionSpec.withValue(CliOptions.Builder::problemFile));
    specs.put("--example", OptionSpec.withValue(CliOptions.Builder::exampleName));
    specs.put("--output", OptionSpec.withValue((b, raw) -> b.outputFile(Path.of(raw))));
    specs.put(
        "--max-qubits",
        OptionSpec.withValue(
            (b, raw) -> b.maxQubitsPerSubcircuit(CliParsers.parseInt(raw, "--max-qubits"))));
    specs.put(
        "--num-subcircuits",
        OptionSpec.withValue(
            (b, raw) -> b.numSubcircuits(CliParsers.parseInt(raw, "--num-subcircuits"))));
    specs.put(
        "--mode", OptionSpec.withValue((b, raw) -> b.objectiveMode(ObjectiveMode.parse(raw))));
    specs.put(
        "--price-weight",
        OptionSpec.withValue(
            (b, raw) -> b.priceWeight(CliParsers.parseDouble(raw, "--price-weight"))));
    specs.put(
        "--reliability-weight",
        OptionSpec.withValue(
            (b, raw) -> b.reliabilityWeight(CliParsers.parseDouble(raw, "--reliability-weight"))));
    specs.put(
        "--region",
        OptionSpec.withValue(
            (b, raw) ->
                b.addPredicate(BackendPredicates.regionIn(CliParsers.parseList(raw, "--region")))));
    specs.put(
        "--exclude",
        OptionSpec.withValue(
            (b, raw) ->
                b.addPredicate(
                    BackendPredicates.excludeIds(CliParsers.parseList(raw, "--exclude")))));
    specs.put(
        "--uniform-split",
        OptionSpec.withValue(
            (b, raw) -> b.uniformSplit(CliParsers.parseBoolean(raw, "--uniform-split"))));
    specs.put(
        "--split-strategy",
        OptionSpec.withValue(
            (b, raw) -> b.uniformSplitStrategy(UniformSplitStrategy.parse(raw))));
    specs.put(
        "--shots",
        OptionSpec.withValue(
            (b, raw) -> b.shotsPerSubcircuit(CliParsers.parseInt(raw, "--shots"))));
    specs.put(
        "--time-limit",
        OptionSpec.withValue(
            (b, raw) ->
                b.solverTimeLimitMs(CliParsers.parseSecondsAsMillis(raw, "--time-limit"))));
    specs.put("--solver", OptionSpec.withValue(CliOptions.Builder::solverId));
    specs.put("--combined", OptionSpec.flag(b -> b.combined(true)));
    specs.put(
        "--pool-size",
        OptionSpec.withValue(
            (b, raw) -> b.solutionPoolSize(CliParsers.parseInt(raw, "--pool-size"))));
    return specs;
  }

  static String[] stripCommand(String[] args, String command) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if (command.equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  static Problem loadProblem(CliOptions options) throws IOException {
    Problem problem;
    if (options.hasProblemFile()) {
      problem = new ProblemLoader().load(Path.of(options.problemFile()));
    } else if (options.hasExample()) {
      problem = Examples.load(options.exampleName());
    } else {
      throw new InvalidInputException(
          "Missing problem input: use --file <problem.json> or --example " + Examples.names());
    }
    return problem.withOptions(options.applyTo(problem.options()));
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new InvalidInputException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(raw.substring(0, equalsIndex), value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
