package cutshoot.pipeline;

import cutshoot.core.ScheduleOptions;
import cutshoot.core.ScheduleResult;
import cutshoot.core.model.Backend;
import cutshoot.core.model.WorkloadGraph;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs independent configurations of the same problem concurrently.
 *
 * <p>Every run builds and owns its own models; only the graph and backend list are shared, and
 * both are immutable.
 */
public final class ConfigurationSweep {
  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationSweep.class);

  private final int parallelism;

  public ConfigurationSweep() {
    this(Runtime.getRuntime().availableProcessors());
  }

  public ConfigurationSweep(int parallelism) {
    if (parallelism < 1) {
      throw new IllegalArgumentException("parallelism must be at least 1: " + parallelism);
    }
    this.parallelism = parallelism;
  }

  public SweepResult run(
      WorkloadGraph graph, List<Backend> backends, List<ScheduleOptions> configurations) {
    if (configurations.isEmpty()) {
      return new SweepResult(List.of(), -1);
    }
    LOG.info(
        "Sweeping {} configuration(s) with parallelism {}", configurations.size(), parallelism);
    SchedulingPipeline pipeline = new SchedulingPipeline();
    ForkJoinPool pool = new ForkJoinPool(parallelism);
    List<ScheduleResult> results;
    try {
      results =
          pool.submit(
                  () ->
                      configurations.parallelStream()
                          .map(options -> pipeline.run(graph, backends, options))
                          .collect(Collectors.toList()))
              .get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("configuration sweep interrupted", ex);
    } catch (ExecutionException ex) {
      Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new IllegalStateException("configuration sweep failed", cause);
    } finally {
      pool.shutdown();
    }
    return new SweepResult(results, bestIndex(results));
  }

  private static int bestIndex(List<ScheduleResult> results) {
    int best = -1;
    for (int i = 0; i < results.size(); i++) {
      ScheduleResult result = results.get(i);
      if (!result.hasSchedule()) {
        continue;
      }
      if (best < 0 || result.objectiveValue() < results.get(best).objectiveValue() - 1e-9) {
        best = i;
      }
    }
    LOG.info("Best configuration: {}", best);
    return best;
  }
}
