package cutshoot.cli;

import cutshoot.core.InvalidInputException;
import cutshoot.core.ScheduleOptions;
import cutshoot.core.model.Backend;
import cutshoot.core.model.WorkloadGraph;
import cutshoot.objective.ObjectiveMode;
import cutshoot.objective.QosWeights;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/** Built-in problems selectable with {@code --example}. */
final class Examples {
  private static final Map<String, Supplier<Problem>> LOADERS = buildLoaders();

  private Examples() {}

  static Problem load(String name) {
    if (name == null || name.isBlank()) {
      throw new InvalidInputException("Unknown example: " + name);
    }
    Supplier<Problem> supplier = LOADERS.get(name.trim().toLowerCase(Locale.ROOT));
    if (supplier == null) {
      throw new InvalidInputException(
          "Unknown example: " + name + " (available: " + LOADERS.keySet() + ")");
    }
    return supplier.get();
  }

  static List<String> names() {
    return List.copyOf(LOADERS.keySet());
  }

  /** Ten unit vertices in a chain, five backends with distinct queue and execution times. */
  static Problem path10() {
    List<Backend> backends =
        List.of(
            Backend.of("qpu_0", 10, 1, 10),
            Backend.of("qpu_1", 20, 4, 10),
            Backend.of("qpu_2", 15, 3, 10),
            Backend.of("qpu_3", 30, 1, 10),
            Backend.of("qpu_4", 10, 3, 10));
    ScheduleOptions options =
        ScheduleOptions.builder().maxQubitsPerSubcircuit(4).numSubcircuits(3).build();
    return new Problem(WorkloadGraph.path(10), backends, options);
  }

  /** Two interleaved four-qubit registers; simulator-like backends of different speed. */
  static Problem ladder() {
    WorkloadGraph.Builder graph = WorkloadGraph.builder();
    for (int v = 0; v < 8; v++) {
      graph.addVertex(2);
    }
    for (int v = 0; v + 2 < 8; v++) {
      graph.addEdge(v, v + 2);
    }
    graph.addEdge(0, 3);
    graph.addEdge(4, 7);
    List<Backend> backends =
        List.of(
            Backend.of("aer_simulator", 10, 1, 200),
            Backend.of("aer_simulator_statevector", 12, 2, 200),
            Backend.of("qasm_simulator", 60, 3, 200),
            Backend.of("nairobi", 300, 6, 7),
            Backend.of("oslo", 280, 5, 7));
    ScheduleOptions options =
        ScheduleOptions.builder()
            .maxQubitsPerSubcircuit(8)
            .numSubcircuits(3)
            .objectiveMode(ObjectiveMode.JOINT_UNIFORM)
            .build();
    return new Problem(graph.build(), backends, options);
  }

  /** Priced backends in two regions, scheduled with the QoS penalty. */
  static Problem qos() {
    List<Backend> backends =
        List.of(
            Backend.builder("eu_fast")
                .executionTime(10)
                .queueTime(2)
                .capacity(8)
                .price(5.0)
                .reliability(0.9)
                .region("eu")
                .build(),
            Backend.builder("eu_cheap")
                .executionTime(25)
                .queueTime(1)
                .capacity(8)
                .price(1.0)
                .reliability(0.8)
                .region("eu")
                .build(),
            Backend.builder("us_fast")
                .executionTime(8)
                .queueTime(1)
                .capacity(16)
                .price(8.0)
                .reliability(0.95)
                .region("us")
                .build());
    ScheduleOptions options =
        ScheduleOptions.builder()
            .maxQubitsPerSubcircuit(4)
            .numSubcircuits(3)
            .objectiveMode(ObjectiveMode.JOINT_QOS)
            .qosWeights(new QosWeights(5.0, 10.0))
            .build();
    return new Problem(WorkloadGraph.path(8), backends, options);
  }

  private static Map<String, Supplier<Problem>> buildLoaders() {
    Map<String, Supplier<Problem>> loaders = new LinkedHashMap<>();
    loaders.put("path10", Examples::path10);
    loaders.put("ladder", Examples::ladder);
    loaders.put("qos", Examples::qos);
    return loaders;
  }
}
