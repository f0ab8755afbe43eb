package cutshoot.cli;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import cutshoot.allocation.BackendPredicate;
import cutshoot.allocation.BackendPredicates;
import cutshoot.allocation.UniformSplitStrategy;
import cutshoot.core.InvalidInputException;
import cutshoot.core.ScheduleOptions;
import cutshoot.core.model.Backend;
import cutshoot.core.model.WorkloadGraph;
import cutshoot.objective.ExponentialPostProcessingCost;
import cutshoot.objective.LinearPostProcessingCost;
import cutshoot.objective.ObjectiveMode;
import cutshoot.objective.ObjectiveWeights;
import cutshoot.objective.PostProcessingCostModel;
import cutshoot.objective.QosWeights;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Reads a JSON problem file.
 *
 * <pre>{@code
 * {
 *   "graph":    {"weights": [1, 1, 2], "edges": [[0, 1], [1, 2]]},
 *   "backends": [{"id": "a", "execution_time": 10, "queue_time": 1, "capacity": 5}],
 *   "options":  {"max_qubits_per_subcircuit": 4, "num_subcircuits": 2,
 *                "objective_mode": "joint_uniform", "solver_time_limit": 30}
 * }
 * }</pre>
 */
final class ProblemLoader {

  Problem load(Path path) throws IOException {
    if (!Files.exists(path)) {
      throw new InvalidInputException("Problem file not found: " + path);
    }
    return parse(Files.readString(path));
  }

  Problem parse(String json) {
    JsonObject root;
    try {
      JsonElement element = JsonParser.parseString(json);
      if (!element.isJsonObject()) {
        throw new InvalidInputException("Problem file must contain a JSON object");
      }
      root = element.getAsJsonObject();
    } catch (JsonParseException ex) {
      throw new InvalidInputException("Malformed problem JSON: " + ex.getMessage(), ex);
    }
    try {
      WorkloadGraph graph = graph(requireObject(root, "graph"));
      List<Backend> backends = backends(requireArray(root, "backends"));
      ScheduleOptions options =
          root.has("options")
              ? options(requireObject(root, "options"))
              : ScheduleOptions.defaults();
      return new Problem(graph, backends, options);
    } catch (IllegalStateException | UnsupportedOperationException | NumberFormatException ex) {
      throw new InvalidInputException("Malformed problem JSON: " + ex.getMessage(), ex);
    }
  }

  private WorkloadGraph graph(JsonObject node) {
    WorkloadGraph.Builder builder = WorkloadGraph.builder();
    for (JsonElement weight : requireArray(node, "weights")) {
      builder.addVertex(weight.getAsInt());
    }
    if (node.has("edges")) {
      for (JsonElement edge : requireArray(node, "edges")) {
        JsonArray pair = edge.getAsJsonArray();
        if (pair.size() != 2) {
          throw new InvalidInputException("Edge must be a [source, target] pair: " + edge);
        }
        builder.addEdge(pair.get(0).getAsInt(), pair.get(1).getAsInt());
      }
    }
    return builder.build();
  }

  private List<Backend> backends(JsonArray array) {
    List<Backend> backends = new ArrayList<>(array.size());
    for (JsonElement element : array) {
      JsonObject node = element.getAsJsonObject();
      Backend.Builder builder =
          Backend.builder(requireString(node, "id"))
              .executionTime(doubleOr(node, "execution_time", 0.0))
              .executionTimePerUnit(doubleOr(node, "execution_time_per_unit", 0.0))
              .queueTime(doubleOr(node, "queue_time", 0.0));
      if (has(node, "capacity")) {
        builder.capacity(node.get("capacity").getAsInt());
      }
      if (has(node, "price")) {
        builder.price(node.get("price").getAsDouble());
      }
      if (has(node, "reliability")) {
        builder.reliability(node.get("reliability").getAsDouble());
      }
      if (has(node, "region")) {
        builder.region(node.get("region").getAsString());
      }
      backends.add(builder.build());
    }
    return backends;
  }

  ScheduleOptions options(JsonObject node) {
    ScheduleOptions.Builder builder = ScheduleOptions.builder();
    if (has(node, "max_qubits_per_subcircuit")) {
      builder.maxQubitsPerSubcircuit(node.get("max_qubits_per_subcircuit").getAsInt());
    }
    if (has(node, "num_subcircuits")) {
      builder.numSubcircuits(node.get("num_subcircuits").getAsInt());
    }
    if (has(node, "objective_mode")) {
      builder.objectiveMode(ObjectiveMode.parse(node.get("objective_mode").getAsString()));
    }
    if (has(node, "qos_weights")) {
      JsonObject qos = node.getAsJsonObject("qos_weights");
      builder.qosWeights(
          new QosWeights(
              doubleOr(qos, "price_weight", 0.0), doubleOr(qos, "reliability_weight", 0.0)));
    }
    if (has(node, "predicates")) {
      List<BackendPredicate> predicates = new ArrayList<>();
      for (JsonElement predicate : node.getAsJsonArray("predicates")) {
        predicates.add(predicate(predicate.getAsJsonObject()));
      }
      builder.predicates(predicates);
    }
    if (has(node, "uniform_split")) {
      builder.uniformSplit(node.get("uniform_split").getAsBoolean());
    }
    if (has(node, "uniform_split_strategy")) {
      builder.uniformSplitStrategy(
          UniformSplitStrategy.parse(node.get("uniform_split_strategy").getAsString()));
    }
    if (has(node, "shots_per_subcircuit")) {
      builder.shotsPerSubcircuit(node.get("shots_per_subcircuit").getAsInt());
    }
    if (has(node, "solver_time_limit")) {
      double seconds = node.get("solver_time_limit").getAsDouble();
      InvalidInputException.require(
          Double.isFinite(seconds) && seconds >= 0, "solver_time_limit must be non-negative");
      builder.solverTimeLimitMs(Math.round(seconds * 1000.0));
    }
    if (has(node, "solver")) {
      builder.solverId(node.get("solver").getAsString());
    }
    if (has(node, "random_seed")) {
      builder.randomSeed(node.get("random_seed").getAsInt());
    }
    if (has(node, "combined")) {
      builder.combined(node.get("combined").getAsBoolean());
    }
    if (has(node, "solution_pool_size")) {
      builder.solutionPoolSize(node.get("solution_pool_size").getAsInt());
    }
    if (has(node, "objective_weights")) {
      builder.objectiveWeights(objectiveWeights(node.getAsJsonObject("objective_weights")));
    }
    if (has(node, "post_processing")) {
      builder.postProcessing(postProcessing(node.getAsJsonObject("post_processing")));
    }
    return builder.build();
  }

  private BackendPredicate predicate(JsonObject node) {
    String type = requireString(node, "type").trim().toLowerCase(Locale.ROOT);
    return switch (type) {
      case "region_in" -> BackendPredicates.regionIn(strings(requireArray(node, "values")));
      case "exclude_ids" -> BackendPredicates.excludeIds(strings(requireArray(node, "values")));
      case "min_reliability" -> BackendPredicates.minReliability(requireDouble(node, "value"));
      case "max_price" -> BackendPredicates.maxPrice(requireDouble(node, "value"));
      default -> throw new InvalidInputException("Unknown predicate type: " + type);
    };
  }

  private ObjectiveWeights objectiveWeights(JsonObject node) {
    ObjectiveWeights defaults = ObjectiveWeights.defaults();
    return new ObjectiveWeights(
        doubleOr(node, "cut", defaults.cut()),
        doubleOr(node, "latency", defaults.latency()),
        doubleOr(node, "qos", defaults.qos()),
        doubleOr(node, "post_processing", defaults.postProcessing()),
        has(node, "normalize") ? node.get("normalize").getAsBoolean() : defaults.normalize());
  }

  private PostProcessingCostModel postProcessing(JsonObject node) {
    String type = requireString(node, "type").trim().toLowerCase(Locale.ROOT);
    return switch (type) {
      case "none" -> PostProcessingCostModel.none();
      case "linear" ->
          new LinearPostProcessingCost(
              doubleOr(node, "fixed", 0.0), doubleOr(node, "per_cut", 0.0));
      case "exponential" ->
          new ExponentialPostProcessingCost(
              doubleOr(node, "scale", 1.0),
              doubleOr(node, "base", ExponentialPostProcessingCost.DEFAULT_BASE));
      default -> throw new InvalidInputException("Unknown post-processing model: " + type);
    };
  }

  private static List<String> strings(JsonArray array) {
    List<String> values = new ArrayList<>(array.size());
    for (JsonElement element : array) {
      values.add(element.getAsString());
    }
    return values;
  }

  private static boolean has(JsonObject node, String key) {
    return node.has(key) && !node.get(key).isJsonNull();
  }

  private static JsonObject requireObject(JsonObject node, String key) {
    if (!has(node, key) || !node.get(key).isJsonObject()) {
      throw new InvalidInputException("Missing object '" + key + "'");
    }
    return node.getAsJsonObject(key);
  }

  private static JsonArray requireArray(JsonObject node, String key) {
    if (!has(node, key) || !node.get(key).isJsonArray()) {
      throw new InvalidInputException("Missing array '" + key + "'");
    }
    return node.getAsJsonArray(key);
  }

  private static String requireString(JsonObject node, String key) {
    if (!has(node, key)) {
      throw new InvalidInputException("Missing field '" + key + "'");
    }
    return node.get(key).getAsString();
  }

  private static double requireDouble(JsonObject node, String key) {
    if (!has(node, key)) {
      throw new InvalidInputException("Missing field '" + key + "'");
    }
    return node.get(key).getAsDouble();
  }

  private static double doubleOr(JsonObject node, String key, double fallback) {
    return has(node, key) ? node.get(key).getAsDouble() : fallback;
  }
}
