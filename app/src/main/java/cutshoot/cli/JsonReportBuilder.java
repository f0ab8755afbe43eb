package cutshoot.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import cutshoot.allocation.AllocationResult;
import cutshoot.core.ScheduleOptions;
import cutshoot.core.ScheduleResult;
import cutshoot.core.diagnostics.ScheduleDiagnostic;
import cutshoot.core.model.CutEdge;
import cutshoot.core.model.ShotAssignment;
import cutshoot.core.model.Subcircuit;
import cutshoot.partition.PartitionLayout;
import cutshoot.pipeline.SweepResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  String build(ScheduleResult result) {
    return gson.toJson(report(result));
  }

  String build(SweepResult sweep) {
    Map<String, Object> root = new LinkedHashMap<>();
    List<Map<String, Object>> runs = new ArrayList<>();
    for (int i = 0; i < sweep.results().size(); i++) {
      ScheduleResult result = sweep.results().get(i);
      Map<String, Object> run = new LinkedHashMap<>();
      run.put("index", i);
      run.put("num_subcircuits", result.options().numSubcircuits());
      run.put("status", statusKey(result));
      run.put("objective", finite(result.objectiveValue()));
      runs.add(run);
    }
    root.put("runs", runs);
    root.put("best_index", sweep.bestIndex() < 0 ? null : sweep.bestIndex());
    sweep.best().ifPresent(best -> root.put("best", report(best)));
    return gson.toJson(root);
  }

  private Map<String, Object> report(ScheduleResult result) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(result));
    root.put("status", statusKey(result));
    root.put("objective", finite(result.objectiveValue()));
    if (result.partition() != null && result.partition().hasSolution()) {
      PartitionLayout layout = result.partition().layout();
      root.put("partition_assignment", layout.assignment());
      root.put("cut_count", layout.cutCount());
      root.put("cut_edges", cutEdges(layout.cutEdges()));
      root.put("per_partition_aggregates", aggregates(layout.subcircuits()));
    }
    AllocationResult allocation = result.allocation();
    if (allocation != null && allocation.hasSolution()) {
      root.put("allocation", allocation(allocation));
      root.put("backend_busy_time", allocation.solution().busyTimes());
      root.put("makespan", finite(allocation.makespan()));
      if (!allocation.termValues().isEmpty()) {
        Map<String, Object> terms = new LinkedHashMap<>();
        allocation
            .termValues()
            .forEach((term, value) -> terms.put(term.name().toLowerCase(Locale.ROOT), value));
        root.put("objective_terms", terms);
      }
    }
    root.put("post_processing_cost", finite(result.postProcessingCost()));
    if (!result.diagnostics().isEmpty()) {
      root.put("diagnostics", diagnostics(result.diagnostics()));
    }
    return root;
  }

  private Map<String, Object> meta(ScheduleResult result) {
    ScheduleOptions options = result.options();
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("time_ms", result.elapsedMillis());
    meta.put("objective_mode", options.objectiveMode().configKey());
    meta.put("max_qubits_per_subcircuit", options.maxQubitsPerSubcircuit());
    meta.put("num_subcircuits", options.numSubcircuits());
    meta.put("uniform_split", options.effectiveUniformSplit());
    meta.put("shots_per_subcircuit", options.shotsPerSubcircuit());
    meta.put("combined", options.combined());
    meta.put("solver", options.solverId());
    return meta;
  }

  private List<Map<String, Object>> cutEdges(List<CutEdge> cutEdges) {
    List<Map<String, Object>> list = new ArrayList<>(cutEdges.size());
    for (CutEdge cutEdge : cutEdges) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("edge", List.of(cutEdge.edge().source(), cutEdge.edge().target()));
      map.put("partition", cutEdge.partition());
      map.put("direction", cutEdge.direction().name().toLowerCase(Locale.ROOT));
      list.add(map);
    }
    return list;
  }

  private List<Map<String, Object>> aggregates(List<Subcircuit> subcircuits) {
    List<Map<String, Object>> list = new ArrayList<>(subcircuits.size());
    for (Subcircuit subcircuit : subcircuits) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("partition", subcircuit.index());
      map.put("vertices", subcircuit.vertices());
      map.put("a", subcircuit.aggregates().a());
      map.put("p", subcircuit.aggregates().p());
      map.put("o", subcircuit.aggregates().o());
      map.put("f", subcircuit.aggregates().f());
      map.put("d", subcircuit.aggregates().d());
      map.put("cuts_in", subcircuit.cutsIn());
      map.put("cuts_out", subcircuit.cutsOut());
      list.add(map);
    }
    return list;
  }

  private Map<String, Object> allocation(AllocationResult allocation) {
    Map<String, Object> map = new LinkedHashMap<>();
    for (int partition : allocation.allocation().partitions()) {
      List<Map<String, Object>> entries = new ArrayList<>();
      for (ShotAssignment assignment : allocation.allocation().assignments(partition)) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("backend", assignment.backendId());
        entry.put("shots", assignment.shots());
        entries.add(entry);
      }
      map.put(String.valueOf(partition), entries);
    }
    return map;
  }

  private List<Map<String, Object>> diagnostics(List<ScheduleDiagnostic> diagnostics) {
    List<Map<String, Object>> list = new ArrayList<>(diagnostics.size());
    for (ScheduleDiagnostic diagnostic : diagnostics) {
      Map<String, Object> map = new LinkedHashMap<>();
      map.put("reason", diagnostic.reason().name().toLowerCase(Locale.ROOT));
      if (diagnostic.partitionIndex() != null) {
        map.put("partition", diagnostic.partitionIndex());
      }
      if (!diagnostic.attributes().isEmpty()) {
        map.put("attributes", new LinkedHashMap<>(diagnostic.attributes()));
      }
      list.add(map);
    }
    return list;
  }

  private static String statusKey(ScheduleResult result) {
    return result.status().name().toLowerCase(Locale.ROOT);
  }

  private static Double finite(double value) {
    return Double.isFinite(value) ? value : null;
  }
}
