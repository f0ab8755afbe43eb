package cutshoot.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import cutshoot.core.ScheduleOptions;
import cutshoot.core.ScheduleResult;
import cutshoot.core.SolveStatus;
import cutshoot.core.diagnostics.ScheduleDiagnostic;
import cutshoot.pipeline.SchedulingPipeline;
import cutshoot.testing.TestDefaults;
import java.util.List;
import org.junit.jupiter.api.Test;

final class JsonReportBuilderTest {
  private final JsonReportBuilder builder = new JsonReportBuilder();

  @Test
  void reportCarriesLayoutAllocationAndTiming() {
    Problem problem = Examples.path10();
    ScheduleOptions options =
        problem.options().toBuilder().solverTimeLimitMs(TestDefaults.solverTimeLimitMs()).build();
    ScheduleResult result =
        new SchedulingPipeline().run(problem.graph(), problem.backends(), options);

    JsonObject report = JsonParser.parseString(builder.build(result)).getAsJsonObject();

    assertEquals("optimal", report.get("status").getAsString(), "Lower-case status");
    assertEquals(10, report.getAsJsonArray("partition_assignment").size(), "One entry per vertex");
    assertEquals(2, report.get("cut_count").getAsInt(), "Cut count");
    assertEquals(4, report.getAsJsonArray("cut_edges").size(), "Two cuts, listed for both sides");
    JsonArray aggregates = report.getAsJsonArray("per_partition_aggregates");
    assertEquals(3, aggregates.size(), "Three subcircuits");
    assertTrue(aggregates.get(0).getAsJsonObject().has("d"), "Aggregates expose d");
    assertEquals(3, report.getAsJsonObject("allocation").size(), "Allocation per subcircuit");
    assertEquals(18.0, report.get("makespan").getAsDouble(), 1e-6, "Makespan");
    assertTrue(report.has("backend_busy_time"), "Busy times are reported");
    JsonObject meta = report.getAsJsonObject("meta");
    assertEquals("single_select", meta.get("objective_mode").getAsString(), "Mode key");
    assertTrue(meta.has("time_ms"), "Elapsed time is reported");
  }

  @Test
  void infeasibleReportListsDiagnosticsAndNullObjective() {
    ScheduleResult result =
        new ScheduleResult(
            SolveStatus.INFEASIBLE,
            Double.NaN,
            null,
            null,
            Double.NaN,
            List.of(ScheduleDiagnostic.partitionCapacity(10, 4, 2)),
            ScheduleOptions.defaults(),
            3L);

    JsonObject report = JsonParser.parseString(builder.build(result)).getAsJsonObject();

    assertEquals("infeasible", report.get("status").getAsString(), "Status");
    assertTrue(report.get("objective").isJsonNull(), "NaN objective becomes null");
    assertFalse(report.has("allocation"), "No allocation section");
    JsonObject diagnostic = report.getAsJsonArray("diagnostics").get(0).getAsJsonObject();
    assertEquals("partition_capacity", diagnostic.get("reason").getAsString(), "Reason key");
    assertEquals(
        10,
        diagnostic.getAsJsonObject("attributes").get("totalWeight").getAsInt(),
        "Attributes are kept");
  }
}
