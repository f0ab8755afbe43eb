package cutshoot.milp;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.ortools.linearsolver.MPVariable;
import cutshoot.core.SolveStatus;
import cutshoot.core.model.Subcircuit;
import cutshoot.core.model.WorkloadGraph;
import cutshoot.partition.PartitionFormulation;
import cutshoot.partition.PartitionLayout;
import cutshoot.testing.TestDefaults;
import java.util.Random;
import org.junit.jupiter.api.Test;

final class MilpModelTest {

  @Test
  void solvesSmallIntegerProgram() {
    try (MilpModel model = MilpModel.create("knapsack", TestDefaults.solverSettings())) {
      MPVariable x = model.intVar(0, 10, "x");
      MPVariable y = model.intVar(0, 10, "y");
      model.addGreaterOrEqual(LinearExpression.of(x, 2.0).add(y, 3.0), 12.0, "cover");
      model.minimize(LinearExpression.of(x, 3.0).add(y, 4.0));

      SolveOutcome outcome = model.solve();

      assertEquals(SolveStatus.OPTIMAL, outcome.status(), "Tiny model solves to optimality");
      assertTrue(outcome.hasSolution(), "Optimal outcome carries a solution");
      assertEquals(16.0, outcome.objectiveValue(), 1e-6, "x=0, y=4 is cheapest");
      assertEquals(4, model.intValue(y), "y covers the demand alone");
    }
  }

  @Test
  void constantTermsMoveToTheBounds() {
    try (MilpModel model = MilpModel.create("shift", TestDefaults.solverSettings())) {
      MPVariable x = model.numVar(0, 100, "x");
      model.addEqual(LinearExpression.of(x).addConstant(5.0), 12.0, "shifted");
      model.minimize(LinearExpression.of(x).addConstant(1.0));

      SolveOutcome outcome = model.solve();

      assertEquals(7.0, model.value(x), 1e-6, "x + 5 = 12");
      assertEquals(8.0, outcome.objectiveValue(), 1e-6, "Objective offset is applied");
    }
  }

  @Test
  void reportsInfeasibility() {
    try (MilpModel model = MilpModel.create("empty", TestDefaults.solverSettings())) {
      MPVariable x = model.boolVar("x");
      model.forbid(x);
      model.addGreaterOrEqual(LinearExpression.of(x), 1.0, "needs_x");
      model.minimize(LinearExpression.of(x));

      SolveOutcome outcome = model.solve();

      assertEquals(SolveStatus.INFEASIBLE, outcome.status(), "Forbidden variable cannot be 1");
      assertFalse(outcome.hasSolution(), "No solution without feasibility");
    }
  }

  @Test
  void timeLimitStopsBeforeOptimalityAndKeepsTheIncumbent() {
    WorkloadGraph graph = randomDag(new Random(11), 80);
    SolverSettings tight = new SolverSettings(SolverSettings.SCIP, 1, 0);

    try (MilpModel model = MilpModel.create("hard_partition", tight)) {
      PartitionFormulation formulation = PartitionFormulation.build(model, graph, 10, 10);
      model.minimize(formulation.cutCount());

      SolveOutcome outcome = model.solve();

      assertEquals(
          SolveStatus.LIMIT_REACHED, outcome.status(), "One millisecond never proves optimality");
      if (outcome.hasSolution()) {
        PartitionLayout layout = formulation.extract(model);
        assertEquals(graph.vertexCount(), layout.assignment().size(), "Every vertex is placed");
        for (Subcircuit subcircuit : layout.subcircuits()) {
          assertTrue(subcircuit.size() <= 10, "Incumbent respects the capacity");
        }
      }
    }
  }

  private static WorkloadGraph randomDag(Random random, int vertices) {
    WorkloadGraph.Builder builder = WorkloadGraph.builder();
    for (int v = 0; v < vertices; v++) {
      builder.addVertex(1);
    }
    for (int v = 1; v < vertices; v++) {
      builder.addEdge(random.nextInt(v), v);
      builder.addEdge(random.nextInt(v), v);
    }
    return builder.build();
  }
}
