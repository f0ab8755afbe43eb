package cutshoot.partition;

import com.google.ortools.linearsolver.MPVariable;
import cutshoot.core.model.CutEdge;
import cutshoot.core.model.Edge;
import cutshoot.core.model.PartitionAggregates;
import cutshoot.core.model.Subcircuit;
import cutshoot.core.model.WorkloadGraph;
import cutshoot.milp.LinearExpression;
import cutshoot.milp.Linearization;
import cutshoot.milp.MilpModel;
import java.util.ArrayList;
import java.util.List;

/**
 * Partitioning variables and constraints for one graph inside a {@link MilpModel}.
 *
 * <p>Per vertex {@code v} and partition {@code c}: {@code y[v][c]} places the vertex. Per edge
 * {@code e}: {@code x[e][c]} marks the edge as crossing the boundary of {@code c}, which holds iff
 * exactly one endpoint lies in {@code c}. The products {@code zp = x AND y[target]} and
 * {@code zo = x AND y[source]} count the units a partition gains to receive a cut edge and the
 * units it measures out. Aggregates: {@code a = sum w*y}, {@code p = sum zp}, {@code o = sum zo},
 * {@code f = a + p - o}, {@code d = a + p <= capacity}.
 *
 * <p>The combined optimiser builds the same variables and adds its allocation part on top.
 */
public final class PartitionFormulation {
  private final WorkloadGraph graph;
  private final int capacity;
  private final int partitions;
  private final MPVariable[][] y;
  private final MPVariable[][] x;
  private final MPVariable[] a;
  private final MPVariable[] p;
  private final MPVariable[] o;
  private final MPVariable[] f;
  private final MPVariable[] d;
  private final LinearExpression cutIndicators = LinearExpression.empty();

  private PartitionFormulation(WorkloadGraph graph, int capacity, int partitions) {
    this.graph = graph;
    this.capacity = capacity;
    this.partitions = partitions;
    this.y = new MPVariable[graph.vertexCount()][partitions];
    this.x = new MPVariable[graph.edgeCount()][partitions];
    this.a = new MPVariable[partitions];
    this.p = new MPVariable[partitions];
    this.o = new MPVariable[partitions];
    this.f = new MPVariable[partitions];
    this.d = new MPVariable[partitions];
  }

  /** Adds all partitioning variables and structural constraints to {@code model}. */
  public static PartitionFormulation build(
      MilpModel model, WorkloadGraph graph, int capacity, int partitions) {
    PartitionFormulation formulation = new PartitionFormulation(graph, capacity, partitions);
    formulation.addAssignment(model);
    formulation.addCutConsistency(model);
    formulation.addAggregates(model);
    return formulation;
  }

  private void addAssignment(MilpModel model) {
    for (int v = 0; v < graph.vertexCount(); v++) {
      LinearExpression placed = LinearExpression.empty();
      for (int c = 0; c < partitions; c++) {
        y[v][c] = model.boolVar("y_" + v + "_" + c);
        // vertex k may only use partitions 0..k
        if (c > v) {
          model.forbid(y[v][c]);
        }
        placed.add(y[v][c], 1.0);
      }
      model.addEqual(placed, 1.0, "assign_" + v);
    }
  }

  private void addCutConsistency(MilpModel model) {
    for (Edge edge : graph.edges()) {
      int e = edge.index();
      for (int c = 0; c < partitions; c++) {
        MPVariable cut = model.boolVar("x_" + e + "_" + c);
        x[e][c] = cut;
        MPVariable src = y[edge.source()][c];
        MPVariable dst = y[edge.target()][c];
        String tag = "cut_" + e + "_" + c;
        // both inside or both outside: not cut; exactly one inside: cut
        model.addLessOrEqual(
            LinearExpression.of(cut).add(src, 1.0).add(dst, 1.0), 2.0, tag + "_in");
        model.addLessOrEqual(
            LinearExpression.of(cut).add(src, -1.0).add(dst, -1.0), 0.0, tag + "_out");
        model.addGreaterOrEqual(
            LinearExpression.of(cut).add(src, -1.0).add(dst, 1.0), 0.0, tag + "_src");
        model.addGreaterOrEqual(
            LinearExpression.of(cut).add(src, 1.0).add(dst, -1.0), 0.0, tag + "_dst");
        cutIndicators.add(cut, 1.0);
      }
    }
  }

  private void addAggregates(MilpModel model) {
    int edges = graph.edgeCount();
    for (int c = 0; c < partitions; c++) {
      a[c] = model.intVar(0, graph.totalWeight(), "a_" + c);
      p[c] = model.intVar(0, edges, "p_" + c);
      o[c] = model.intVar(0, edges, "o_" + c);
      // f is negative when a partition measures out more wires than it owns
      f[c] = model.intVar(-edges, graph.totalWeight() + edges, "f_" + c);
      d[c] = model.intVar(0, capacity, "d_" + c);

      LinearExpression owned = LinearExpression.of(a[c], -1.0);
      for (int v = 0; v < graph.vertexCount(); v++) {
        owned.add(y[v][c], graph.weight(v));
      }
      model.addEqual(owned, 0.0, "a_def_" + c);

      LinearExpression introduced = LinearExpression.of(p[c], -1.0);
      LinearExpression measured = LinearExpression.of(o[c], -1.0);
      for (Edge edge : graph.edges()) {
        int e = edge.index();
        introduced.add(
            Linearization.and(model, x[e][c], y[edge.target()][c], "zp_" + e + "_" + c), 1.0);
        measured.add(
            Linearization.and(model, x[e][c], y[edge.source()][c], "zo_" + e + "_" + c), 1.0);
      }
      model.addEqual(introduced, 0.0, "p_def_" + c);
      model.addEqual(measured, 0.0, "o_def_" + c);

      model.addEqual(
          LinearExpression.of(f[c]).add(a[c], -1.0).add(p[c], -1.0).add(o[c], 1.0),
          0.0,
          "f_def_" + c);
      model.addEqual(
          LinearExpression.of(d[c]).add(a[c], -1.0).add(p[c], -1.0), 0.0, "d_def_" + c);
    }
  }

  /** Number of physical cuts: every cut edge is marked for both adjacent partitions. */
  public LinearExpression cutCount() {
    return LinearExpression.empty().addScaled(cutIndicators, 0.5);
  }

  /** Restricts the model to solutions with exactly {@code cuts} cut edges. */
  public void requireCutCount(MilpModel model, int cuts) {
    model.addEqual(cutIndicators.copy(), 2.0 * cuts, "exact_cut_count");
  }

  public int partitions() {
    return partitions;
  }

  public int capacity() {
    return capacity;
  }

  public WorkloadGraph graph() {
    return graph;
  }

  /** Total units {@code d[c]} of partition {@code c}. */
  public MPVariable size(int c) {
    return d[c];
  }

  /** Indicator {@code y[v][c]} placing vertex {@code v} in partition {@code c}. */
  public MPVariable placement(int v, int c) {
    return y[v][c];
  }

  /** Reads the layout at the model's current solution. */
  public PartitionLayout extract(MilpModel model) {
    List<Integer> assignment = new ArrayList<>(graph.vertexCount());
    List<List<Integer>> members = new ArrayList<>(partitions);
    for (int c = 0; c < partitions; c++) {
      members.add(new ArrayList<>());
    }
    for (int v = 0; v < graph.vertexCount(); v++) {
      int chosen = 0;
      for (int c = 0; c < partitions; c++) {
        if (model.isSet(y[v][c])) {
          chosen = c;
          break;
        }
      }
      assignment.add(chosen);
      members.get(chosen).add(v);
    }

    List<CutEdge> cutEdges = new ArrayList<>();
    int cutMarks = 0;
    for (Edge edge : graph.edges()) {
      int from = assignment.get(edge.source());
      int to = assignment.get(edge.target());
      if (from != to) {
        cutEdges.add(new CutEdge(edge, from, CutEdge.Direction.OUT));
        cutEdges.add(new CutEdge(edge, to, CutEdge.Direction.IN));
        cutMarks++;
      }
    }

    List<Subcircuit> subcircuits = new ArrayList<>();
    for (int c = 0; c < partitions; c++) {
      if (members.get(c).isEmpty()) {
        continue;
      }
      List<Integer> cutsIn = new ArrayList<>();
      List<Integer> cutsOut = new ArrayList<>();
      for (CutEdge cutEdge : cutEdges) {
        if (cutEdge.partition() != c) {
          continue;
        }
        if (cutEdge.direction() == CutEdge.Direction.IN) {
          cutsIn.add(cutEdge.edge().target());
        } else {
          cutsOut.add(cutEdge.edge().source());
        }
      }
      PartitionAggregates aggregates =
          PartitionAggregates.of(model.intValue(a[c]), model.intValue(p[c]), model.intValue(o[c]));
      subcircuits.add(new Subcircuit(c, members.get(c), aggregates, cutsIn, cutsOut));
    }
    return new PartitionLayout(assignment, cutEdges, subcircuits, cutMarks);
  }
}
