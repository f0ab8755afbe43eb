package cutshoot.milp;

import static org.junit.jupiter.api.Assertions.assertEquals;

import com.google.ortools.linearsolver.MPVariable;
import cutshoot.milp.Linearization.EpigraphTerm;
import cutshoot.testing.TestDefaults;
import java.util.List;
import org.junit.jupiter.api.Test;

final class LinearizationTest {

  @Test
  void andMatchesTruthTable() {
    int[][] cases = {{0, 0}, {0, 1}, {1, 0}, {1, 1}};
    for (int[] input : cases) {
      try (MilpModel model = MilpModel.create("and", TestDefaults.solverSettings())) {
        MPVariable x = model.boolVar("x");
        MPVariable y = model.boolVar("y");
        x.setBounds(input[0], input[0]);
        y.setBounds(input[1], input[1]);
        MPVariable z = Linearization.and(model, x, y, "z");
        // push z away from the expected value; the constraints alone must pin it
        model.minimize(LinearExpression.of(z, (input[0] & input[1]) == 1 ? 1.0 : -1.0));
        model.solve();

        assertEquals(
            input[0] & input[1],
            model.intValue(z),
            "AND of " + input[0] + " and " + input[1]);
      }
    }
  }

  @Test
  void boundedProductIsZeroWhenIndicatorIsOff() {
    try (MilpModel model = MilpModel.create("product", TestDefaults.solverSettings())) {
      MPVariable value = model.numVar(0, 10, "value");
      value.setBounds(6, 6);
      MPVariable off = model.boolVar("off");
      off.setBounds(0, 0);
      MPVariable on = model.boolVar("on");
      on.setBounds(1, 1);
      MPVariable gOff =
          Linearization.boundedProduct(model, LinearExpression.of(value), 10, off, "g_off");
      MPVariable gOn =
          Linearization.boundedProduct(model, LinearExpression.of(value), 10, on, "g_on");
      model.minimize(LinearExpression.of(gOff, -1.0).add(gOn, -1.0));
      model.solve();

      assertEquals(0.0, model.value(gOff), 1e-6, "Product with a zero indicator");
      assertEquals(6.0, model.value(gOn), 1e-6, "Product with a unit indicator");
    }
  }

  @Test
  void epigraphTracksMaximumOfActiveTerms() {
    try (MilpModel model = MilpModel.create("max", TestDefaults.solverSettings())) {
      MPVariable active = model.boolVar("active");
      MPVariable inactive = model.boolVar("inactive");
      active.setBounds(1, 1);
      inactive.setBounds(0, 0);
      MPVariable m =
          Linearization.epigraph(
              model,
              List.of(
                  new EpigraphTerm(LinearExpression.constant(4.0), null, 0.0),
                  new EpigraphTerm(LinearExpression.constant(7.0), active, 100.0),
                  new EpigraphTerm(LinearExpression.constant(50.0), inactive, 100.0)),
              "makespan");
      model.minimize(LinearExpression.of(m));
      model.solve();

      assertEquals(7.0, model.value(m), 1e-6, "Inactive candidate does not bind");
    }
  }
}
