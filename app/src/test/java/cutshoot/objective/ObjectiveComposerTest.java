package cutshoot.objective;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.ortools.linearsolver.MPVariable;
import cutshoot.milp.LinearExpression;
import cutshoot.milp.MilpModel;
import cutshoot.milp.SolveOutcome;
import cutshoot.testing.TestDefaults;
import java.util.Map;
import org.junit.jupiter.api.Test;

final class ObjectiveComposerTest {

  @Test
  void weightsAndNormalisesTerms() {
    ObjectiveComposer composer =
        new ObjectiveComposer(new ObjectiveWeights(2.0, 1.0, 0.0, 0.0, true));
    try (MilpModel model = MilpModel.create("composer", TestDefaults.solverSettings())) {
      MPVariable cuts = model.numVar(3, 3, "cuts");
      MPVariable latency = model.numVar(5, 5, "latency");
      composer.addTerm(ObjectiveTerm.CUTS, LinearExpression.of(cuts), 6.0);
      composer.addTerm(ObjectiveTerm.LATENCY, LinearExpression.of(latency), 10.0);
      composer.build(model);

      SolveOutcome outcome = model.solve();
      composer.solved(outcome);
      Map<ObjectiveTerm, Double> report = composer.report();

      assertEquals(2.0 * 3 / 6 + 5.0 / 10, outcome.objectiveValue(), 1e-6, "Weighted sum");
      assertEquals(3.0, report.get(ObjectiveTerm.CUTS), 1e-6, "Report is unweighted");
      assertEquals(ObjectiveComposer.Stage.REPORTED, composer.stage(), "Life cycle ends");
    }
  }

  @Test
  void zeroWeightDisablesTerm() {
    ObjectiveComposer composer =
        new ObjectiveComposer(new ObjectiveWeights(1.0, 1.0, 0.0, 1.0, false));

    assertFalse(composer.isEnabled(ObjectiveTerm.QOS), "QoS weight is zero");
    assertThrows(
        IllegalStateException.class,
        () -> composer.addTerm(ObjectiveTerm.QOS, LinearExpression.constant(1.0)),
        "Disabled terms cannot be registered");
  }

  @Test
  void lifeCycleIsEnforced() {
    ObjectiveComposer composer = new ObjectiveComposer(ObjectiveWeights.defaults());

    assertThrows(
        IllegalStateException.class, composer::report, "Cannot report before solving");
  }
}
