package cutshoot.objective;

import cutshoot.milp.LinearExpression;
import cutshoot.milp.MilpModel;
import cutshoot.milp.SolveOutcome;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sums the enabled objective terms into the model objective.
 *
 * <p>Formulations ask {@link #isEnabled} before creating the variables behind a term, so a
 * disabled term costs nothing. Life cycle: {@code CONFIGURED -> BUILT -> SOLVED -> REPORTED}.
 */
public final class ObjectiveComposer {
  private static final Logger LOG = LoggerFactory.getLogger(ObjectiveComposer.class);

  /** Composer life-cycle stage. */
  public enum Stage {
    CONFIGURED,
    BUILT,
    SOLVED,
    REPORTED
  }

  private final ObjectiveWeights weights;
  private final Map<ObjectiveTerm, LinearExpression> terms = new EnumMap<>(ObjectiveTerm.class);
  private final Map<ObjectiveTerm, Double> normalizers = new EnumMap<>(ObjectiveTerm.class);
  private Stage stage = Stage.CONFIGURED;
  private SolveOutcome outcome;

  public ObjectiveComposer(ObjectiveWeights weights) {
    this.weights = Objects.requireNonNull(weights, "weights");
  }

  public ObjectiveWeights weights() {
    return weights;
  }

  public Stage stage() {
    return stage;
  }

  public boolean isEnabled(ObjectiveTerm term) {
    return weights.weight(term) > 0.0;
  }

  /**
   * Registers (or extends) a term.
   *
   * @param normalizer positive scale the term is divided by when weights ask for normalisation
   */
  public void addTerm(ObjectiveTerm term, LinearExpression expression, double normalizer) {
    requireStage(Stage.CONFIGURED);
    if (!isEnabled(term)) {
      throw new IllegalStateException("term " + term + " is disabled by its weight");
    }
    terms.computeIfAbsent(term, t -> LinearExpression.empty()).addScaled(expression, 1.0);
    normalizers.put(term, normalizer > 0.0 ? normalizer : 1.0);
  }

  public void addTerm(ObjectiveTerm term, LinearExpression expression) {
    addTerm(term, expression, 1.0);
  }

  /** Installs {@code minimize sum(weight * term / normalizer)} on the model. */
  public LinearExpression build(MilpModel model) {
    requireStage(Stage.CONFIGURED);
    LinearExpression objective = LinearExpression.empty();
    terms.forEach(
        (term, expression) -> {
          double scale = weights.weight(term);
          if (weights.normalize()) {
            scale /= normalizers.getOrDefault(term, 1.0);
          }
          objective.addScaled(expression, scale);
        });
    model.minimize(objective);
    LOG.debug("Objective for {} built from terms {}", model.name(), terms.keySet());
    stage = Stage.BUILT;
    return objective;
  }

  public void solved(SolveOutcome solveOutcome) {
    requireStage(Stage.BUILT);
    this.outcome = Objects.requireNonNull(solveOutcome, "solveOutcome");
    stage = Stage.SOLVED;
  }

  /** Unweighted value of each registered term at the solution; empty without a solution. */
  public Map<ObjectiveTerm, Double> report() {
    requireStage(Stage.SOLVED);
    stage = Stage.REPORTED;
    if (!outcome.hasSolution()) {
      return Map.of();
    }
    Map<ObjectiveTerm, Double> values = new EnumMap<>(ObjectiveTerm.class);
    terms.forEach((term, expression) -> values.put(term, expression.value()));
    return Collections.unmodifiableMap(values);
  }

  private void requireStage(Stage expected) {
    if (stage != expected) {
      throw new IllegalStateException("composer is " + stage + ", expected " + expected);
    }
  }
}
