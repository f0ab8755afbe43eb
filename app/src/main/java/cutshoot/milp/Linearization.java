package cutshoot.milp;

import com.google.ortools.linearsolver.MPVariable;
import java.util.List;
import java.util.Objects;

/** Standard linearisations of product and max terms. */
public final class Linearization {
  private Linearization() {}

  /**
   * Returns a binary {@code z} equal to {@code x AND y} for binaries {@code x}, {@code y}.
   *
   * <p>Four inequalities: {@code z <= x}, {@code z <= y}, {@code z >= x + y - 1}, {@code z >= 0}
   * (the last one as the variable bound).
   */
  public static MPVariable and(MilpModel model, MPVariable x, MPVariable y, String name) {
    MPVariable z = model.boolVar(name);
    constrainAnd(model, z, x, y, name);
    return z;
  }

  /** Adds the AND constraints for an existing binary {@code z}. */
  public static void constrainAnd(
      MilpModel model, MPVariable z, MPVariable x, MPVariable y, String name) {
    model.addLessOrEqual(LinearExpression.of(z).add(x, -1.0), 0.0, name + "_le_x");
    model.addLessOrEqual(LinearExpression.of(z).add(y, -1.0), 0.0, name + "_le_y");
    model.addGreaterOrEqual(
        LinearExpression.of(z).add(x, -1.0).add(y, -1.0), -1.0, name + "_ge_xy");
  }

  /**
   * Returns a continuous {@code g = value * indicator} for a binary indicator and a value known
   * to lie in {@code [0, upperBound]} (McCormick envelope, exact for a binary factor).
   */
  public static MPVariable boundedProduct(
      MilpModel model,
      LinearExpression value,
      double upperBound,
      MPVariable indicator,
      String name) {
    MPVariable g = model.numVar(0.0, upperBound, name);
    model.addLessOrEqual(
        LinearExpression.of(g).add(indicator, -upperBound), 0.0, name + "_le_ind");
    model.addLessOrEqual(LinearExpression.of(g).addScaled(value, -1.0), 0.0, name + "_le_val");
    model.addGreaterOrEqual(
        LinearExpression.of(g).addScaled(value, -1.0).add(indicator, -upperBound),
        -upperBound,
        name + "_ge_val");
    return g;
  }

  /**
   * Epigraph of a max over optional terms: returns {@code m} with
   * {@code m >= term - bigM * (1 - indicator)} for every candidate, so a candidate whose
   * indicator is 0 does not bind. Minimising {@code m} yields the max over active terms.
   */
  public static MPVariable epigraph(MilpModel model, List<EpigraphTerm> terms, String name) {
    MPVariable m = model.numVar(0.0, MilpModel.infinity(), name);
    int index = 0;
    for (EpigraphTerm term : terms) {
      LinearExpression lhs = LinearExpression.of(m).addScaled(term.value(), -1.0);
      if (term.indicator() != null) {
        lhs.add(term.indicator(), -term.bigM());
        model.addGreaterOrEqual(lhs, -term.bigM(), name + "_" + index++);
      } else {
        model.addGreaterOrEqual(lhs, 0.0, name + "_" + index++);
      }
    }
    return m;
  }

  /** One candidate of {@link #epigraph}; {@code indicator} may be null for an always-on term. */
  public record EpigraphTerm(LinearExpression value, MPVariable indicator, double bigM) {
    public EpigraphTerm {
      Objects.requireNonNull(value, "value");
      if (bigM < 0) {
        throw new IllegalArgumentException("bigM must be non-negative");
      }
    }
  }
}
