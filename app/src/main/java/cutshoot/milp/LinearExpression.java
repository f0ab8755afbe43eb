package cutshoot.milp;

import com.google.ortools.linearsolver.MPVariable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable affine expression {@code constant + sum(coefficient * variable)} over solver variables.
 *
 * <p>Variables are keyed by proxy identity, so the same {@link MPVariable} instance must be used
 * for every term that refers to it.
 */
public final class LinearExpression {
  private final Map<MPVariable, Double> terms = new LinkedHashMap<>();
  private double constant;

  public static LinearExpression empty() {
    return new LinearExpression();
  }

  public static LinearExpression of(MPVariable variable) {
    return new LinearExpression().add(variable, 1.0);
  }

  public static LinearExpression of(MPVariable variable, double coefficient) {
    return new LinearExpression().add(variable, coefficient);
  }

  public static LinearExpression constant(double value) {
    return new LinearExpression().addConstant(value);
  }

  public LinearExpression add(MPVariable variable, double coefficient) {
    if (coefficient != 0.0) {
      terms.merge(variable, coefficient, Double::sum);
    }
    return this;
  }

  public LinearExpression addConstant(double value) {
    constant += value;
    return this;
  }

  /** Adds {@code scale * other} to this expression. */
  public LinearExpression addScaled(LinearExpression other, double scale) {
    if (scale == 0.0) {
      return this;
    }
    other.terms.forEach((variable, coefficient) -> add(variable, coefficient * scale));
    constant += other.constant * scale;
    return this;
  }

  public LinearExpression copy() {
    return new LinearExpression().addScaled(this, 1.0);
  }

  public Map<MPVariable, Double> terms() {
    return Collections.unmodifiableMap(terms);
  }

  public double constantTerm() {
    return constant;
  }

  /** Evaluates the expression at the solver's current solution. */
  public double value() {
    double total = constant;
    for (Map.Entry<MPVariable, Double> term : terms.entrySet()) {
      total += term.getValue() * term.getKey().solutionValue();
    }
    return total;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    terms.forEach(
        (variable, coefficient) -> {
          if (sb.length() > 0) {
            sb.append(" + ");
          }
          sb.append(coefficient).append('*').append(variable.name());
        });
    if (constant != 0.0 || sb.length() == 0) {
      if (sb.length() > 0) {
        sb.append(" + ");
      }
      sb.append(constant);
    }
    return sb.toString();
  }
}
