package cutshoot.objective;

import cutshoot.core.InvalidInputException;

/**
 * {@code scale * base^cuts}: every cut multiplies the number of result combinations the
 * reconstruction has to visit.
 */
public record ExponentialPostProcessingCost(double scale, double base)
    implements PostProcessingCostModel {

  /** Four measurement bases per cut. */
  public static final double DEFAULT_BASE = 4.0;

  public ExponentialPostProcessingCost {
    InvalidInputException.require(scale >= 0, "scale must be non-negative");
    InvalidInputException.require(base >= 1.0, "base must be at least 1");
  }

  public static ExponentialPostProcessingCost withScale(double scale) {
    return new ExponentialPostProcessingCost(scale, DEFAULT_BASE);
  }

  @Override
  public double cost(int cutCount) {
    return scale * Math.pow(base, cutCount);
  }
}
