package cutshoot.objective;

import cutshoot.core.InvalidInputException;

/** {@code fixed + perCut * cuts}. */
public record LinearPostProcessingCost(double fixed, double perCut)
    implements PostProcessingCostModel {

  static final LinearPostProcessingCost ZERO = new LinearPostProcessingCost(0.0, 0.0);

  public LinearPostProcessingCost {
    InvalidInputException.require(
        fixed >= 0 && perCut >= 0, "post-processing cost terms must be non-negative");
  }

  @Override
  public double cost(int cutCount) {
    return fixed + perCut * cutCount;
  }

  @Override
  public boolean isLinear() {
    return true;
  }

  @Override
  public double fixedCost() {
    return fixed;
  }

  @Override
  public double perCutCost() {
    return perCut;
  }

  public boolean isZero() {
    return fixed == 0.0 && perCut == 0.0;
  }
}
