package cutshoot.objective;

/**
 * Estimated time to recombine sub-job results as a function of the number of cuts.
 *
 * <p>Only linear models can be placed inside the MILP; others are evaluated after solving over a
 * pool of candidate solutions.
 */
public interface PostProcessingCostModel {

  double cost(int cutCount);

  default boolean isLinear() {
    return false;
  }

  /** Constant part of a linear model. */
  default double fixedCost() {
    throw new UnsupportedOperationException("not a linear cost model");
  }

  /** Slope per cut of a linear model. */
  default double perCutCost() {
    throw new UnsupportedOperationException("not a linear cost model");
  }

  static PostProcessingCostModel none() {
    return LinearPostProcessingCost.ZERO;
  }
}
