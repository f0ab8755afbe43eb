package cutshoot.objective;

import cutshoot.core.InvalidInputException;

/** Weights of the normalised price and unreliability penalties. */
public record QosWeights(double priceWeight, double reliabilityWeight) {

  public QosWeights {
    InvalidInputException.require(
        Double.isFinite(priceWeight) && priceWeight >= 0, "price weight must be non-negative");
    InvalidInputException.require(
        Double.isFinite(reliabilityWeight) && reliabilityWeight >= 0,
        "reliability weight must be non-negative");
  }

  public static QosWeights none() {
    return new QosWeights(0.0, 0.0);
  }

  public boolean isZero() {
    return priceWeight == 0.0 && reliabilityWeight == 0.0;
  }
}
