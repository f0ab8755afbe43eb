package cutshoot.objective;

import cutshoot.core.InvalidInputException;

/**
 * Weights of the objective terms. A zero weight disables the term: its variables and constraints
 * are not built.
 *
 * @param normalize divide the cut term by the edge count and the latency term by a makespan
 *     upper bound before weighting
 */
public record ObjectiveWeights(
    double cut, double latency, double qos, double postProcessing, boolean normalize) {

  public ObjectiveWeights {
    requireWeight(cut, "cut");
    requireWeight(latency, "latency");
    requireWeight(qos, "qos");
    requireWeight(postProcessing, "post-processing");
  }

  public static ObjectiveWeights defaults() {
    return new ObjectiveWeights(1.0, 1.0, 1.0, 1.0, false);
  }

  public double weight(ObjectiveTerm term) {
    return switch (term) {
      case CUTS -> cut;
      case LATENCY -> latency;
      case QOS -> qos;
      case POST_PROCESSING -> postProcessing;
    };
  }

  private static void requireWeight(double value, String name) {
    InvalidInputException.require(
        Double.isFinite(value) && value >= 0, name + " weight must be non-negative: " + value);
  }
}
