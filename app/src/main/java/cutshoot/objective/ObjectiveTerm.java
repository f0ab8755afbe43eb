package cutshoot.objective;

/** Terms the composer can sum into the objective. */
public enum ObjectiveTerm {
  CUTS,
  LATENCY,
  QOS,
  POST_PROCESSING
}
