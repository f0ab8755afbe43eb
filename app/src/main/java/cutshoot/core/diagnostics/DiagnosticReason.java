package cutshoot.core.diagnostics;

/** Constraint families that can explain an infeasible run. */
public enum DiagnosticReason {
  VERTEX_EXCEEDS_CAPACITY,
  PARTITION_CAPACITY,
  PREDICATES_EXCLUDE_ALL,
  NO_BACKEND_CAPACITY,
  NO_FEASIBLE_ALLOCATION,
  SOLVER_LIMIT_WITHOUT_INCUMBENT;
}
