package cutshoot.cli;

import cutshoot.core.SolveStatus;

/** Process exit codes. */
final class ExitCodes {
  static final int OPTIMAL = 0;
  static final int SOLVER_FAILURE = 1;
  static final int INVALID_INPUT = 2;
  static final int LIMIT_REACHED = 3;
  static final int INFEASIBLE = 4;
  static final int IO_FAILURE = 5;

  private ExitCodes() {}

  static int forStatus(SolveStatus status) {
    return switch (status) {
      case OPTIMAL -> OPTIMAL;
      case LIMIT_REACHED -> LIMIT_REACHED;
      case INFEASIBLE -> INFEASIBLE;
      case UNBOUNDED -> SOLVER_FAILURE;
    };
  }
}
