package cutshoot.cli;

import cutshoot.core.InvalidInputException;
import cutshoot.milp.SolverFailureException;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code run --example path10}
 *   <li>{@code run --file problem.json --mode joint_uniform --time-limit 30}
 *   <li>{@code sweep --example path10 --subcircuits 2,3,4}
 * </ul>
 *
 * <p>Exit codes: 0 optimal, 3 limit reached, 4 infeasible, 2 invalid input, 1 solver failure, 5
 * problem or report file I/O failure.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    System.exit(execute(args));
  }

  static int execute(String[] args) {
    String command = args != null && args.length > 0 ? args[0] : "run";
    try {
      return switch (command) {
        case "sweep" -> new SweepCommand().execute(args);
        case "run" -> new RunCommand().execute(args);
        default -> {
          if (command.startsWith("--")) {
            yield new RunCommand().execute(args);
          }
          throw new InvalidInputException("Unknown command: " + command);
        }
      };
    } catch (SolverFailureException ex) {
      LOG.error("Solver failure: {}", ex.getMessage(), ex);
      return ExitCodes.SOLVER_FAILURE;
    } catch (IllegalArgumentException ex) {
      LOG.error("Invalid input: {}", ex.getMessage());
      return ExitCodes.INVALID_INPUT;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return ExitCodes.IO_FAILURE;
    }
  }
}
