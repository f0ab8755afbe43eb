package cutshoot.milp;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import cutshoot.core.SolveStatus;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One OR-Tools {@link MPSolver} instance together with the helpers the formulations use to add
 * variables and constraints.
 *
 * <p>A model is built, solved once and then closed; it is never shared between runs.
 */
public final class MilpModel implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(MilpModel.class);
  private static volatile boolean nativesLoaded;

  private final String name;
  private final SolverSettings settings;
  private final MPSolver solver;
  private boolean closed;

  private MilpModel(String name, SolverSettings settings, MPSolver solver) {
    this.name = name;
    this.settings = settings;
    this.solver = solver;
  }

  /**
   * Creates an empty minimisation model backed by the engine named in {@code settings}.
   *
   * @throws SolverFailureException when the engine is not available in the native bundle
   */
  public static MilpModel create(String name, SolverSettings settings) {
    Objects.requireNonNull(settings, "settings");
    ensureNativeLibraries();
    MPSolver solver = MPSolver.createSolver(settings.solverId());
    if (solver == null) {
      throw new SolverFailureException("Solver engine unavailable: " + settings.solverId());
    }
    if (settings.hasTimeLimit()) {
      solver.setTimeLimit(settings.timeLimitMs());
    }
    if (!solver.setNumThreads(1)) {
      LOG.debug("Engine {} ignores the thread count setting", settings.solverId());
    }
    if (SolverSettings.SCIP.equals(settings.solverId())) {
      solver.setSolverSpecificParametersAsString(
          "randomization/randomseedshift = " + settings.randomSeed() + "\n");
    }
    return new MilpModel(name, settings, solver);
  }

  private static void ensureNativeLibraries() {
    if (nativesLoaded) {
      return;
    }
    synchronized (MilpModel.class) {
      if (!nativesLoaded) {
        try {
          Loader.loadNativeLibraries();
        } catch (RuntimeException | LinkageError ex) {
          throw new SolverFailureException("Unable to load OR-Tools native libraries", ex);
        }
        nativesLoaded = true;
      }
    }
  }

  public String name() {
    return name;
  }

  public MPVariable boolVar(String varName) {
    return solver.makeBoolVar(varName);
  }

  public MPVariable intVar(double lowerBound, double upperBound, String varName) {
    return solver.makeIntVar(lowerBound, upperBound, varName);
  }

  public MPVariable numVar(double lowerBound, double upperBound, String varName) {
    return solver.makeNumVar(lowerBound, upperBound, varName);
  }

  /** Pins a variable's upper bound to zero; used for hard exclusions. */
  public void forbid(MPVariable variable) {
    variable.setUb(0.0);
  }

  public static double infinity() {
    return MPSolver.infinity();
  }

  /** {@code expression <= rhs}. */
  public MPConstraint addLessOrEqual(
      LinearExpression expression, double rhs, String constraintName) {
    return addRange(Double.NEGATIVE_INFINITY, expression, rhs, constraintName);
  }

  /** {@code expression >= rhs}. */
  public MPConstraint addGreaterOrEqual(
      LinearExpression expression, double rhs, String constraintName) {
    return addRange(rhs, expression, Double.POSITIVE_INFINITY, constraintName);
  }

  /** {@code expression == rhs}. */
  public MPConstraint addEqual(LinearExpression expression, double rhs, String constraintName) {
    return addRange(rhs, expression, rhs, constraintName);
  }

  /** {@code lowerBound <= expression <= upperBound}; the expression constant is moved across. */
  public MPConstraint addRange(
      double lowerBound, LinearExpression expression, double upperBound, String constraintName) {
    double shift = expression.constantTerm();
    double lb = Double.isInfinite(lowerBound) ? -infinity() : lowerBound - shift;
    double ub = Double.isInfinite(upperBound) ? infinity() : upperBound - shift;
    MPConstraint constraint = solver.makeConstraint(lb, ub, constraintName);
    for (Map.Entry<MPVariable, Double> term : expression.terms().entrySet()) {
      constraint.setCoefficient(term.getKey(), term.getValue());
    }
    return constraint;
  }

  /** Replaces the objective with {@code minimize expression}. */
  public void minimize(LinearExpression expression) {
    MPObjective objective = solver.objective();
    objective.clear();
    for (Map.Entry<MPVariable, Double> term : expression.terms().entrySet()) {
      objective.setCoefficient(term.getKey(), term.getValue());
    }
    objective.setOffset(expression.constantTerm());
    objective.setMinimization();
  }

  public int variableCount() {
    return solver.numVariables();
  }

  public int constraintCount() {
    return solver.numConstraints();
  }

  /**
   * Runs the engine and maps its status.
   *
   * @throws SolverFailureException on {@code ABNORMAL}, {@code MODEL_INVALID} or an unsolved
   *     model without a time limit
   */
  public SolveOutcome solve() {
    LOG.debug(
        "Solving {} with {} ({} variables, {} constraints)",
        name,
        settings.solverId(),
        variableCount(),
        constraintCount());
    MPSolver.ResultStatus status = solver.solve();
    long wallTime = solver.wallTime();
    return switch (status) {
      case OPTIMAL -> withSolution(SolveStatus.OPTIMAL, wallTime);
      case FEASIBLE -> withSolution(SolveStatus.LIMIT_REACHED, wallTime);
      case INFEASIBLE -> SolveOutcome.withoutSolution(SolveStatus.INFEASIBLE, wallTime);
      case UNBOUNDED -> SolveOutcome.withoutSolution(SolveStatus.UNBOUNDED, wallTime);
      case NOT_SOLVED -> {
        if (settings.hasTimeLimit()) {
          yield SolveOutcome.withoutSolution(SolveStatus.LIMIT_REACHED, wallTime);
        }
        throw new SolverFailureException(name + ": engine returned NOT_SOLVED without a limit");
      }
      default -> throw new SolverFailureException(name + ": engine returned " + status);
    };
  }

  private SolveOutcome withSolution(SolveStatus status, long wallTime) {
    MPObjective objective = solver.objective();
    return new SolveOutcome(status, true, objective.value(), objective.bestBound(), wallTime);
  }

  public double value(MPVariable variable) {
    return variable.solutionValue();
  }

  public int intValue(MPVariable variable) {
    return (int) Math.round(variable.solutionValue());
  }

  public boolean isSet(MPVariable binary) {
    return binary.solutionValue() > 0.5;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      solver.delete();
    }
  }
}
