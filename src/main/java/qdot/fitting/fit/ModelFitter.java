package qdot.fitting.fit;

import java.util.List;
import org.apache.log4j.Logger;
import qdot.fitting.input.Configuration;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.ModelFunction;
import qdot.fitting.output.FitResult;
import qdot.fitting.output.ResultNormalizer;
import qdot.fitting.solver.CurveSolver;
import qdot.fitting.solver.ParameterBound;
import qdot.fitting.solver.SolverResult;

/**
 * Common base of the fitters for each model family. A fitter turns a sample series into an
 * initial guess (the estimate), hands that guess and any parameter bounds to a solver, and wraps
 * the solver's output as a {@link FitResult}. Subclasses add model-specific post-processing,
 * such as reordering peaks or computing derived values.
 *
 * Fitters keep no state between fits, so a single instance may be shared between threads as
 * long as its solver is.
 */
public abstract class ModelFitter {

  private static final Logger logger = Logger.getLogger(ModelFitter.class);

  final Configuration config;
  private final CurveSolver solver;

  ModelFitter(Configuration config, CurveSolver solver) {
    this.config = config;
    this.solver = solver;
  }

  /**
   * @return Smallest number of samples the estimator of this fitter can work with
   */
  public abstract int minimumSize();

  public CurveSolver getSolver() {
    return solver;
  }

  FitResult runFit(ModelFunction model, SampleSeries series, double[] initial,
      List<ParameterBound> bounds) {
    return runFit(solver, model, series, initial, bounds);
  }

  /**
   * Solve for the parameters of a model and normalize the result
   *
   * @param curveSolver Solver to use
   * @param model Model to fit
   * @param series Data to fit
   * @param initial Initial guess
   * @param bounds Parameter bounds
   * @return Result of the fit, with no derived values yet
   */
  FitResult runFit(CurveSolver curveSolver, ModelFunction model, SampleSeries series,
      double[] initial, List<ParameterBound> bounds) {
    series.requireMinimumSize(minimumSize());
    model.getSchema().checkLength(initial);
    logger.debug("Fitting " + series.getName() + " (" + series.size() + " points) with "
        + model.getName() + " using " + curveSolver.getClass().getSimpleName());
    SolverResult solved = curveSolver.solve(model, series, initial, bounds);
    logger.debug("Solver stopped after " + solved.getIterations() + " iterations and "
        + solved.getEvaluations() + " evaluations");
    FitResult result = ResultNormalizer.normalize(model, initial, solved);
    logger.debug(result);
    return result;
  }
}
