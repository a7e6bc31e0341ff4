package qdot.fitting.solver;

import java.util.List;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealVector;
import org.apache.log4j.Logger;
import qdot.fitting.input.Configuration;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.ModelFunction;

/**
 * Solves a curve fit by building the least-squares problem directly: the target is the measured
 * data, the model function is the model evaluated at each sample point, and the jacobian is
 * calculated by forward differences. The problem is minimized with the Apache Commons
 * Levenberg-Marquardt optimizer; bounds are enforced by clamping each iterate.
 */
public class LevenbergMarquardtSolver implements CurveSolver {

  private static final Logger logger = Logger.getLogger(LevenbergMarquardtSolver.class);

  private final int maxEvaluations;
  private final int maxIterations;
  private final double costTolerance;
  private final double parameterTolerance;

  public LevenbergMarquardtSolver() {
    this(Configuration.getInstance());
  }

  public LevenbergMarquardtSolver(Configuration config) {
    this(config.getMaxEvaluations(), config.getMaxIterations(),
        config.getCostRelativeTolerance(), config.getParameterRelativeTolerance());
  }

  public LevenbergMarquardtSolver(int maxEvaluations, int maxIterations, double costTolerance,
      double parameterTolerance) {
    this.maxEvaluations = maxEvaluations;
    this.maxIterations = maxIterations;
    this.costTolerance = costTolerance;
    this.parameterTolerance = parameterTolerance;
  }

  @Override
  public SolverResult solve(ModelFunction model, SampleSeries series, double[] initial,
      List<ParameterBound> bounds) {
    model.getSchema().checkLength(initial);
    BoundsValidator validator = bounds.isEmpty() ? null
        : new BoundsValidator(model.getSchema(), bounds);
    double[] start = validator == null ? initial.clone() : validator.clamp(initial);

    RealVector startVector = MatrixUtils.createRealVector(start);
    RealVector observedComponents = MatrixUtils.createRealVector(series.getY());

    LeastSquaresProblem lsp = new LeastSquaresBuilder().
        start(startVector).
        target(observedComponents).
        model(new ModelJacobian(model, series.getX(), validator)).
        parameterValidator(validator).
        lazyEvaluation(false).
        maxEvaluations(maxEvaluations).
        maxIterations(maxIterations).
        build();

    LeastSquaresOptimizer optimizer = new LevenbergMarquardtOptimizer().
        withCostRelativeTolerance(costTolerance).
        withParameterRelativeTolerance(parameterTolerance);

    logger.debug("Fitting " + model.getName() + " " + model.getSchema()
        + " from initial point " + startVector);
    LeastSquaresOptimizer.Optimum optimum = optimizer.optimize(lsp);
    logger.debug("Converged after " + optimum.getIterations() + " iterations, RMS "
        + optimum.getRMS());

    return SolverResult.fromOptimum(optimum, series.size());
  }
}
