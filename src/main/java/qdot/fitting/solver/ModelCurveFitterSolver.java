package qdot.fitting.solver;

import java.util.Collection;
import java.util.List;
import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.fitting.AbstractCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoint;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresBuilder;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.fitting.leastsquares.LeastSquaresProblem;
import org.apache.commons.math3.fitting.leastsquares.LevenbergMarquardtOptimizer;
import org.apache.commons.math3.linear.DiagonalMatrix;
import qdot.fitting.input.Configuration;
import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.ModelFunction;

/**
 * Solves a curve fit through the Apache Commons curve-fitting layer: the model is wrapped as a
 * {@link ParametricUnivariateFunction}, the data as weighted observed points (all weights 1),
 * and the least-squares problem is built by an {@link AbstractCurveFitter}. Numerically this is
 * the same minimization as {@link LevenbergMarquardtSolver}.
 */
public class ModelCurveFitterSolver implements CurveSolver {

  private final Configuration config;

  public ModelCurveFitterSolver() {
    this(Configuration.getInstance());
  }

  public ModelCurveFitterSolver(Configuration config) {
    this.config = config;
  }

  @Override
  public SolverResult solve(ModelFunction model, SampleSeries series, double[] initial,
      List<ParameterBound> bounds) {
    model.getSchema().checkLength(initial);
    BoundsValidator validator = bounds.isEmpty() ? null
        : new BoundsValidator(model.getSchema(), bounds);
    double[] start = validator == null ? initial.clone() : validator.clamp(initial);

    WeightedObservedPoints points = new WeightedObservedPoints();
    for (int i = 0; i < series.size(); ++i) {
      points.add(series.getX(i), series.getY(i));
    }

    ModelCurveFitter fitter = new ModelCurveFitter(model, start, validator, series.getX());
    LeastSquaresOptimizer.Optimum optimum = fitter.optimize(points.toList());
    return SolverResult.fromOptimum(optimum, series.size());
  }

  /**
   * Adapter presenting a model function with numerically differentiated gradient to the
   * curve fitter
   */
  private static class ParametricModel implements ParametricUnivariateFunction {

    private final ModelFunction model;
    private final ModelJacobian jacobian;

    ParametricModel(ModelFunction model, ModelJacobian jacobian) {
      this.model = model;
      this.jacobian = jacobian;
    }

    @Override
    public double value(double x, double... parameters) {
      return model.value(x, parameters);
    }

    @Override
    public double[] gradient(double x, double... parameters) {
      return jacobian.gradient(x, parameters);
    }
  }

  private class ModelCurveFitter extends AbstractCurveFitter {

    private final ParametricModel function;
    private final double[] initialGuess;
    private final BoundsValidator validator;

    ModelCurveFitter(ModelFunction model, double[] initialGuess, BoundsValidator validator,
        double[] xData) {
      this.function = new ParametricModel(model, new ModelJacobian(model, xData, validator));
      this.initialGuess = initialGuess;
      this.validator = validator;
    }

    /**
     * Same as {@link #fit(Collection)} but keeps the optimizer's statistics
     *
     * @param observations Data points to fit
     * @return The optimum found by the optimizer
     */
    LeastSquaresOptimizer.Optimum optimize(Collection<WeightedObservedPoint> observations) {
      return getOptimizer().optimize(getProblem(observations));
    }

    @Override
    protected LeastSquaresOptimizer getOptimizer() {
      return new LevenbergMarquardtOptimizer()
          .withCostRelativeTolerance(config.getCostRelativeTolerance())
          .withParameterRelativeTolerance(config.getParameterRelativeTolerance());
    }

    @Override
    protected LeastSquaresProblem getProblem(Collection<WeightedObservedPoint> observations) {
      final int len = observations.size();
      final double[] target = new double[len];
      final double[] weights = new double[len];

      int i = 0;
      for (final WeightedObservedPoint obs : observations) {
        target[i] = obs.getY();
        weights[i] = obs.getWeight();
        ++i;
      }

      final AbstractCurveFitter.TheoreticalValuesFunction model =
          new AbstractCurveFitter.TheoreticalValuesFunction(function, observations);

      return new LeastSquaresBuilder().parameterValidator(validator)
          .maxEvaluations(config.getMaxEvaluations()).maxIterations(config.getMaxIterations())
          .lazyEvaluation(false).start(initialGuess).target(target)
          .weight(new DiagonalMatrix(weights))
          .model(model.getModelFunction(), model.getModelFunctionJacobian()).build();
    }
  }
}
