package qdot.fitting.output;

import qdot.fitting.input.SampleSeries;
import qdot.fitting.model.ModelFunction;
import qdot.fitting.solver.SolverResult;

/**
 * Converts raw solver output into a {@link FitResult}. The reduced chi-squared is the sum of
 * squared residuals divided by the degrees of freedom (at least 1), and the unscaled parameter
 * covariance reported by the solver is scaled by that reduced chi-squared.
 */
public class ResultNormalizer {

  /**
   * @param model Model that was fit
   * @param initial Initial guess handed to the solver
   * @param solverResult Output of the solver
   * @return Fit result with parameters in the order of the model's schema
   */
  public static FitResult normalize(ModelFunction model, double[] initial,
      SolverResult solverResult) {
    double[] point = solverResult.getPoint();
    double redChi = reducedChiSquared(solverResult.getChiSquare(),
        solverResult.getObservations(), point.length);
    double[] covariance = solverResult.getCovarianceDiagonal();
    if (covariance != null) {
      for (int i = 0; i < covariance.length; ++i) {
        covariance[i] *= redChi;
      }
    }
    return new FitResult(model.getName(), model.getSchema(), point, initial, redChi, covariance);
  }

  /**
   * @param chiSquare Sum of squared residuals
   * @param observations Number of samples
   * @param parameters Number of free parameters
   * @return Chi-square per degree of freedom
   */
  public static double reducedChiSquared(double chiSquare, int observations, int parameters) {
    return chiSquare / Math.max(observations - parameters, 1);
  }

  /**
   * Reduced chi-squared of a model at a given parameter point, without fitting
   *
   * @param model Model to evaluate
   * @param series Data to compare against
   * @param parameters Point to evaluate at
   * @return Reduced chi-squared of the model at that point
   */
  public static double evaluate(ModelFunction model, SampleSeries series, double[] parameters) {
    double[] y = series.getY();
    double[] fit = model.values(series.getX(), parameters);
    double chiSquare = 0.;
    for (int i = 0; i < y.length; ++i) {
      double resid = y[i] - fit[i];
      chiSquare += resid * resid;
    }
    return reducedChiSquared(chiSquare, y.length, parameters.length);
  }
}
