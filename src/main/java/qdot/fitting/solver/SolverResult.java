package qdot.fitting.solver;

import org.apache.commons.math3.fitting.leastsquares.LeastSquaresOptimizer;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.log4j.Logger;

/**
 * Raw output of a least-squares solve: the best-fit point, the sum of squared residuals there,
 * and the diagonal of the unscaled parameter covariance (null when the normal matrix at the
 * optimum is singular and no covariance can be estimated).
 */
public class SolverResult {

  private static final Logger logger = Logger.getLogger(SolverResult.class);

  /**
   * Threshold below which the normal matrix is considered singular
   */
  private static final double SINGULARITY_THRESHOLD = 1E-14;

  private final double[] point;
  private final double chiSquare;
  private final int observations;
  private final double[] covarianceDiagonal;
  private final int evaluations;
  private final int iterations;

  public SolverResult(double[] point, double chiSquare, int observations,
      double[] covarianceDiagonal, int evaluations, int iterations) {
    this.point = point.clone();
    this.chiSquare = chiSquare;
    this.observations = observations;
    this.covarianceDiagonal = covarianceDiagonal == null ? null : covarianceDiagonal.clone();
    this.evaluations = evaluations;
    this.iterations = iterations;
  }

  /**
   * Collect the relevant values of an optimizer's result
   *
   * @param optimum Result of the optimizer
   * @param observations Number of samples that were fit
   * @return Result with the point, chi-square and (if available) covariance diagonal
   */
  static SolverResult fromOptimum(LeastSquaresOptimizer.Optimum optimum, int observations) {
    double[] covariance = null;
    try {
      RealMatrix covMatrix = optimum.getCovariances(SINGULARITY_THRESHOLD);
      covariance = new double[covMatrix.getRowDimension()];
      for (int i = 0; i < covariance.length; ++i) {
        covariance[i] = covMatrix.getEntry(i, i);
      }
    } catch (SingularMatrixException e) {
      logger.debug("Singular normal matrix at optimum, no covariance estimate available");
    }
    // cost is the root of the weighted sum of squared residuals
    double cost = optimum.getCost();
    return new SolverResult(optimum.getPoint().toArray(), cost * cost, observations,
        covariance, optimum.getEvaluations(), optimum.getIterations());
  }

  public double[] getPoint() {
    return point.clone();
  }

  /**
   * @return Sum of squared residuals at the best-fit point
   */
  public double getChiSquare() {
    return chiSquare;
  }

  public int getObservations() {
    return observations;
  }

  /**
   * @return Diagonal of (J^T J)^-1 at the optimum, or null if it could not be computed
   */
  public double[] getCovarianceDiagonal() {
    return covarianceDiagonal == null ? null : covarianceDiagonal.clone();
  }

  public int getEvaluations() {
    return evaluations;
  }

  public int getIterations() {
    return iterations;
  }
}
