package qdot.fitting.solver;

import org.apache.commons.math3.fitting.leastsquares.MultivariateJacobianFunction;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.util.Pair;
import qdot.fitting.model.ModelFunction;

/**
 * Evaluates a model over the sample points and approximates its derivatives with respect to
 * each parameter by forward differences. Steps that would leave the parameter bounds are taken
 * backwards instead.
 */
class ModelJacobian implements MultivariateJacobianFunction {

  /**
   * Relative resolution of the difference step (square root of machine epsilon)
   */
  private static final double STEP_FACTOR = Math.sqrt(Math.ulp(1.0));

  private final ModelFunction model;
  private final double[] xData;
  private final BoundsValidator validator;

  ModelJacobian(ModelFunction model, double[] xData, BoundsValidator validator) {
    this.model = model;
    this.xData = xData;
    this.validator = validator;
  }

  private static double step(double value) {
    return STEP_FACTOR * Math.max(Math.abs(value), 1.);
  }

  /**
   * Approximate derivative of the model at one point with respect to each parameter
   *
   * @param x Independent variable
   * @param parameters Point in parameter space
   * @return Partial derivatives, one per parameter
   */
  double[] gradient(double x, double[] parameters) {
    double base = model.value(x, parameters);
    double[] grad = new double[parameters.length];
    for (int j = 0; j < parameters.length; ++j) {
      double h = signedStep(j, parameters[j]);
      double[] shifted = parameters.clone();
      shifted[j] += h;
      grad[j] = (model.value(x, shifted) - base) / h;
    }
    return grad;
  }

  private double signedStep(int idx, double value) {
    double h = step(value);
    if (validator != null && validator.atUpperBound(idx, value, h)) {
      return -h;
    }
    return h;
  }

  @Override
  public Pair<RealVector, RealMatrix> value(RealVector point) {
    double[] parameters = point.toArray();
    double[] fInit = model.values(xData, parameters);

    double[][] jacobian = new double[xData.length][parameters.length];
    for (int j = 0; j < parameters.length; ++j) {
      double h = signedStep(j, parameters[j]);
      double[] shifted = parameters.clone();
      shifted[j] += h;
      double[] diffOnParam = model.values(xData, shifted);
      for (int i = 0; i < xData.length; ++i) {
        jacobian[i][j] = (diffOnParam[i] - fInit[i]) / h;
      }
    }

    RealMatrix jMat = MatrixUtils.createRealMatrix(jacobian);
    RealVector fnc = MatrixUtils.createRealVector(fInit);

    return new Pair<>(fnc, jMat);
  }
}
