package qdot.fitting.solver;

import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.fitting.leastsquares.ParameterValidator;
import org.apache.commons.math3.linear.RealVector;
import qdot.fitting.model.ParameterSchema;

/**
 * Keeps solver iterates within per-parameter limits. Any component that a step moves outside
 * of its bounds is put back on the bound it crossed.
 */
public class BoundsValidator implements ParameterValidator {

  private final double[] lower;
  private final double[] upper;

  /**
   * Resolve named bounds against the parameter ordering of a model
   *
   * @param schema Parameter names of the model being fit
   * @param bounds Bounds to apply; parameters with no bound are left free
   * @throws IllegalArgumentException if a bound names a parameter the model does not have
   */
  public BoundsValidator(ParameterSchema schema, List<ParameterBound> bounds) {
    lower = new double[schema.size()];
    upper = new double[schema.size()];
    Arrays.fill(lower, Double.NEGATIVE_INFINITY);
    Arrays.fill(upper, Double.POSITIVE_INFINITY);
    for (ParameterBound bound : bounds) {
      int idx = schema.indexOf(bound.getName());
      lower[idx] = Math.max(lower[idx], bound.getLower());
      upper[idx] = Math.min(upper[idx], bound.getUpper());
    }
  }

  /**
   * Clamp a plain parameter array (used for initial guesses)
   *
   * @param parameters Parameters to clamp; not modified
   * @return Copy of the parameters, within bounds
   */
  public double[] clamp(double[] parameters) {
    double[] out = parameters.clone();
    for (int i = 0; i < out.length; ++i) {
      out[i] = Math.max(lower[i], Math.min(upper[i], out[i]));
    }
    return out;
  }

  /**
   * @param idx Parameter index
   * @return True if a small step upward from the given value would leave the bounds
   */
  boolean atUpperBound(int idx, double value, double step) {
    return value + step > upper[idx];
  }

  @Override
  public RealVector validate(RealVector params) {
    for (int i = 0; i < params.getDimension(); ++i) {
      double value = params.getEntry(i);
      if (value < lower[i]) {
        params.setEntry(i, lower[i]);
      } else if (value > upper[i]) {
        params.setEntry(i, upper[i]);
      }
    }
    return params;
  }
}
